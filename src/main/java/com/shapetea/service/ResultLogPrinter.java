package com.shapetea.service;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;

import com.shapetea.context.CallFrame;
import com.shapetea.context.Context;
import com.shapetea.context.ShHeap;
import com.shapetea.context.ShValue;
import com.shapetea.context.ShValue.SVAddr;
import com.shapetea.context.ShValue.SVError;
import com.shapetea.context.ShValue.SVObject;
import com.shapetea.context.ShValue.SVSize;

/** Renders an {@link AnalysisResult} at one of the {@link AnalysisOptions.LogLevel}s. */
public final class ResultLogPrinter {

    private static final int ATTR_MAX = 8;

    private final AnalysisOptions.LogLevel level;

    public ResultLogPrinter(AnalysisOptions.LogLevel level) {
        this.level = level;
    }

    public void print(AnalysisResult result, PrintStream out) {
        String text = render(result);
        if (!text.isEmpty()) out.print(text);
    }

    public String render(AnalysisResult result) {
        StringBuilder sb = new StringBuilder();
        switch (level) {
            case NONE:
                return "";
            case RESULT_ONLY:
                resultOnly(result, sb);
                break;
            case REDUCED:
                detailed(result, sb, false);
                break;
            case FULL:
                detailed(result, sb, true);
                break;
        }
        summary(result, sb);
        return sb.toString();
    }

    // ===================== LEVELS =====================

    private void resultOnly(AnalysisResult result, StringBuilder sb) {
        List<Context<ShValue>> stopped = result.getStopped();
        for (int i = 0; i < stopped.size(); i++) {
            sb.append(" path #").append(i + 1).append(": ").append(failure(stopped.get(i))).append("\n\n");
        }
        List<Context<ShValue>> failed = result.getFailed();
        for (int i = 0; i < failed.size(); i++) {
            sb.append("failed path #").append(i + 1).append(": ").append(failure(failed.get(i))).append("\n\n");
        }
    }

    private void detailed(AnalysisResult result, StringBuilder sb, boolean full) {
        List<Context<Object>> success = result.getSuccess();
        for (int i = 0; i < success.size(); i++) {
            Context<Object> ctx = success.get(i);
            sb.append("success path #").append(i + 1).append("\n\n");
            if (full) {
                sb.append("ENV:\n").append(ctx.env).append('\n');
                sb.append("HEAP (size: ").append(ctx.heap.valMap.size()).append("):\n")
                        .append(ctx.heap.filter((addr, v) -> addr >= 0)).append('\n');
            } else {
                sb.append(reducedHeap(ctx)).append('\n');
            }
            sb.append("LOGS:\n").append(logs(ctx)).append('\n');
            sb.append("CONSTRAINTS:\n").append(ctx.ctrSet).append("\n\n");
        }
        appendDead(sb, "stopped path #", result.getStopped(), full);
        appendDead(sb, "failed path #", result.getFailed(), full);
    }

    private void appendDead(StringBuilder sb, String title, List<Context<ShValue>> paths, boolean full) {
        for (int i = 0; i < paths.size(); i++) {
            Context<ShValue> ctx = paths.get(i);
            sb.append(title).append(i + 1).append(": ").append(failure(ctx));
            if (full) sb.append(" / at ").append(ctx.relPath);
            sb.append("\n\n");
            if (full) {
                sb.append("ENV:\n").append(ctx.env).append('\n');
            } else {
                sb.append(reducedEnv(ctx)).append('\n');
            }
            sb.append("CALL STACK:\n").append(callStack(ctx)).append('\n');
            sb.append("LOGS:\n").append(logs(ctx)).append('\n');
            sb.append("CONSTRAINTS:\n").append(ctx.ctrSet).append("\n\n");
        }
    }

    private void summary(AnalysisResult result, StringBuilder sb) {
        if (result.isAborted()) {
            sb.append("analysis aborted: ").append(result.getEntryName()).append('\n');
        }
        sb.append("potential success path #: ").append(result.getSuccess().size()).append('\n');
        sb.append("potential unreachable path #: ").append(result.getStopped().size()).append('\n');
        sb.append("immediate failed path #: ").append(result.getFailed().size()).append("\n\n");
        if (level == AnalysisOptions.LogLevel.REDUCED || level == AnalysisOptions.LogLevel.FULL) {
            sb.append("RUNNING TIME: ").append(String.format("%.4f", result.getElapsedMs() / 1000.0)).append("s\n");
        }
    }

    // ===================== PIECES =====================

    private static String failure(Context<ShValue> ctx) {
        SVError err = ctx.failed;
        if (err == null) return "unknown failure";
        return err.reason + " - " + (err.source == null ? "<unknown>" : err.source.toString());
    }

    // the module object is the first non-builtin allocation
    private static String reducedHeap(Context<?> ctx) {
        ShValue module = ctx.heap.getVal(1);
        if (!(module instanceof SVObject)) return "REDUCED HEAP: (size: " + ctx.heap.valMap.size() + ")\n";
        StringBuilder sb = new StringBuilder("REDUCED HEAP: (size: ").append(ctx.heap.valMap.size()).append(")\n");
        for (Map.Entry<String, ShValue> e : ((SVObject) module).attrs.entrySet()) {
            sb.append("  ").append(e.getKey()).append(" => ").append(reducedToString(e.getValue(), ctx.heap))
                    .append('\n');
        }
        return sb.toString();
    }

    private static String reducedEnv(Context<?> ctx) {
        StringBuilder sb = new StringBuilder("REDUCED HEAP (").append(ctx.heap.valMap.size()).append("):\n");
        for (Map.Entry<String, SVAddr> e : ctx.env.addrMap.entrySet()) {
            if (e.getValue().addr < 0) continue;
            sb.append("  ").append(e.getKey()).append(" => ").append(reducedToString(e.getValue(), ctx.heap))
                    .append('\n');
        }
        return sb.toString();
    }

    private static String callStack(Context<?> ctx) {
        StringBuilder sb = new StringBuilder();
        for (int i = ctx.callStack.size() - 1; i >= 0; i--) {
            CallFrame frame = ctx.callStack.get(i);
            sb.append("  ").append(frame).append('\n');
        }
        return sb.toString();
    }

    private static String logs(Context<?> ctx) {
        StringBuilder sb = new StringBuilder();
        for (ShValue log : ctx.logs) {
            if (log instanceof SVError) {
                SVError err = (SVError) log;
                sb.append(err.level).append(": ").append(err.reason);
                if (err.source != null) sb.append(" - ").append(err.source);
            } else {
                sb.append(reducedToString(log, ctx.heap));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Short rendering of a value: tensors by shape, Size by its shape expression, other objects
     * with their storage elided past a few entries.
     */
    public static String reducedToString(ShValue value, ShHeap heap) {
        ShValue obj = heap.fetchAddr(value);
        if (obj == null) return String.valueOf(value);
        if (obj instanceof SVSize) {
            return "SVSize(" + ((SVSize) obj).shape + ")";
        }
        if (obj instanceof SVObject) {
            SVObject o = (SVObject) obj;
            ShValue shape = heap.fetchAddr(o.getAttr("shape"));
            if (shape instanceof SVSize) {
                return "tensor: " + ((SVSize) shape).shape;
            }
            String attrs = o.attrs.size() > ATTR_MAX ? "<" + o.attrs.size() + " attrs>" : o.attrs.toString();
            String indices = o.indices.size() > ATTR_MAX
                    ? "<" + o.indices.size() + " indexed values>" : o.indices.toString();
            String kvs = o.keyValues.size() > ATTR_MAX
                    ? "<" + o.keyValues.size() + " keyed values>" : o.keyValues.toString();
            String shapeStr = o.shape() != null ? ", " + o.shape() : "";
            return "[" + o.addr().addr + "]{ " + attrs + ", " + indices + ", " + kvs + shapeStr + " }";
        }
        return obj.toString();
    }
}
