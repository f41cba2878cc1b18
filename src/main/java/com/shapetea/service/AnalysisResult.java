package com.shapetea.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.shapetea.constraint.ConstraintJson;
import com.shapetea.context.Context;
import com.shapetea.context.ContextSet;
import com.shapetea.context.ShValue;

/**
 * Outcome of one entry: live paths (potential successes), failed paths (reached without any
 * path condition) and stopped paths (failures guarded by a path condition).
 */
public final class AnalysisResult {

    private final String entryName;
    private final List<Context<Object>> success;
    private final List<Context<ShValue>> failed;
    private final List<Context<ShValue>> stopped;
    private final boolean aborted;
    private final long elapsedMs;

    AnalysisResult(String entryName, ContextSet<Object> result, long elapsedMs) {
        this(entryName, result.getList(), result.getFailed(), result.getStopped(), false, elapsedMs);
    }

    private AnalysisResult(String entryName, List<Context<Object>> success, List<Context<ShValue>> failed,
                           List<Context<ShValue>> stopped, boolean aborted, long elapsedMs) {
        this.entryName = entryName;
        this.success = Collections.unmodifiableList(new ArrayList<>(success));
        this.failed = Collections.unmodifiableList(new ArrayList<>(failed));
        this.stopped = Collections.unmodifiableList(new ArrayList<>(stopped));
        this.aborted = aborted;
        this.elapsedMs = elapsedMs;
    }

    static AnalysisResult aborted(String entryName, long elapsedMs) {
        return new AnalysisResult(entryName, Collections.emptyList(), Collections.emptyList(),
                Collections.emptyList(), true, elapsedMs);
    }

    public String getEntryName() { return entryName; }
    public List<Context<Object>> getSuccess() { return success; }
    public List<Context<ShValue>> getFailed() { return failed; }
    public List<Context<ShValue>> getStopped() { return stopped; }

    /** True when an engine exception was routed to an {@link AnalysisErrorReporter}. */
    public boolean isAborted() { return aborted; }

    public long getElapsedMs() { return elapsedMs; }

    /** No failed path. Stopped paths still need an external solver to be ruled out. */
    public boolean hasNoImmediateFailure() {
        return !aborted && failed.isEmpty();
    }

    /**
     * Constraint documents of every live and stopped path, as a JSON array. Failed paths are
     * left out: they need no solver.
     */
    public String exportConstraintJson() {
        List<String> docs = new ArrayList<>();
        for (Context<Object> ctx : success) docs.add(ConstraintJson.toJson(ctx.ctrSet));
        for (Context<ShValue> ctx : stopped) docs.add(ConstraintJson.toJson(ctx.ctrSet));
        return "[\n" + String.join(",\n", docs) + "\n]";
    }

    @Override
    public String toString() {
        return "AnalysisResult{" + entryName + ": success=" + success.size() + ", stopped=" + stopped.size()
                + ", failed=" + failed.size() + (aborted ? ", aborted" : "") + "}";
    }
}
