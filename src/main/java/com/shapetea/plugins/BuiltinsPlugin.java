package com.shapetea.plugins;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.shapetea.constraint.ExpSimplifier;
import com.shapetea.context.Context;
import com.shapetea.context.ContextSet;
import com.shapetea.context.ShEnv;
import com.shapetea.context.ShHeap;
import com.shapetea.context.ShValue;
import com.shapetea.context.ShValue.ObjectLike;
import com.shapetea.context.ShValue.SVAddr;
import com.shapetea.context.ShValue.SVBool;
import com.shapetea.context.ShValue.SVFloat;
import com.shapetea.context.ShValue.SVFunc;
import com.shapetea.context.ShValue.SVInt;
import com.shapetea.context.ShValue.SVNone;
import com.shapetea.context.ShValue.SVObject;
import com.shapetea.context.ShValue.SVString;
import com.shapetea.debug.Debug;
import com.shapetea.interpreter.Interpreter;
import com.shapetea.interpreter.LibCallParams;
import com.shapetea.interpreter.LibCallRegistry;
import com.shapetea.interpreter.SymOps;
import com.shapetea.interpreter.SymOps.Truthiness;
import com.shapetea.ir.CodeSource;
import com.shapetea.ir.Expr;
import com.shapetea.ir.Statement;
import com.shapetea.symbolic.ExpNum;
import com.shapetea.symbolic.NumRange;
import com.shapetea.util.PMap;

/**
 * Language-level intrinsics: containers, function plumbing, attribute access, random values
 * and assertions.
 */
public final class BuiltinsPlugin {

    private BuiltinsPlugin() {}

    public static void register(LibCallRegistry registry) {
        register(registry, false, Collections.emptyMap());
    }

    public static void register(LibCallRegistry registry, boolean ignoreAssert,
                                Map<String, VariableRange> variableRanges) {
        Map<String, VariableRange> ranges = variableRanges == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(variableRanges));

        // ===================== CONTAINERS =====================

        registry.register("genList", (interp, ctx, source) ->
                ctx.genList(ctx.retVal.values(), source).toSet());

        // genDict((k, v), ...) with constant int or string keys
        registry.register("genDict", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            Context<ShValue> objCtx = ctx.genObject(source);
            SVAddr addr = (SVAddr) objCtx.retVal;
            SVObject dict = (SVObject) objCtx.heap.getVal(addr);
            ShHeap heap = objCtx.heap;

            for (ShValue param : params.values()) {
                ShValue kv = heap.fetchAddr(param);
                if (!(kv instanceof ObjectLike)) {
                    return ctx.warnWithMsg("from 'LibCall.genDict': parameter must be key-value tuple", source).toSet();
                }
                ShValue key = heap.fetchAddr(((ObjectLike) kv).getIndice(0));
                ShValue value = ((ObjectLike) kv).getIndice(1);
                if (key == null || value == null) {
                    return ctx.warnWithMsg("from 'LibCall.genDict': parameter must be key-value tuple", source).toSet();
                }
                if (key instanceof SVInt) {
                    NumRange keyRange = ctx.getCachedRange(((SVInt) key).value);
                    NumRange intRange = keyRange == null ? null : keyRange.toIntRange();
                    if (intRange != null && intRange.isConst()) {
                        dict = dict.setIndice((int) intRange.start, value);
                    }
                } else if (key instanceof SVString) {
                    String k = ctx.ctrSet.getCachedString(((SVString) key).value);
                    if (k != null) dict = dict.setKeyVal(k, value);
                }
            }
            dict = dict.setAttr("$length", SVInt.of(params.size(), source));
            return objCtx.setHeap(heap.setVal(addr, dict)).toSet();
        });

        registry.register("range", BuiltinsPlugin::range);

        // ===================== FUNCTIONS =====================

        // setDefault($func, <param>=<default>..., $varargsName, $kwargsName, $keyOnlyNum)
        registry.register("setDefault", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            ShValue funcVal = ctx.heap.fetchAddr(params.has("$func") ? params.get("$func") : params.get(0));
            if (!(funcVal instanceof SVFunc)) {
                return ctx.warnWithMsg("from 'LibCall.setDefault': $func is not a function", source).toSet();
            }
            Map<String, ShValue> defaults = new LinkedHashMap<>();
            String varargs = null;
            String kwargs = null;
            Integer keyOnly = null;
            for (int i = 0; i < params.size(); i++) {
                String name = params.name(i);
                ShValue value = params.get(i);
                if (name.isEmpty() || "$func".equals(name)) continue;
                if ("$varargsName".equals(name)) {
                    varargs = constString(ctx, value);
                } else if ("$kwargsName".equals(name)) {
                    kwargs = constString(ctx, value);
                } else if ("$keyOnlyNum".equals(name)) {
                    ShValue n = ctx.heap.fetchAddr(value);
                    if (n instanceof SVInt && ((SVInt) n).isConst()) keyOnly = (int) ((SVInt) n).constValue();
                } else {
                    defaults.put(name, value);
                }
            }
            SVFunc func = ((SVFunc) funcVal).setDefaults(PMap.of(defaults)).setVKParam(varargs, kwargs, keyOnly);
            return ctx.toSetWith((ShValue) func);
        });

        // callKV($func, args=<tuple>, <keyword>=<value>...)
        registry.register("callKV", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            ShValue callee = params.has("$func") ? params.get("$func") : params.get(0);
            if (callee == null) {
                return ctx.warnWithMsg("from 'LibCall.callKV': no function given", source).toSet();
            }
            List<ShValue> args = new ArrayList<>();
            ShValue argsObj = ctx.heap.fetchAddr(params.get("args"));
            if (argsObj instanceof ObjectLike) {
                ShValue length = ctx.heap.fetchAddr(((ObjectLike) argsObj).getAttr("$length"));
                int n = length instanceof SVInt && ((SVInt) length).isConst() ? (int) ((SVInt) length).constValue() : 0;
                for (int i = 0; i < n; i++) {
                    ShValue arg = ((ObjectLike) argsObj).getIndice(i);
                    args.add(arg == null ? SVNone.create(source) : arg);
                }
            }
            Map<String, ShValue> kwargs = new LinkedHashMap<>();
            for (int i = 0; i < params.size(); i++) {
                String name = params.name(i);
                if (name.isEmpty() || "$func".equals(name) || "args".equals(name)) continue;
                kwargs.put(name, params.get(i));
            }
            return interp.callValue(ctx, callee, args, kwargs, source);
        });

        // class object of `object` with default __init__ and __new__
        registry.register("objectClass", (interp, ctx, source) -> {
            Context<ShValue> objCtx = ctx.genObject(source);
            SVAddr addr = (SVAddr) objCtx.retVal;
            SVObject cls = (SVObject) objCtx.heap.getVal(addr);

            List<String> selfParam = Collections.singletonList("self");
            List<String> clsParam = Collections.singletonList("cls");
            SVFunc init = SVFunc.create("__init__", selfParam,
                    new Statement.Return(new Expr.Const(Expr.ConstType.NONE, null, source), source),
                    false, ShEnv.empty(), source);
            SVFunc create = SVFunc.create("__new__", clsParam,
                    new Statement.Return(new Expr.ObjectExpr(source), source), false, ShEnv.empty(), source);
            cls = cls.setAttr("__init__", init).setAttr("__new__", create);
            return objCtx.setHeap(objCtx.heap.setVal(addr, cls)).toSet();
        });

        // $module.<globalVar> = address of globalVar
        registry.register("exportGlobal", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            ShValue moduleAddr = params.has("$module") ? params.get("$module") : params.get(0);
            String globalVar = constString(ctx, params.has("globalVar") ? params.get("globalVar") : params.get(1));
            ShValue module = ctx.heap.fetchAddr(moduleAddr);
            if (!(module instanceof ObjectLike) || globalVar == null) {
                return ctx.warnWithMsg("from 'LibCall.exportGlobal': invalid module or variable name", source).toSet();
            }
            SVAddr global = ctx.env.getId(globalVar);
            if (global == null) {
                return ctx.warnWithMsg("from 'LibCall.exportGlobal': " + globalVar + " is not defined", source).toSet();
            }
            ShValue updated = (ShValue) ((ObjectLike) module).setAttr(globalVar, global);
            return ctx.setHeap(ctx.heap.setVal(((ObjectLike) module).addr(), updated)).toSetWith((ShValue) global);
        });

        // ===================== ATTRIBUTES =====================

        registry.register("getAttr", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            if (params.size() != 2) {
                return argCountWarning(ctx, "getAttr", params.size(), source);
            }
            ShValue obj = ctx.heap.fetchAddr(params.get(0));
            String attr = constString(ctx, params.get(1));
            if (attr == null) {
                return ctx.warnWithMsg("from 'LibCall.getAttr': attribute name is not a constant", source).toSet();
            }
            if (!(obj instanceof ObjectLike)) {
                return ctx.warnWithMsg("from 'LibCall.getAttr': got non-object", source).toSet();
            }
            ShValue value = ((ObjectLike) obj).getAttr(attr);
            if (value == null) {
                return ctx.warnWithMsg("from 'LibCall.getAttr': " + attr + " is not in object. return warning.", source)
                        .toSet();
            }
            return ctx.toSetWith(value);
        });

        registry.register("setAttr", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            if (params.size() != 3) {
                return argCountWarning(ctx, "setAttr", params.size(), source);
            }
            ShValue obj = ctx.heap.fetchAddr(params.get(0));
            String attr = constString(ctx, params.get(1));
            if (attr == null) {
                return ctx.warnWithMsg("from 'LibCall.setAttr': attribute name is not a constant", source).toSet();
            }
            if (!(obj instanceof ObjectLike)) {
                return ctx.warnWithMsg("from 'LibCall.setAttr': got non-object", source).toSet();
            }
            ShValue updated = (ShValue) ((ObjectLike) obj).setAttr(attr, params.get(2));
            return ctx.setHeap(ctx.heap.setVal(((ObjectLike) obj).addr(), updated))
                    .toSetWith((ShValue) SVNone.create(source));
        });

        registry.register("len", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            if (params.size() != 1) {
                return argCountWarning(ctx, "len", params.size(), source);
            }
            return interp.lenOf(ctx, params.get(0), source, true);
        });

        registry.register("isinstance", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            if (params.size() != 2) {
                return argCountWarning(ctx, "isinstance", params.size(), source);
            }
            ShValue cls = params.get(1);
            if (!(cls instanceof SVAddr) || ctx.heap.fetchAddr(params.get(0)) == null) {
                return ctx.warnWithMsg("from 'LibCall.isinstance': got invalid address", source).toSet();
            }
            boolean result = Interpreter.isInstanceOf(params.get(0), (SVAddr) cls, ctx.heap, ctx.env);
            return ctx.toSetWith((ShValue) SVBool.of(result, source));
        });

        // ===================== RANDOM =====================

        registry.register("randInt", (interp, ctx, source) -> randNumber(ctx, ranges, false, source));
        registry.register("randFloat", (interp, ctx, source) -> randNumber(ctx, ranges, true, source));

        // ===================== DIAGNOSTICS =====================

        registry.register("DEBUG", (interp, ctx, source) -> {
            ShValue raw = ctx.retVal.get(0);
            ShValue value = raw == null ? null : ctx.heap.fetchAddr(raw);
            Debug.get().i(Debug.TAG_LIBCALL, "DEBUG: " + value);
            ShValue logged = value != null ? value : (raw != null ? raw : SVNone.create(source));
            return ctx.addLogValue(logged).toSetWith((ShValue) SVNone.create(source));
        });

        registry.register("raise", (interp, ctx, source) -> {
            ShValue raisedAddr = ctx.retVal.has("value") ? ctx.retVal.get("value") : ctx.retVal.get(0);
            ShValue raised = ctx.heap.fetchAddr(raisedAddr);
            if (!(raised instanceof ObjectLike)) {
                return ctx.failToSet("TypeError: exceptions must derive from BaseException", source);
            }
            return interp.getAttrDeep(ctx, raisedAddr, "__name__", source).flatMap(nc -> {
                String errType = constString(nc, nc.retVal);
                if (errType == null) {
                    return nc.<ShValue>failToSet("TypeError: exceptions must derive from BaseException", source);
                }
                return interp.getAttrDeep(nc, raisedAddr, "args", source).flatMap(ac -> {
                    String errMsg = "";
                    ShValue args = ac.heap.fetchAddr(ac.retVal);
                    if (args instanceof ObjectLike) {
                        ShValue msg = ac.heap.fetchAddr(((ObjectLike) args).getIndice(0));
                        if (msg instanceof SVString) {
                            errMsg = ": " + ((SVString) msg).value;
                        }
                    }
                    return ac.<ShValue>failToSet(errType + errMsg, source);
                });
            });
        });

        registry.register("assert", (interp, ctx, source) -> {
            if (ignoreAssert) {
                return ctx.toSetWith((ShValue) SVNone.create(source));
            }
            LibCallParams params = ctx.retVal;
            ShValue cond = params.get(0);
            if (cond == null) {
                return argCountWarning(ctx, "assert", 0, source);
            }
            String msg = constString(ctx, params.get(1));
            String failMsg = msg == null ? "assertion failed" : "assertion failed: " + msg;

            Truthiness truth = SymOps.isTruthy(ctx, cond, source);
            if (truth.isDecided()) {
                if (!truth.decided) {
                    return ctx.failToSet(failMsg, source);
                }
                return ctx.toSetWith((ShValue) SVNone.create(source));
            }
            return ctx.require(truth.constraint, failMsg, source).returnValue((ShValue) SVNone.create(source));
        });

        registry.register("warn", (interp, ctx, source) -> {
            String msg = constString(ctx, ctx.retVal.get(0));
            return ctx.warnWithMsg(msg == null ? "Explicit warn called" : msg, source).toSet();
        });

        registry.register("exit", (interp, ctx, source) ->
                ctx.failToSet("explicit process exit function call", source));
    }

    // ===================== HELPERS =====================

    static ContextSet<ShValue> argCountWarning(Context<?> ctx, String name, int count, CodeSource source) {
        return ctx.warnWithMsg("from 'LibCall." + name + "': got insufficient number of argument: " + count, source)
                .toSet();
    }

    /** Constant string behind {@code value}, or null. */
    static String constString(Context<?> ctx, ShValue value) {
        if (value == null) return null;
        ShValue fetched = ctx.heap.fetchAddr(value);
        if (!(fetched instanceof SVString)) return null;
        return ctx.ctrSet.getCachedString(((SVString) fetched).value);
    }

    static ExpNum numValue(ShValue value) {
        if (value instanceof SVInt) return ((SVInt) value).value;
        if (value instanceof SVFloat) return ((SVFloat) value).value;
        return null;
    }

    private static ShValue numOf(boolean isFloat, ExpNum value, CodeSource source) {
        return isFloat ? SVFloat.of(value, source) : SVInt.of(value, source);
    }

    /**
     * randInt(a, b, prefix) is inclusive on both ends, randFloat(a, b, prefix) excludes b. A
     * configured range for the prefix replaces the bounds.
     */
    private static ContextSet<ShValue> randNumber(Context<LibCallParams> ctx, Map<String, VariableRange> ranges,
                                                  boolean isFloat, CodeSource source) {
        String name = isFloat ? "randFloat" : "randInt";
        LibCallParams params = ctx.retVal;
        if (params.size() != 3) {
            return argCountWarning(ctx, name, params.size(), source);
        }
        String prefix = constString(ctx, params.get(2));
        if (prefix == null) prefix = name;

        VariableRange range = ranges.get(prefix);
        if (range != null) {
            Debug.get().d(Debug.TAG_LIBCALL, name + ": variable range " + range + " for " + prefix);
            if (range.isFixed()) {
                return ctx.toSetWith(numOf(isFloat, ExpNum.fromConst(range.fixedValue(), source), source));
            }
            Context<?> symCtx;
            ExpNum num;
            if (range.lower() != null) {
                Context<ExpNum> gte = isFloat
                        ? ctx.genFloatGte(prefix, ExpNum.fromConst(range.lower(), source), source)
                        : ctx.genIntGte(prefix, range.lower(), source);
                num = gte.retVal;
                symCtx = gte;
            } else {
                num = ExpNum.fromSymbol(isFloat ? ctx.genSymFloat(prefix, source) : ctx.genSymInt(prefix, source));
                symCtx = ctx;
            }
            if (range.upper() != null) {
                symCtx = symCtx.guarantee(symCtx.genLte(num, range.upper(), source));
            }
            return symCtx.toSetWith(numOf(isFloat, num, source));
        }

        ExpNum a = numValue(ctx.heap.fetchAddr(params.get(0)));
        ExpNum b = numValue(ctx.heap.fetchAddr(params.get(1)));
        if (a == null) {
            return ctx.warnWithMsg("from 'LibCall." + name + "': value a is non-numeric", source).toSet();
        }
        if (b == null) {
            return ctx.warnWithMsg("from 'LibCall." + name + "': value b is non-numeric", source).toSet();
        }
        if (a.equals(b)) {
            return ctx.toSetWith(numOf(isFloat, a, source));
        }

        return ctx.require(ctx.genLte(a, b, source),
                "from 'LibCall." + name + "': min value is greater than max value.", source).flatMap(c -> {
            Context<ExpNum> gte = isFloat ? c.genFloatGte(prefix(params, c, name), a, source)
                    : c.genIntGte(prefix(params, c, name), a, source);
            ExpNum num = gte.retVal;
            Context<ExpNum> bounded = isFloat
                    ? gte.guarantee(gte.genLt(num, b, source))
                    : gte.guarantee(gte.genLte(num, b, source));
            return bounded.toSetWith(numOf(isFloat, num, source));
        });
    }

    private static String prefix(LibCallParams params, Context<?> ctx, String fallback) {
        String prefix = constString(ctx, params.get(2));
        return prefix == null ? fallback : prefix;
    }

    /**
     * range(stop), range(start, stop) or range(start, stop, step). The result exposes
     * {@code $length}, {@code $start} and {@code $step}; items are materialized when the
     * length is a constant.
     */
    private static ContextSet<ShValue> range(Interpreter interp, Context<LibCallParams> ctx, CodeSource source) {
        LibCallParams params = ctx.retVal;
        if (params.size() < 1 || params.size() > 3) {
            return argCountWarning(ctx, "range", params.size(), source);
        }
        List<ExpNum> nums = new ArrayList<>(params.size());
        for (ShValue v : params.values()) {
            ShValue fetched = ctx.heap.fetchAddr(v);
            if (fetched instanceof SVBool && ((SVBool) fetched).isConst()) {
                nums.add(ExpNum.fromConst(((SVBool) fetched).constValue() ? 1 : 0, source));
            } else if (fetched instanceof SVInt) {
                nums.add(((SVInt) fetched).value);
            } else {
                return ctx.warnWithMsg("from 'LibCall.range': argument is not an integer: got "
                        + ShValue.typeName(fetched), source).toSet();
            }
        }

        ExpNum start = nums.size() == 1 ? ExpNum.fromConst(0, source) : nums.get(0);
        ExpNum stop = nums.size() == 1 ? nums.get(0) : nums.get(1);
        ExpNum step = nums.size() == 3 ? nums.get(2) : ExpNum.fromConst(1, source);

        NumRange stepRange = ctx.getCachedRange(step);
        if (stepRange != null && stepRange.isConst() && stepRange.start == 0) {
            return ctx.failToSet("ValueError: range() arg 3 must not be zero", source);
        }

        Context<?> lenCtx = ctx;
        ExpNum length;
        ExpNum span = ExpNum.bop(ExpNum.BopType.SUB, stop, start, source);
        NumRange spanRange = ctx.getCachedRange(span);
        if (stepRange != null && stepRange.isConst() && spanRange != null && spanRange.isConst()) {
            double k = stepRange.start;
            length = ExpNum.fromConst(Math.max(0, Math.ceil(spanRange.start / k)), source);
        } else if (stepRange != null && stepRange.isConst() && stepRange.start == 1) {
            if (spanRange != null && Boolean.TRUE.equals(spanRange.gte(0))) {
                length = span;
            } else {
                List<ExpNum> candidates = new ArrayList<>(2);
                candidates.add(ExpNum.fromConst(0, source));
                candidates.add(span);
                length = ExpNum.max(candidates, source);
            }
        } else {
            Context<ExpNum> sym = ctx.genIntGte("range$len", 0, source);
            length = sym.retVal;
            lenCtx = sym.addLog("WARNING: length of range with symbolic step is not tracked", source);
        }
        length = ExpSimplifier.simplifyNum(lenCtx.ctrSet, length);

        Context<ShValue> objCtx = lenCtx.genObject(source);
        SVAddr addr = (SVAddr) objCtx.retVal;
        SVObject obj = (SVObject) objCtx.heap.getVal(addr);
        obj = obj.setAttr("$length", SVInt.of(length, source))
                .setAttr("$start", SVInt.of(start, source))
                .setAttr("$step", SVInt.of(step, source));

        NumRange lenRange = objCtx.getCachedRange(length);
        if (lenRange != null && lenRange.isConst()) {
            for (int i = 0; i < (int) lenRange.start; i++) {
                ExpNum item = ExpNum.bop(ExpNum.BopType.ADD, start,
                        ExpNum.bop(ExpNum.BopType.MUL, step, i, source), source);
                obj = obj.setIndice(i, SVInt.of(
                        ExpSimplifier.simplifyNum(objCtx.ctrSet, item), source));
            }
        }
        return objCtx.setHeap(objCtx.heap.setVal(addr, obj)).toSet();
    }
}
