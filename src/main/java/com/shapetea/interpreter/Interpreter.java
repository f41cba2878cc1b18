package com.shapetea.interpreter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.shapetea.constraint.CSResult;
import com.shapetea.constraint.ExpSimplifier;
import com.shapetea.context.CallFrame;
import com.shapetea.context.Context;
import com.shapetea.context.ContextSet;
import com.shapetea.context.ShContFlag;
import com.shapetea.context.ShEnv;
import com.shapetea.context.ShHeap;
import com.shapetea.context.ShValue;
import com.shapetea.context.ShValue.ObjectLike;
import com.shapetea.context.ShValue.SVAddr;
import com.shapetea.context.ShValue.SVBool;
import com.shapetea.context.ShValue.SVError;
import com.shapetea.context.ShValue.SVFloat;
import com.shapetea.context.ShValue.SVFunc;
import com.shapetea.context.ShValue.SVInt;
import com.shapetea.context.ShValue.SVNone;
import com.shapetea.context.ShValue.SVNotImpl;
import com.shapetea.context.ShValue.SVObject;
import com.shapetea.context.ShValue.SVString;
import com.shapetea.context.ShValue.SVUndef;
import com.shapetea.debug.Debug;
import com.shapetea.interpreter.SymOps.Truthiness;
import com.shapetea.ir.CodeSource;
import com.shapetea.ir.Expr;
import com.shapetea.ir.Expr.BinOpType;
import com.shapetea.ir.Expr.ExprNode;
import com.shapetea.ir.Expr.ExprVisitor;
import com.shapetea.ir.Expr.UnaryOpType;
import com.shapetea.ir.Statement;
import com.shapetea.ir.Statement.Stmt;
import com.shapetea.ir.Statement.StmtVisitor;
import com.shapetea.symbolic.ExpBool;
import com.shapetea.symbolic.ExpNum;
import com.shapetea.symbolic.NumRange;

/**
 * Symbolic interpreter over the IR. Every step maps one context to a set of contexts, so
 * branching conditions fork paths instead of picking one.
 *
 * <p>Statements leave either a {@link ShContFlag} (fell through, continue, break) or a
 * {@link ShValue} (returned) as the result value. Expressions leave a {@link ShValue}.
 */
public final class Interpreter {

    private static final String TMP_SUFFIX = "$TMP$";
    private static final String ITER_PREFIX = "$iter$";

    private final LibCallRegistry libCalls;

    public Interpreter(LibCallRegistry libCalls) {
        this.libCalls = libCalls;
    }

    public LibCallRegistry libCalls() {
        return libCalls;
    }

    private static Context<Object> widen(Context<?> ctx) {
        return ctx.setRetVal((Object) ctx.retVal);
    }

    private static ContextSet<Object> widen(ContextSet<?> set) {
        return set.asObjects();
    }

    // ===================== ENTRY POINTS =====================

    public <T> ContextSet<Object> run(ContextSet<T> ctxSet, Stmt stmt) {
        return ctxSet.flatMap(ctx -> run(ctx, stmt));
    }

    public ContextSet<Object> run(Context<?> ctx, Stmt stmt) {
        return stmt.accept(new StmtRunner(widen(ctx)));
    }

    public <T> ContextSet<ShValue> evaluate(ContextSet<T> ctxSet, ExprNode expr) {
        return ctxSet.flatMap(ctx -> evaluate(ctx, expr));
    }

    /**
     * Evaluates {@code expr}. The result is sanitized: address chains collapse to the value
     * they point at unless that value is an object.
     */
    public ContextSet<ShValue> evaluate(Context<?> ctx, ExprNode expr) {
        return expr.accept(new ExprEvaluator(widen(ctx))).map(c -> {
            if (c.retVal == null) return c;
            ShValue sanitized = c.heap.sanitizeAddr(c.retVal);
            if (sanitized == null) {
                return c.warnWithMsg("dangling address " + c.retVal, expr.source());
            }
            return c.setRetVal(sanitized);
        });
    }

    /** Evaluates {@code exprs} left to right, threading each path through the next argument. */
    public ContextSet<List<ShValue>> evalAll(Context<?> ctx, List<ExprNode> exprs) {
        ContextSet<List<ShValue>> acc = widen(ctx).toSetWith(Collections.<ShValue>emptyList());
        for (ExprNode expr : exprs) {
            acc = acc.flatMap(c -> {
                List<ShValue> prefix = c.retVal;
                return evaluate(c, expr).map(ec -> {
                    List<ShValue> next = new ArrayList<>(prefix);
                    next.add(ec.retVal);
                    return ec.setRetVal((List<ShValue>) next);
                });
            });
        }
        return acc;
    }

    /**
     * Runs a module of the form {@code let $module = object in body}. Every attribute the body
     * leaves on the module object becomes a name of the resulting environment. The result
     * value is the module address.
     */
    public ContextSet<ShValue> runModule(Context<?> ctx, Statement.Let module, String relPath) {
        CodeSource source = module.source();
        Context<Object> base = relPath == null ? widen(ctx) : widen(ctx).setRelPath(relPath);
        ShEnv envOrigin = base.env;
        Debug.get().d(Debug.TAG_INTERP, "running module " + module.name
                + (relPath == null ? "" : " (" + relPath + ")"));

        ContextSet<ShValue> moduleSet = module.expr == null
                ? base.toSetWith((ShValue) SVUndef.create(source))
                : evaluate(base, module.expr);

        return moduleSet.flatMap(c -> {
            ShValue moduleAddr = c.retVal;
            if (!(moduleAddr instanceof SVAddr)) {
                return c.<ShValue>failToSet("module " + module.name + " is not an object", source);
            }
            ShHeap.Allocated slot = c.heap.allocNew(moduleAddr, source);
            Context<ShValue> scoped = c.setEnv(c.env.setId(module.name, slot.addr)).setHeap(slot.heap);

            return run(scoped, module.scope).map(rc -> {
                ShValue moduleObj = rc.heap.fetchAddr(moduleAddr);
                ShEnv env = envOrigin;
                ShHeap heap = rc.heap;
                if (moduleObj instanceof SVObject) {
                    for (Map.Entry<String, ShValue> e : ((SVObject) moduleObj).attrs.entrySet()) {
                        if (e.getValue() instanceof SVAddr) {
                            env = env.setId(e.getKey(), (SVAddr) e.getValue());
                        } else {
                            ShHeap.Allocated a = heap.allocNew(e.getValue(), source);
                            heap = a.heap;
                            env = env.setId(e.getKey(), a.addr);
                        }
                    }
                }
                ShHeap.Allocated notImpl = heap.allocNew(SVNotImpl.create("implicit NotImplemented", source), source);
                env = env.setId("NotImplemented", notImpl.addr);
                return rc.setEnv(env).setHeap(notImpl.heap).setRetVal(moduleAddr);
            });
        });
    }

    /**
     * Runs the builtin module and shifts its heap to negative addresses, so that user code
     * allocates from zero on top of it.
     */
    public ContextSet<ShValue> runBuiltin(Context<?> ctx, Statement.Let builtin) {
        return runModule(ctx, builtin, null).map(Context::asDefault);
    }

    // ===================== STATEMENTS =====================

    private final class StmtRunner implements StmtVisitor<ContextSet<Object>> {
        private final Context<Object> ctx;

        StmtRunner(Context<Object> ctx) {
            this.ctx = ctx;
        }

        @Override
        public ContextSet<Object> visitPass(Statement.Pass stmt) {
            return ctx.<Object>toSetWith(ShContFlag.RUN);
        }

        @Override
        public ContextSet<Object> visitExprStmt(Statement.ExprStmt stmt) {
            return evaluate(ctx, stmt.expr).map(c -> c.<Object>setRetVal(ShContFlag.RUN));
        }

        @Override
        public ContextSet<Object> visitSeq(Statement.Seq stmt) {
            return run(ctx, stmt.left).flatMap(c -> c.retVal == ShContFlag.RUN ? run(c, stmt.right) : c.toSet());
        }

        @Override
        public ContextSet<Object> visitAssign(Statement.Assign stmt) {
            return runAssign(ctx, stmt);
        }

        @Override
        public ContextSet<Object> visitIf(Statement.If stmt) {
            return runIf(ctx, stmt);
        }

        @Override
        public ContextSet<Object> visitForIn(Statement.ForIn stmt) {
            return runForIn(ctx, stmt);
        }

        @Override
        public ContextSet<Object> visitReturn(Statement.Return stmt) {
            return widen(evaluate(ctx, stmt.expr));
        }

        @Override
        public ContextSet<Object> visitContinue(Statement.Continue stmt) {
            return ctx.<Object>toSetWith(ShContFlag.CNT);
        }

        @Override
        public ContextSet<Object> visitBreak(Statement.Break stmt) {
            return ctx.<Object>toSetWith(ShContFlag.BRK);
        }

        @Override
        public ContextSet<Object> visitLet(Statement.Let stmt) {
            ShEnv envOrigin = ctx.env;
            ContextSet<ShValue> valueSet = stmt.expr == null
                    ? ctx.toSetWith((ShValue) SVUndef.create(stmt.source()))
                    : evaluate(ctx, stmt.expr);
            return valueSet.flatMap(c -> {
                ShHeap.Allocated a = c.heap.allocNew(c.retVal, stmt.source());
                return run(c.setEnv(c.env.setId(stmt.name, a.addr)).setHeap(a.heap), stmt.scope);
            }).map(c -> c.setEnv(envOrigin));
        }

        @Override
        public ContextSet<Object> visitFunDef(Statement.FunDef stmt) {
            ShEnv envOrigin = ctx.env;
            SVFunc func = SVFunc.create(stmt.name, stmt.params, stmt.body, stmt.hasClosure, ctx.env, stmt.source());
            ShHeap.Allocated a = ctx.heap.allocNew(func, stmt.source());
            return run(ctx.setEnv(ctx.env.setId(stmt.name, a.addr)).setHeap(a.heap), stmt.scope)
                    .map(c -> c.setEnv(envOrigin));
        }
    }

    private static Context<Object> warnRun(Context<?> ctx, String message, CodeSource source) {
        return ctx.warnWithMsg(message, source).<Object>setRetVal(ShContFlag.RUN);
    }

    private ContextSet<Object> runAssign(Context<Object> ctx, Statement.Assign stmt) {
        CodeSource source = stmt.source();
        ExprNode left = stmt.left;

        if (left instanceof Expr.Name) {
            String name = ((Expr.Name) left).ident;
            SVAddr lvalAddr = ctx.env.getId(name);
            if (lvalAddr == null) {
                return ctx.failToSet("address not found at id " + name, source);
            }

            // temporaries produced by the frontend are moved, not copied
            if (stmt.right instanceof Expr.Name && ((Expr.Name) stmt.right).ident.endsWith(TMP_SUFFIX)) {
                String tmpName = ((Expr.Name) stmt.right).ident;
                SVAddr tmpAddr = ctx.env.getId(tmpName);
                if (tmpAddr == null) {
                    return ctx.failToSet("name '" + tmpName + "' does not exist.", source);
                }
                ShValue moved = ctx.heap.getVal(tmpAddr);
                ShHeap heap = ctx.heap.free(tmpAddr).setVal(lvalAddr, moved == null ? SVUndef.create(source) : moved);
                return ctx.setHeap(heap).setEnv(ctx.env.removeId(tmpName)).<Object>toSetWith(ShContFlag.RUN);
            }

            return evaluate(ctx, stmt.right).map(c ->
                    c.setHeap(c.heap.setVal(lvalAddr, c.retVal)).<Object>setRetVal(ShContFlag.RUN));
        }

        if (left instanceof Expr.Attr) {
            Expr.Attr attr = (Expr.Attr) left;
            return evaluate(ctx, attr.left).flatMap(lc -> {
                ShValue lhs = lc.retVal;
                if (lhs instanceof SVError) {
                    return lc.<Object>toSetWith(ShContFlag.RUN);
                }
                if (!(lhs instanceof SVAddr)) {
                    return lc.<Object>failToSet(ShValue.typeName(lhs) + " is not an address", source);
                }
                SVAddr objAddr = (SVAddr) lhs;
                return evaluate(lc, stmt.right).flatMap(rc -> {
                    ShValue obj = rc.heap.getValRecur(objAddr);
                    if (!(obj instanceof ObjectLike)) {
                        return rc.<Object>failToSet("object not found at address " + objAddr, source);
                    }
                    ShValue updated = (ShValue) ((ObjectLike) obj).setAttr(attr.right, rc.retVal);
                    SVAddr target = ((ObjectLike) obj).addr();
                    return rc.setHeap(rc.heap.setVal(target, updated)).<Object>toSetWith(ShContFlag.RUN);
                });
            });
        }

        if (left instanceof Expr.Subscr) {
            Expr.Subscr subscr = (Expr.Subscr) left;
            return evaluate(ctx, subscr.left).flatMap(oc -> {
                ShValue objAddr = oc.retVal;
                return evaluate(oc, subscr.right).flatMap(ic -> {
                    ShValue index = ic.retVal;
                    return evaluate(ic, stmt.right).flatMap(vc -> assignSubscr(vc, objAddr, index, vc.retVal, source));
                });
            });
        }

        return ctx.failToSet("cannot reach here: invalid assignment target " + left, source);
    }

    private ContextSet<Object> assignSubscr(Context<ShValue> ctx, ShValue objAddr, ShValue index, ShValue value,
                                            CodeSource source) {
        ShValue obj = ctx.heap.fetchAddr(objAddr);
        if (!(obj instanceof ObjectLike)) {
            return warnRun(ctx, "__setitem__: target is not an object", source).toSet();
        }

        return lookupAttr(ctx, obj, "__setitem__", source, false).flatMap(sc -> {
            if (sc.retVal instanceof SVFunc) {
                List<ShValue> args = new ArrayList<>();
                args.add(index);
                args.add(value);
                return functionCall(sc, (SVFunc) sc.retVal, args, source)
                        .map(c -> c.<Object>setRetVal(ShContFlag.RUN));
            }
            ShValue idx = sc.heap.fetchAddr(index);
            if (idx instanceof SVString) {
                String key = sc.ctrSet.getCachedString(((SVString) idx).value);
                if (key == null) {
                    return sc.addLog("__setitem__: key is not a constant string", source)
                            .<Object>toSetWith(ShContFlag.RUN);
                }
                ShValue updated = (ShValue) ((ObjectLike) obj).setKeyVal(key, value);
                return sc.setHeap(sc.heap.setVal(((ObjectLike) obj).addr(), updated)).<Object>toSetWith(ShContFlag.RUN);
            }
            if (!(idx instanceof SVInt)) {
                return warnRun(sc, "__setitem__ index " + idx + " is not a number", source).toSet();
            }
            NumRange range = sc.getCachedRange(((SVInt) idx).value);
            if (range == null || !range.isConst()) {
                return sc.addLog("__setitem__: symbolic index " + idx + " is not tracked", source)
                        .<Object>toSetWith(ShContFlag.RUN);
            }
            int i = (int) range.start;
            if (i < 0) {
                ShValue length = sc.heap.fetchAddr(((ObjectLike) obj).getAttr("$length"));
                if (length instanceof SVInt && ((SVInt) length).isConst()) {
                    i += (int) ((SVInt) length).constValue();
                }
            }
            ShValue updated = (ShValue) ((ObjectLike) obj).setIndice(i, value);
            return sc.setHeap(sc.heap.setVal(((ObjectLike) obj).addr(), updated)).<Object>toSetWith(ShContFlag.RUN);
        });
    }

    /** True for expressions that neither fail nor touch the heap when dropped. */
    private static boolean isSilentExpr(ExprNode expr) {
        return expr instanceof Expr.Const || expr instanceof Expr.Name || expr instanceof Expr.ObjectExpr;
    }

    private static boolean isTrivialStmt(Stmt stmt) {
        if (stmt instanceof Statement.Pass) return true;
        if (stmt instanceof Statement.ExprStmt) return isSilentExpr(((Statement.ExprStmt) stmt).expr);
        if (stmt instanceof Statement.Seq) {
            Statement.Seq seq = (Statement.Seq) stmt;
            return isTrivialStmt(seq.left) && isTrivialStmt(seq.right);
        }
        return false;
    }

    private ContextSet<Object> runIf(Context<Object> ctx, Statement.If stmt) {
        ExprNode cond = stmt.cond;
        if ((cond instanceof Expr.Const || cond instanceof Expr.Name)
                && isTrivialStmt(stmt.thenStmt) && isTrivialStmt(stmt.elseStmt)) {
            return ctx.<Object>toSetWith(ShContFlag.RUN);
        }

        return evaluate(ctx, cond).flatMap(c -> {
            Truthiness truth = SymOps.isTruthy(c, c.retVal, cond.source());
            if (truth.isDecided()) {
                return run(c, truth.decided ? stmt.thenStmt : stmt.elseStmt);
            }
            ContextSet.Branches<ShValue> branches = c.ifThenElse(truth.constraint, cond.source());
            return run(branches.thenSet, stmt.thenStmt).join(run(branches.elseSet, stmt.elseStmt));
        });
    }

    // ===================== LOOPS =====================

    private static Context<Object> flagToRun(Context<Object> ctx) {
        return ctx.retVal instanceof ShContFlag ? ctx.setRetVal(ShContFlag.RUN) : ctx;
    }

    private ContextSet<Object> runForIn(Context<Object> ctx, Statement.ForIn stmt) {
        CodeSource source = stmt.source();
        ShEnv envOrigin = ctx.env;

        return evaluate(ctx, stmt.loopVal).flatMap(vc -> {
            ShValue loopAddr = vc.retVal;
            ShValue loopObj = vc.heap.fetchAddr(loopAddr);
            if (!(loopObj instanceof ObjectLike)) {
                return warnRun(vc, "loop value is not an object: got " + ShValue.typeName(loopObj), source).toSet();
            }

            return lenOf(vc, loopAddr, source, false).flatMap(lc -> {
                ShValue len = lc.heap.fetchAddr(lc.retVal);
                Context<ShValue> lenCtx;
                ExpNum length;
                if (len == null || len instanceof SVError || len instanceof SVNotImpl) {
                    Context<ExpNum> sym = lc.genIntGte("for$len", 0, source);
                    length = sym.retVal;
                    lenCtx = sym.addLog("WARNING: loop length is not an int type: got " + ShValue.typeName(len)
                            + ". use symbolic length", source).setRetVal(lc.retVal);
                } else if (len instanceof SVInt) {
                    length = ((SVInt) len).value;
                    lenCtx = lc;
                } else {
                    return lc.<Object>failToSet("loop length is not an int type: got " + ShValue.typeName(len), source);
                }

                ShHeap.Allocated identSlot = lenCtx.heap.malloc(source);
                Context<Object> loopCtx = lenCtx.setEnv(lenCtx.env.setId(stmt.ident, identSlot.addr))
                        .setHeap(identSlot.heap).<Object>setRetVal(ShContFlag.RUN);

                NumRange lenRange = lenCtx.getCachedRange(length);
                ContextSet<Object> result;
                if (lenRange != null && lenRange.isConst() && lenRange.start >= 0) {
                    result = runConstLoop(loopCtx, stmt, loopAddr, identSlot.addr, (int) lenRange.start);
                } else {
                    result = runSymbolicLoop(loopCtx, stmt, loopAddr, identSlot.addr, length);
                }
                return result.map(c -> c.setEnv(envOrigin));
            });
        });
    }

    private boolean usesIterProtocol(Context<?> ctx, ShValue loopAddr) {
        ShValue obj = ctx.heap.fetchAddr(loopAddr);
        if (!(obj instanceof SVObject) || ((SVObject) obj).getAttr("$length") != null) {
            return false;
        }
        return findMroAttr(ctx, obj, "__iter__") != null;
    }

    private ContextSet<Object> runConstLoop(Context<Object> ctx, Statement.ForIn stmt, ShValue loopAddr,
                                            SVAddr identAddr, int count) {
        CodeSource source = stmt.source();
        String iterName = ITER_PREFIX + stmt.ident;
        boolean iterProtocol = usesIterProtocol(ctx, loopAddr);

        ContextSet<Object> running = ctx.toSet();
        if (iterProtocol) {
            running = running.flatMap(c -> callMethod(c, loopAddr, "__iter__", Collections.emptyList(), source)
                    .map(ic -> {
                        ShHeap.Allocated a = ic.heap.allocNew(ic.retVal, source);
                        return ic.setEnv(ic.env.setId(iterName, a.addr)).setHeap(a.heap).<Object>setRetVal(ShContFlag.RUN);
                    }));
        }

        ContextSet<Object> exited = ContextSet.empty(ctx.session());
        for (int i = 0; i < count && !running.isEmpty(); i++) {
            final int index = i;
            running = running.flatMap(c -> {
                ContextSet<ShValue> item;
                if (iterProtocol) {
                    ShValue iterator = c.heap.getVal(c.env.getId(iterName));
                    item = callMethod(c, iterator, "__next__", Collections.emptyList(), source);
                } else {
                    item = getIndiceDeep(c, loopAddr, ExpNum.fromConst(index, source), source);
                }
                return item.map(ic -> ic.setHeap(ic.heap.setVal(identAddr, ic.retVal)).<Object>setRetVal(ShContFlag.RUN));
            });
            running = run(running, stmt.loopBody);
            exited = exited.join(running.filter(c -> c.retVal != ShContFlag.RUN && c.retVal != ShContFlag.CNT));
            running = running.filter(c -> c.retVal == ShContFlag.RUN || c.retVal == ShContFlag.CNT);
        }

        return running.join(exited).map(Interpreter::flagToRun);
    }

    private ContextSet<Object> runSymbolicLoop(Context<Object> ctx, Statement.ForIn stmt, ShValue loopAddr,
                                               SVAddr identAddr, ExpNum length) {
        CodeSource source = stmt.source();
        Debug.get().d(Debug.TAG_INTERP, "symbolic loop over " + stmt.ident + " with length " + length);

        return ctx.require(ctx.genLte(0, length, source), "length of iterator is less than 0", source)
                .flatMap(c -> {
                    Context<ExpNum> idxCtx = c.genIntGte("for$" + stmt.ident, 0, source);
                    ExpNum idx = idxCtx.retVal;
                    Context<ExpNum> bounded = idxCtx.guarantee(
                            idxCtx.genLte(idx, ExpNum.bop(ExpNum.BopType.SUB, length, 1, source), source));
                    ContextSet<Object> entered = getIndiceDeep(bounded, loopAddr, idx, source)
                            .map(ic -> ic.setHeap(ic.heap.setVal(identAddr, ic.retVal)).<Object>setRetVal(ShContFlag.RUN));
                    return run(entered, stmt.loopBody).map(Interpreter::flagToRun);
                });
    }

    // ===================== EXPRESSIONS =====================

    private final class ExprEvaluator implements ExprVisitor<ContextSet<ShValue>> {
        private final Context<Object> ctx;

        ExprEvaluator(Context<Object> ctx) {
            this.ctx = ctx;
        }

        @Override
        public ContextSet<ShValue> visitConst(Expr.Const expr) {
            CodeSource source = expr.source();
            ShValue value;
            switch (expr.constType) {
                case INT:
                    value = SVInt.of(expr.numValue(), source);
                    break;
                case FLOAT:
                    value = SVFloat.of(expr.numValue(), source);
                    break;
                case STRING:
                    value = SVString.of((String) expr.value, source);
                    break;
                case BOOL:
                    value = SVBool.of((Boolean) expr.value, source);
                    break;
                case NONE:
                default:
                    value = SVNone.create(source);
                    break;
            }
            return ctx.toSetWith(value);
        }

        @Override
        public ContextSet<ShValue> visitObject(Expr.ObjectExpr expr) {
            return ctx.genObject(expr.source()).toSet();
        }

        @Override
        public ContextSet<ShValue> visitTuple(Expr.Tuple expr) {
            return evalAll(ctx, expr.values).map(c -> c.genTuple(c.retVal, expr.source()));
        }

        @Override
        public ContextSet<ShValue> visitCall(Expr.Call expr) {
            return evaluate(ctx, expr.func).flatMap(fc -> {
                ShValue callee = fc.retVal;
                return evalAll(fc, expr.params).flatMap(ac -> callValue(ac, callee, ac.retVal, null, expr.source()));
            });
        }

        @Override
        public ContextSet<ShValue> visitLibCall(Expr.LibCall expr) {
            return evalLibCall(ctx, expr);
        }

        @Override
        public ContextSet<ShValue> visitBinOp(Expr.BinOp expr) {
            return evalBinOp(ctx, expr);
        }

        @Override
        public ContextSet<ShValue> visitUnaryOp(Expr.UnaryOp expr) {
            return evaluate(ctx, expr.base).flatMap(c -> evalUnaryOp(c, expr.op, c.retVal, expr.source()));
        }

        @Override
        public ContextSet<ShValue> visitName(Expr.Name expr) {
            SVAddr addr = ctx.env.getId(expr.ident);
            if (addr == null) {
                return ctx.failToSet("name '" + expr.ident + "' does not exist.", expr.source());
            }
            return ctx.toSetWith((ShValue) addr);
        }

        @Override
        public ContextSet<ShValue> visitAttr(Expr.Attr expr) {
            return evaluate(ctx, expr.left).flatMap(c -> getAttrDeep(c, c.retVal, expr.right, expr.source()));
        }

        @Override
        public ContextSet<ShValue> visitSubscr(Expr.Subscr expr) {
            return evaluate(ctx, expr.left).flatMap(lc -> {
                ShValue objAddr = lc.retVal;
                return evaluate(lc, expr.right).flatMap(rc -> evalSubscr(rc, objAddr, rc.retVal, expr.source()));
            });
        }
    }

    /** Files an operator result: error-level errors fail the path, warnings are logged. */
    private static ContextSet<ShValue> finishOp(Context<?> ctx, ShValue value) {
        if (value instanceof SVError) {
            SVError err = (SVError) value;
            if (err.level == ShValue.ErrorLevel.ERROR) {
                return ctx.<ShValue>setRetVal(null).fail(err).toSet();
            }
            return ctx.warn(err).toSet();
        }
        return ctx.toSetWith(value);
    }

    // ===================== CALLS =====================

    /** Calls a function value or a callable object with already evaluated arguments. */
    public ContextSet<ShValue> callValue(Context<?> ctx, ShValue callee, List<ShValue> args,
                                         Map<String, ShValue> kwargs, CodeSource source) {
        if (callee instanceof SVError) {
            return ctx.toSetWith(callee);
        }
        ShValue func = ctx.heap.fetchAddr(callee);
        if (func == null) {
            return ctx.warnWithMsg("call to invalid address " + callee, source).toSet();
        }
        if (func instanceof SVFunc) {
            return functionCall(ctx, (SVFunc) func, args, source, kwargs);
        }
        if (func instanceof ObjectLike) {
            return lookupAttr(ctx, func, "__call__", source, false).flatMap(c -> {
                if (c.retVal instanceof SVFunc) {
                    return functionCall(c, (SVFunc) c.retVal, args, source, kwargs);
                }
                return c.warnWithMsg("object is not callable", source).toSet();
            });
        }
        return ctx.warnWithMsg(ShValue.typeName(func) + " is not callable", source).toSet();
    }

    /** Looks up {@code name} on the object behind {@code receiver} and calls it. */
    public ContextSet<ShValue> callMethod(Context<?> ctx, ShValue receiver, String name, List<ShValue> args,
                                          CodeSource source) {
        return getAttrDeep(ctx, receiver, name, source).flatMap(c -> {
            if (c.retVal instanceof SVError) return c.toSet();
            return callValue(c, c.retVal, args, null, source);
        });
    }

    public ContextSet<ShValue> functionCall(Context<?> ctx, SVFunc func, List<ShValue> args, CodeSource source) {
        return functionCall(ctx, func, args, source, null);
    }

    /**
     * Calls a user function. Parameters get fresh heap slots; arguments beyond the positional
     * parameters land in the varargs tuple and unmatched keywords in the kwargs dict. Slots
     * of a function without a closure are freed after the call unless they hold an object
     * that may have escaped.
     */
    public ContextSet<ShValue> functionCall(Context<?> ctx, SVFunc func, List<ShValue> args, CodeSource source,
                                            Map<String, ShValue> kwargs) {
        if (func == null) {
            return ctx.warnWithMsg("function not found", source).toSet();
        }
        if (func.funcEnv == null) {
            return ctx.failToSet("env of a function " + func.name + " is not defined", source);
        }

        ShEnv callerEnv = ctx.env;
        int symIdMax = ctx.ctrSet.idManager().symIdMax();

        ShHeap.Allocated funcSlot = ctx.heap.allocNew(func, source);
        ShHeap heap = funcSlot.heap;
        ShEnv env = func.funcEnv.setId(func.name, funcSlot.addr);

        Map<String, SVAddr> paramAddrs = new LinkedHashMap<>();
        for (String param : func.params) {
            ShHeap.Allocated a = heap.malloc(source);
            heap = a.heap;
            env = env.setId(param, a.addr);
            paramAddrs.put(param, a.addr);
        }

        for (Map.Entry<String, ShValue> def : func.defaults.entrySet()) {
            SVAddr addr = paramAddrs.get(def.getKey());
            if (addr != null) heap = heap.setVal(addr, def.getValue());
        }

        int posargLen = func.params.size() - (func.kwargsParam != null ? 1 : 0)
                - (func.varargsParam != null ? 1 : 0) - func.keyOnlyNum;

        SVObject varargs = null;
        if (func.varargsParam != null) {
            varargs = SVObject.create(paramAddrs.get(func.varargsParam), source);
        }
        int extra = 0;
        for (int i = 0; i < args.size(); i++) {
            if (i < posargLen) {
                heap = heap.setVal(paramAddrs.get(func.params.get(i)), args.get(i));
            } else if (varargs != null) {
                varargs = varargs.setIndice(extra++, args.get(i));
            }
        }
        if (varargs != null) {
            heap = heap.setVal(varargs.addr, varargs.setAttr("$length", SVInt.of(extra, source)));
        }

        SVObject kwargsDict = null;
        if (func.kwargsParam != null) {
            kwargsDict = SVObject.create(paramAddrs.get(func.kwargsParam), source);
        }
        if (kwargs != null) {
            for (Map.Entry<String, ShValue> kw : kwargs.entrySet()) {
                SVAddr named = paramAddrs.get(kw.getKey());
                if (named != null && !kw.getKey().equals(func.varargsParam) && !kw.getKey().equals(func.kwargsParam)) {
                    heap = heap.setVal(named, kw.getValue());
                } else if (kwargsDict != null) {
                    kwargsDict = kwargsDict.setKeyVal(kw.getKey(), kw.getValue());
                }
            }
        }
        if (kwargsDict != null) {
            heap = heap.setVal(kwargsDict.addr,
                    kwargsDict.setAttr("$length", SVInt.of(kwargsDict.keyValues.size(), source)));
        }

        if (Debug.get().enabled()) {
            Debug.get().t(Debug.TAG_INTERP, "call " + func.name + " with " + args.size() + " args");
        }

        Context<Object> callCtx = widen(ctx).setEnv(env).setHeap(heap).pushCallStack(new CallFrame(func, source));
        List<SVAddr> slots = new ArrayList<>(paramAddrs.values());

        ContextSet<ShValue> result = run(callCtx, func.funcBody).map(c -> {
            Context<Object> after = c.popCallStack().setEnv(callerEnv);
            if (!func.hasClosure) {
                ShHeap h = after.heap;
                for (int i = slots.size() - 1; i >= 0; i--) {
                    if (!(h.getVal(slots.get(i)) instanceof ObjectLike)) {
                        h = h.free(slots.get(i));
                    }
                }
                h = h.free(funcSlot.addr);
                after = after.setHeap(h);
            }
            ShValue ret = c.retVal instanceof ShContFlag ? SVNone.create(source) : (ShValue) c.retVal;
            return after.setRetVal(ret);
        });

        return result.prunePureFunctionCall(ctx, symIdMax);
    }

    private ContextSet<ShValue> evalLibCall(Context<Object> ctx, Expr.LibCall expr) {
        CodeSource source = expr.source();
        boolean explicit = "explicit".equals(expr.name);
        String name = expr.name;
        if (explicit && !expr.params.isEmpty() && expr.params.get(0).value instanceof Expr.Const
                && ((Expr.Const) expr.params.get(0).value).constType == Expr.ConstType.STRING) {
            name = (String) ((Expr.Const) expr.params.get(0).value).value;
        }
        String callName = name;

        List<ExprNode> paramExprs = new ArrayList<>(expr.params.size());
        List<String> paramNames = new ArrayList<>(expr.params.size());
        for (Expr.LibParam p : expr.params) {
            paramExprs.add(p.value);
            paramNames.add(p.name == null ? "" : p.name);
        }

        Context<Object> pushed = ctx.pushCallStack(new CallFrame(callName, source));
        return evalAll(pushed, paramExprs).flatMap(pc -> {
            LibCallParams params = new LibCallParams(paramNames, pc.retVal);
            if (explicit && !callName.equals(expr.name)) {
                params = params.dropFirst();
            }
            LibCallImpl impl = libCalls.get(callName);
            if (impl == null) {
                if (explicit) {
                    return pc.warnWithMsg("unimplemented explicit libcall: " + callName, source).toSet();
                }
                return pc.<ShValue>failToSet("invalid libcall type: " + callName, source);
            }
            return impl.call(this, pc.setRetVal(params), source);
        }).map(Context::popCallStack);
    }

    // ===================== OPERATORS =====================

    private ContextSet<ShValue> evalBinOp(Context<Object> ctx, Expr.BinOp expr) {
        CodeSource source = expr.source();
        BinOpType op = expr.op;

        if (op == BinOpType.AND || op == BinOpType.OR) {
            return evaluate(ctx, expr.left).flatMap(lc -> {
                Truthiness truth = SymOps.isTruthy(lc, lc.retVal, source);
                if (truth.isDecided()) {
                    boolean shortCircuit = op == BinOpType.AND ? !truth.decided : truth.decided;
                    return shortCircuit ? lc.toSet() : evaluate(lc, expr.right);
                }
                ContextSet.Branches<ShValue> branches = lc.ifThenElse(truth.constraint, source);
                if (op == BinOpType.AND) {
                    return evaluate(branches.thenSet, expr.right).join(branches.elseSet);
                }
                return branches.thenSet.join(evaluate(branches.elseSet, expr.right));
            });
        }

        return evaluate(ctx, expr.left).flatMap(lc -> {
            ShValue leftVal = lc.retVal;
            return evaluate(lc, expr.right).flatMap(rc -> binOp(rc, op, leftVal, rc.retVal, source));
        });
    }

    /** Applies a non short-circuit binary operator to evaluated operands. */
    public ContextSet<ShValue> binOp(Context<?> ctx, BinOpType op, ShValue leftAddr, ShValue rightAddr,
                                     CodeSource source) {
        if (leftAddr instanceof SVError) return ctx.toSetWith(leftAddr);
        if (rightAddr instanceof SVError) return ctx.toSetWith(rightAddr);

        if (op == BinOpType.IS || op == BinOpType.IS_NOT) {
            ShValue identity = identityCheck(ctx, leftAddr, rightAddr, op == BinOpType.IS, source);
            if (identity != null) return ctx.toSetWith(identity);
        }

        ShValue left = ctx.heap.fetchAddr(leftAddr);
        ShValue right = ctx.heap.fetchAddr(rightAddr);
        if (left == null || right == null) {
            return ctx.warnWithMsg("errornous binary operation: got " + leftAddr + " " + op.symbol() + " " + rightAddr,
                    source).toSet();
        }

        if (left instanceof SVString || right instanceof SVString) {
            ShValue result = null;
            if (left instanceof SVString && right instanceof SVString) {
                result = SymOps.binOpStr(ctx.ctrSet, (SVString) left, (SVString) right, op, source);
            } else if (left instanceof SVString && SymOps.isNumeric(right)) {
                result = SymOps.binOpStrNum(ctx.ctrSet, (SVString) left, right, op, source);
            } else if (right instanceof SVString && SymOps.isNumeric(left)) {
                result = SymOps.binOpStrNum(ctx.ctrSet, (SVString) right, left, op, source);
            }
            if (result != null) return ctx.toSetWith(result);
            if (!(left instanceof ObjectLike) && !(right instanceof ObjectLike)) {
                return ctx.failToSet("invalid operation " + op.symbol() + " in string", source);
            }
        }

        if (SymOps.isNumeric(left) && SymOps.isNumeric(right)) {
            return numericBinOp(ctx, op, left, right, source);
        }

        if (left instanceof ObjectLike || right instanceof ObjectLike) {
            return dunderBinOp(ctx, op, leftAddr, rightAddr, source);
        }

        if (op == BinOpType.EQ || op == BinOpType.NEQ) {
            boolean same = left.type() == right.type();
            return ctx.toSetWith((ShValue) SVBool.of(op == BinOpType.EQ ? same : !same, source));
        }
        return ctx.toSetWith((ShValue) SVNotImpl.create("invalid bop " + op.symbol(), source));
    }

    /** Identity of addresses and None; null when identity cannot be decided this way. */
    private static ShValue identityCheck(Context<?> ctx, ShValue leftAddr, ShValue rightAddr, boolean is,
                                         CodeSource source) {
        if (leftAddr instanceof SVAddr && rightAddr instanceof SVAddr) {
            boolean same = ((SVAddr) leftAddr).addr == ((SVAddr) rightAddr).addr;
            return SVBool.of(is == same, source);
        }
        ShValue left = ctx.heap.fetchAddr(leftAddr);
        ShValue right = ctx.heap.fetchAddr(rightAddr);
        boolean leftNone = left instanceof SVNone;
        boolean rightNone = right instanceof SVNone;
        if (leftNone || rightNone) {
            boolean same = leftNone && rightNone;
            return SVBool.of(is == same, source);
        }
        return null;
    }

    private static ExpNum castedNum(Context<?>[] holder, ShValue value, CodeSource source) {
        if (value instanceof SVBool) {
            CSResult<ExpNum> cast = holder[0].ctrSet.castBoolToInt(((SVBool) value).value, source);
            holder[0] = holder[0].setCtrSet(cast.ctrSet);
            return cast.value;
        }
        return SymOps.numExp(value);
    }

    private ContextSet<ShValue> numericBinOp(Context<?> ctx, BinOpType op, ShValue left, ShValue right,
                                             CodeSource source) {
        if (SymOps.isConstant(left) && SymOps.isConstant(right)) {
            return finishOp(ctx, SymOps.binOpLiteral(left, right, op, source));
        }

        Context<?>[] holder = { ctx };
        ShValue l = left instanceof SVBool ? SVInt.of(castedNum(holder, left, source), source) : left;
        ShValue r = right instanceof SVBool ? SVInt.of(castedNum(holder, right, source), source) : right;
        Context<?> cur = holder[0];

        if (op == BinOpType.POW) {
            ShValue pow = SymOps.powUnrolled(cur.ctrSet, l, r, source);
            if (pow != null) return cur.toSetWith(pow);
            boolean isFloat = l instanceof SVFloat || r instanceof SVFloat;
            ExpNum sym = ExpNum.fromSymbol(isFloat ? cur.genSymFloat("pow", source) : cur.genSymInt("pow", source));
            ShValue value = isFloat ? SVFloat.of(sym, source) : SVInt.of(sym, source);
            return cur.addLog("WARNING: symbolic pow is not modelled exactly. use a fresh symbol", source)
                    .toSetWith(value);
        }

        ShValue result = SymOps.binOpNum(l, r, op, source);
        if (result instanceof SVInt) {
            result = SVInt.of(ExpSimplifier.simplifyNum(cur.ctrSet, ((SVInt) result).value), source);
        } else if (result instanceof SVFloat) {
            result = SVFloat.of(ExpSimplifier.simplifyNum(cur.ctrSet, ((SVFloat) result).value), source);
        }
        return finishOp(cur, result);
    }

    /**
     * {@code left.__op__(right)}; when that is missing or returns NotImplemented,
     * {@code right.__rop__(left)}.
     */
    private ContextSet<ShValue> dunderBinOp(Context<?> ctx, BinOpType op, ShValue leftAddr, ShValue rightAddr,
                                            CodeSource source) {
        String[] names = SymOps.dunderNames(op);
        boolean negate = op == BinOpType.NOT_IN;
        boolean swapContains = op == BinOpType.IN || op == BinOpType.NOT_IN;
        // `a in b` dispatches to b.__contains__(a)
        ShValue first = swapContains ? rightAddr : leftAddr;
        ShValue second = swapContains ? leftAddr : rightAddr;

        return tryDunder(ctx, first, names[0], second, source).flatMap(c -> {
            if (!(c.retVal instanceof SVNotImpl) || swapContains) {
                return negate ? negateResult(c, source) : c.toSet();
            }
            return tryDunder(c, second, names[1], first, source).flatMap(rc -> {
                if (rc.retVal instanceof SVNotImpl) {
                    return rc.toSetWith((ShValue) SVNotImpl.create("invalid bop " + op.symbol(), source));
                }
                return rc.toSet();
            });
        });
    }

    private ContextSet<ShValue> negateResult(Context<ShValue> ctx, CodeSource source) {
        Truthiness truth = SymOps.isTruthy(ctx, ctx.retVal, source);
        if (truth.isDecided()) {
            return ctx.toSetWith((ShValue) SVBool.of(!truth.decided, source));
        }
        ShValue value = ctx.retVal;
        if (value instanceof SVBool) {
            return ctx.toSetWith((ShValue) SVBool.of(ExpBool.not(((SVBool) value).value, source), source));
        }
        return ctx.toSetWith((ShValue) SVBool.of(ExpBool.fromSymbol(ctx.genSymBool("not_in", source)), source));
    }

    private ContextSet<ShValue> tryDunder(Context<?> ctx, ShValue receiver, String name, ShValue arg,
                                          CodeSource source) {
        ShValue obj = ctx.heap.fetchAddr(receiver);
        if (!(obj instanceof ObjectLike)) {
            return ctx.toSetWith((ShValue) SVNotImpl.create(name + " is not defined", source));
        }
        return lookupAttr(ctx, obj, name, source, false).flatMap(c -> {
            if (!(c.retVal instanceof SVFunc)) {
                return c.toSetWith((ShValue) SVNotImpl.create(name + " is not defined", source));
            }
            List<ShValue> args = new ArrayList<>(1);
            args.add(arg);
            return functionCall(c, (SVFunc) c.retVal, args, source);
        });
    }

    private ContextSet<ShValue> evalUnaryOp(Context<ShValue> ctx, UnaryOpType op, ShValue baseAddr,
                                            CodeSource source) {
        if (baseAddr instanceof SVError) return ctx.toSet();
        ShValue base = ctx.heap.fetchAddr(baseAddr);
        if (base == null) {
            return ctx.warnWithMsg("unary operation on invalid address " + baseAddr, source).toSet();
        }

        if (SymOps.isNumeric(base)) {
            if (SymOps.isConstant(base)) {
                return finishOp(ctx, SymOps.unaryOp(base, op, source));
            }
            if (op == UnaryOpType.NEG && base instanceof SVBool) {
                CSResult<ExpNum> cast = ctx.ctrSet.castBoolToInt(((SVBool) base).value, source);
                Context<ShValue> cc = ctx.setCtrSet(cast.ctrSet);
                return finishOp(cc, SymOps.unaryOp(SVInt.of(cast.value, source), op, source));
            }
            if (op == UnaryOpType.NOT && !(base instanceof SVBool)) {
                CSResult<ExpBool> cast = ctx.ctrSet.castNumToBool(SymOps.numExp(base), source);
                if (cast == null) {
                    return ctx.warnWithMsg("cannot infer truthiness of " + base, source).toSet();
                }
                Context<ShValue> cc = ctx.setCtrSet(cast.ctrSet);
                return finishOp(cc, SymOps.unaryOp(SVBool.of(cast.value, source), op, source));
            }
            return finishOp(ctx, SymOps.unaryOp(base, op, source));
        }

        if (op == UnaryOpType.NEG) {
            if (base instanceof ObjectLike) {
                return lookupAttr(ctx, base, "__neg__", source, false).flatMap(c -> {
                    if (c.retVal instanceof SVFunc) {
                        return functionCall(c, (SVFunc) c.retVal, Collections.emptyList(), source);
                    }
                    return c.<ShValue>failToSet("bad operand type for unary -: object", source);
                });
            }
            return ctx.failToSet("bad operand type for unary -: " + ShValue.typeName(base), source);
        }

        Truthiness truth = SymOps.isTruthy(ctx, base, source);
        if (truth.isDecided()) {
            return ctx.toSetWith((ShValue) SVBool.of(!truth.decided, source));
        }
        return ctx.toSetWith((ShValue) SVBool.of(ExpBool.fromSymbol(ctx.genSymBool("not$value", source)), source));
    }

    // ===================== SUBSCRIPTS =====================

    private ContextSet<ShValue> evalSubscr(Context<ShValue> ctx, ShValue objAddr, ShValue indexVal,
                                           CodeSource source) {
        if (objAddr instanceof SVError) return ctx.toSetWith(objAddr);
        ShValue obj = ctx.heap.fetchAddr(objAddr);
        if (!(obj instanceof ObjectLike)) {
            return ctx.warnWithMsg("object does not exist.", source).toSet();
        }
        ObjectLike target = (ObjectLike) obj;
        ShValue index = ctx.heap.fetchAddr(indexVal);

        ShValue found = null;
        if (index instanceof SVInt) {
            found = getItemByIndex(ctx, target, ((SVInt) index).value, source);
        } else if (index instanceof SVString) {
            String key = ctx.ctrSet.getCachedString(((SVString) index).value);
            found = key == null ? SVError.warn("cannot infer key " + index + " statically", source)
                    : target.getKeyVal(key);
        }
        if (found != null && !(found instanceof SVError)) {
            return ctx.toSetWith(found);
        }
        ShValue lookup = found;

        return lookupAttr(ctx, obj, "__getitem__", source, false).flatMap(c -> {
            if (c.retVal instanceof SVFunc) {
                List<ShValue> args = new ArrayList<>(1);
                args.add(indexVal);
                return functionCall(c, (SVFunc) c.retVal, args, source);
            }
            if (lookup != null) {
                return c.warn((SVError) lookup).toSet();
            }
            return c.warnWithMsg("object is not subscriptable (or index " + index + " not exist)", source).toSet();
        });
    }

    /**
     * Item at a statically known index; negative indices count from a constant length. An
     * index that is not a constant yields a warning value, a missing item yields null.
     */
    public static ShValue getItemByIndex(Context<?> ctx, ObjectLike obj, ExpNum index, CodeSource source) {
        NumRange range = ctx.getCachedRange(index);
        if (range == null || !range.isConst()) {
            return SVError.warn("cannot infer index " + index + " statically", source);
        }
        int i = (int) range.start;
        if (i < 0) {
            ShValue length = ctx.heap.fetchAddr(obj.getAttr("$length"));
            if (!(length instanceof SVInt)) return null;
            NumRange lenRange = ctx.getCachedRange(((SVInt) length).value);
            if (lenRange == null || !lenRange.isConst()) {
                return SVError.warn("cannot resolve negative index " + i + " of symbolic length", source);
            }
            i += (int) lenRange.start;
            if (i < 0) return null;
        }
        return obj.getIndice(i);
    }

    public ContextSet<ShValue> getIndiceDeep(Context<?> ctx, ShValue object, ExpNum index, CodeSource source) {
        ShValue obj = ctx.heap.fetchAddr(object);
        if (!(obj instanceof ObjectLike)) {
            return ctx.warnWithMsg("getIndiceDeep " + index + ": value is not an object", source).toSet();
        }
        ObjectLike target = (ObjectLike) obj;

        ShValue item = getItemByIndex(ctx, target, index, source);
        if (item != null && !(item instanceof SVError)) {
            return ctx.toSetWith(item);
        }

        // range objects expose start and step instead of materialized items
        ShValue start = ctx.heap.fetchAddr(target.getAttr("$start"));
        ShValue step = ctx.heap.fetchAddr(target.getAttr("$step"));
        if (start instanceof SVInt && step instanceof SVInt) {
            ExpNum value = ExpNum.bop(ExpNum.BopType.ADD, ((SVInt) start).value,
                    ExpNum.bop(ExpNum.BopType.MUL, ((SVInt) step).value, index, source), source);
            return ctx.toSetWith((ShValue) SVInt.of(ExpSimplifier.simplifyNum(ctx.ctrSet, value), source));
        }

        return lookupAttr(ctx, obj, "__getitem__", source, false).flatMap(c -> {
            if (c.retVal instanceof SVFunc) {
                List<ShValue> args = new ArrayList<>(1);
                args.add(SVInt.of(index, source));
                return functionCall(c, (SVFunc) c.retVal, args, source);
            }
            return c.warnWithMsg("getIndiceDeep " + index + ": index " + index + " not exist.", source).toSet();
        });
    }

    public ContextSet<ShValue> getKeyValDeep(Context<?> ctx, ShValue object, String key, CodeSource source) {
        ShValue obj = ctx.heap.fetchAddr(object);
        if (!(obj instanceof ObjectLike)) {
            return ctx.warnWithMsg("getKeyValDeep " + key + ": value is not an object", source).toSet();
        }
        ShValue item = ((ObjectLike) obj).getKeyVal(key);
        if (item != null) {
            return ctx.toSetWith(item);
        }
        return lookupAttr(ctx, obj, "__getitem__", source, false).flatMap(c -> {
            if (c.retVal instanceof SVFunc) {
                List<ShValue> args = new ArrayList<>(1);
                args.add(SVString.of(key, source));
                return functionCall(c, (SVFunc) c.retVal, args, source);
            }
            return c.warnWithMsg("getKeyValDeep " + key + ": key not exist.", source).toSet();
        });
    }

    /**
     * Length of an iterable: {@code $length} of an object, otherwise its {@code __len__}.
     * Strings of unknown content get a fresh non-negative length.
     */
    public ContextSet<ShValue> lenOf(Context<?> ctx, ShValue value, CodeSource source, boolean warnMissing) {
        ShValue obj = ctx.heap.fetchAddr(value);
        if (obj instanceof SVString) {
            SVString str = (SVString) obj;
            String cached = ctx.ctrSet.getCachedString(str.value);
            if (cached != null) {
                return ctx.toSetWith((ShValue) SVInt.of(cached.length(), source));
            }
            Context<ExpNum> len = ctx.genIntGte("len$str", 0, source);
            return len.toSetWith((ShValue) SVInt.of(len.retVal, source));
        }
        if (!(obj instanceof ObjectLike)) {
            return ctx.warnWithMsg("from 'len': value is not iterable: got " + ShValue.typeName(obj), source).toSet();
        }
        ShValue length = ((ObjectLike) obj).getAttr("$length");
        if (length != null) {
            return ctx.toSetWith(ctx.heap.fetchAddr(length));
        }
        return lookupAttr(ctx, obj, "__len__", source, false).flatMap(c -> {
            if (c.retVal instanceof SVFunc) {
                return functionCall(c, (SVFunc) c.retVal, Collections.emptyList(), source);
            }
            if (!warnMissing) {
                return c.toSetWith((ShValue) SVError.warn("object has no '__len__'", source));
            }
            return c.warnWithMsg("from 'len': object has no '__len__'", source).toSet();
        });
    }

    // ===================== ATTRIBUTES =====================

    /**
     * Attribute lookup through the object itself, its {@code __getattr__}, and then the classes
     * of its {@code __mro__}. Functions found on a class are bound to the object.
     */
    public ContextSet<ShValue> getAttrDeep(Context<?> ctx, ShValue object, String name, CodeSource source) {
        if (object instanceof SVError) {
            return ctx.toSetWith(object);
        }
        ShValue obj = ctx.heap.fetchAddr(object);
        if (obj == null) {
            return ctx.warnWithMsg("getAttrDeep(" + name + "): invalid address of object", source).toSet();
        }
        if (obj instanceof SVError) {
            return ctx.toSetWith(obj);
        }
        if ("__dict__".equals(name) && obj instanceof ObjectLike) {
            Context<ShValue> dictCtx = ctx.genObject(source);
            SVAddr dictAddr = (SVAddr) dictCtx.retVal;
            SVObject dict = (SVObject) dictCtx.heap.getVal(dictAddr);
            SVObject attrsObj = ((ObjectLike) obj).object();
            for (Map.Entry<String, ShValue> e : attrsObj.attrs.entrySet()) {
                dict = dict.setKeyVal(e.getKey(), e.getValue());
            }
            dict = dict.setAttr("$length", SVInt.of(attrsObj.attrs.size(), source));
            return dictCtx.setHeap(dictCtx.heap.setVal(dictAddr, dict)).toSetWith((ShValue) dictAddr);
        }
        return lookupAttr(ctx, obj, name, source, true);
    }

    /**
     * Shared lookup. With {@code warnMissing} unset a missing attribute leaves a null result
     * value instead of a warning, for probing optional protocol methods.
     */
    private ContextSet<ShValue> lookupAttr(Context<?> ctx, ShValue obj, String name, CodeSource source,
                                           boolean warnMissing) {
        if (obj instanceof ObjectLike) {
            ObjectLike target = (ObjectLike) obj;
            ShValue own = target.getAttr(name);
            if (own != null) {
                return ctx.toSetWith(own);
            }
            ShValue ownGetattr = ctx.heap.fetchAddr(target.getAttr("__getattr__"));
            if (ownGetattr instanceof SVFunc) {
                List<ShValue> args = new ArrayList<>(1);
                args.add(SVString.of(name, source));
                return functionCall(ctx, (SVFunc) ownGetattr, args, source);
            }
        }

        ShValue classAttr = findMroAttr(ctx, obj, name);
        if (classAttr != null) {
            ShValue attr = ctx.heap.fetchAddr(classAttr);
            if (attr instanceof SVFunc && obj instanceof ObjectLike) {
                return ctx.toSetWith((ShValue) ((SVFunc) attr).bound(((ObjectLike) obj).addr()));
            }
            return ctx.toSetWith(classAttr);
        }

        ShValue mroGetattr = ctx.heap.fetchAddr(findMroAttr(ctx, obj, "__getattr__"));
        if (mroGetattr instanceof SVFunc) {
            SVFunc getattr = (SVFunc) mroGetattr;
            if (obj instanceof ObjectLike) {
                getattr = getattr.bound(((ObjectLike) obj).addr());
            }
            List<ShValue> args = new ArrayList<>(1);
            args.add(SVString.of(name, source));
            return functionCall(ctx, getattr, args, source);
        }

        if (!warnMissing) {
            return ctx.<ShValue>toSetWith(null);
        }
        return ctx.warnWithMsg("getAttrDeep(" + name + "): attribute not found", source).toSet();
    }

    /** First class in the method resolution order of {@code obj} that defines {@code name}. */
    private static ShValue findMroAttr(Context<?> ctx, ShValue obj, String name) {
        if (obj == null) return null;
        for (Integer classAddr : trackMro(obj, ctx.heap, ctx.env)) {
            ShValue cls = ctx.heap.getValRecur(new SVAddr(classAddr, null));
            if (cls instanceof ObjectLike) {
                ShValue attr = ((ObjectLike) cls).getAttr(name);
                if (attr != null) return attr;
            }
        }
        return null;
    }

    /**
     * Addresses of the classes in the method resolution order of {@code value}. Objects carry
     * an {@code __mro__} tuple; primitives use the builtin class bound to their type name.
     */
    public static List<Integer> trackMro(ShValue value, ShHeap heap, ShEnv env) {
        ShValue obj = heap.fetchAddr(value);
        if (obj == null) return Collections.emptyList();

        String primitiveClass = null;
        switch (obj.type()) {
            case INT: primitiveClass = "int"; break;
            case FLOAT: primitiveClass = "float"; break;
            case STRING: primitiveClass = "str"; break;
            case BOOL: primitiveClass = "bool"; break;
            default: break;
        }
        if (primitiveClass != null) {
            SVAddr classAddr = env.getId(primitiveClass);
            if (classAddr == null) return Collections.emptyList();
            ShValue cls = heap.getValRecur(classAddr);
            if (!(cls instanceof ObjectLike)) return Collections.emptyList();
            return trackMro(((ObjectLike) cls).addr(), heap, env);
        }

        if (!(obj instanceof ObjectLike)) return Collections.emptyList();
        ShValue mro = heap.fetchAddr(((ObjectLike) obj).getAttr("__mro__"));
        if (!(mro instanceof ObjectLike)) return Collections.emptyList();

        ObjectLike mroTuple = (ObjectLike) mro;
        ShValue length = heap.fetchAddr(mroTuple.getAttr("$length"));
        if (!(length instanceof SVInt) || !((SVInt) length).isConst()) return Collections.emptyList();

        List<Integer> result = new ArrayList<>();
        int n = (int) ((SVInt) length).constValue();
        for (int i = 0; i < n; i++) {
            ShValue entry = mroTuple.getIndice(i);
            if (entry instanceof SVAddr) {
                result.add(((SVAddr) entry).addr);
            }
        }
        return result;
    }

    /** True when the class at {@code classAddr} appears in the MRO of {@code value}. */
    public static boolean isInstanceOf(ShValue value, SVAddr classAddr, ShHeap heap, ShEnv env) {
        ShValue cls = heap.sanitizeAddr(classAddr);
        int target = cls instanceof SVAddr ? ((SVAddr) cls).addr : classAddr.addr;
        return trackMro(value, heap, env).contains(target);
    }
}
