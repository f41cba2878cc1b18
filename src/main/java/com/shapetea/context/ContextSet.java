package com.shapetea.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

import com.shapetea.constraint.Constraint;
import com.shapetea.constraint.ConstraintSet;
import com.shapetea.constraint.ExpSimplifier;
import com.shapetea.context.ShValue.ObjectLike;
import com.shapetea.context.ShValue.SVBool;
import com.shapetea.context.ShValue.SVError;
import com.shapetea.context.ShValue.SVFloat;
import com.shapetea.context.ShValue.SVInt;
import com.shapetea.context.ShValue.SVNone;
import com.shapetea.context.ShValue.SVObject;
import com.shapetea.context.ShValue.SVSize;
import com.shapetea.context.ShValue.SVString;
import com.shapetea.debug.Debug;
import com.shapetea.ir.CodeSource;
import com.shapetea.symbolic.SymExp;

/**
 * Live, failed and stopped contexts of one evaluation step.
 *
 * <p>Failed contexts terminated without any active path constraint: the error is reached
 * unconditionally. Stopped contexts terminated under a path constraint, so the error is real
 * only if that path is feasible. Every set is built through {@link #create}, which is also
 * where the session's {@link PathGovernor} gets to cancel live paths.
 */
public final class ContextSet<T> {

    private final AnalysisSession session;
    private final List<Context<T>> ctxList;
    private final List<Context<ShValue>> failed;
    private final List<Context<ShValue>> stopped;

    private ContextSet(AnalysisSession session, List<Context<T>> ctxList, List<Context<ShValue>> failed,
                       List<Context<ShValue>> stopped) {
        this.session = session;
        this.ctxList = ctxList;
        this.failed = failed;
        this.stopped = stopped;
    }

    /** Pair of sets produced by forking on a condition. */
    public static final class Branches<T> {
        public final ContextSet<T> thenSet;
        public final ContextSet<T> elseSet;

        Branches(ContextSet<T> thenSet, ContextSet<T> elseSet) {
            this.thenSet = thenSet;
            this.elseSet = elseSet;
        }
    }

    // ===================== CONSTRUCTION =====================

    private static <T> ContextSet<T> create(AnalysisSession session, List<Context<T>> ctxList,
                                            List<Context<ShValue>> failed, List<Context<ShValue>> stopped) {
        if (session != null && !ctxList.isEmpty()) {
            String reason = session.governor().check(ctxList.size());
            if (reason != null) {
                Debug.get().w(Debug.TAG_CTX, "cancelling " + ctxList.size() + " live paths: " + reason);
                List<Context<ShValue>> newFailed = new ArrayList<>(failed);
                List<Context<ShValue>> newStopped = new ArrayList<>(stopped);
                for (Context<T> ctx : ctxList) {
                    file(session, ctx.failWithMsg(reason, null), newFailed, newStopped);
                }
                return new ContextSet<>(session, Collections.emptyList(), newFailed, newStopped);
            }
        }
        return new ContextSet<>(session, ctxList, failed, stopped);
    }

    /** Moves a failed context into the failed or stopped list, depending on its path constraints. */
    private static <A> void file(AnalysisSession session, Context<A> ctx, List<Context<ShValue>> failedOut,
                                 List<Context<ShValue>> stoppedOut) {
        Context<ShValue> dead = ctx.setRetVal((ShValue) ctx.failed);
        if (dead.failId == -1) {
            dead = dead.setFailId(session.nextFailId());
        }
        if (dead.hasPathCtr()) {
            stoppedOut.add(dead);
        } else {
            failedOut.add(dead);
        }
    }

    public static <T> ContextSet<T> fromCtx(Context<T> ctx) {
        if (ctx.failed != null) {
            List<Context<ShValue>> failedOut = new ArrayList<>(1);
            List<Context<ShValue>> stoppedOut = new ArrayList<>(1);
            file(ctx.session(), ctx, failedOut, stoppedOut);
            return new ContextSet<>(ctx.session(), Collections.emptyList(), failedOut, stoppedOut);
        }
        return create(ctx.session(), Collections.singletonList(ctx), Collections.emptyList(),
                Collections.emptyList());
    }

    public static <T> ContextSet<T> empty(AnalysisSession session) {
        return new ContextSet<>(session, Collections.emptyList(), Collections.emptyList(), Collections.emptyList());
    }

    /** Partitions {@code ctxs} into live, failed and stopped on top of the given dead lists. */
    private <A> ContextSet<A> setCtxList(List<Context<A>> ctxs, List<Context<ShValue>> baseFailed,
                                         List<Context<ShValue>> baseStopped) {
        List<Context<A>> live = new ArrayList<>(ctxs.size());
        List<Context<ShValue>> newFailed = new ArrayList<>(baseFailed);
        List<Context<ShValue>> newStopped = new ArrayList<>(baseStopped);
        for (Context<A> ctx : ctxs) {
            if (ctx.failed == null) {
                live.add(ctx);
            } else {
                file(session, ctx, newFailed, newStopped);
            }
        }
        return create(session, live, newFailed, newStopped);
    }

    // ===================== ACCESSORS =====================

    public AnalysisSession session() {
        return session;
    }

    public List<Context<T>> getList() {
        return Collections.unmodifiableList(ctxList);
    }

    public List<Context<ShValue>> getFailed() {
        return Collections.unmodifiableList(failed);
    }

    public List<Context<ShValue>> getStopped() {
        return Collections.unmodifiableList(stopped);
    }

    public int getRunningCount() {
        return ctxList.size();
    }

    public boolean isEmpty() {
        return ctxList.isEmpty();
    }

    // ===================== COMBINATORS =====================

    public ContextSet<T> filter(Predicate<Context<T>> tester) {
        List<Context<T>> kept = new ArrayList<>();
        for (Context<T> ctx : ctxList) {
            if (tester.test(ctx)) kept.add(ctx);
        }
        return new ContextSet<>(session, kept, failed, stopped);
    }

    public <A> ContextSet<A> map(Function<Context<T>, Context<A>> mapper) {
        List<Context<A>> mapped = new ArrayList<>(ctxList.size());
        for (Context<T> ctx : ctxList) {
            mapped.add(mapper.apply(ctx));
        }
        return setCtxList(mapped, failed, stopped);
    }

    public <A> ContextSet<A> flatMap(Function<Context<T>, ContextSet<A>> mapper) {
        List<Context<A>> live = new ArrayList<>();
        List<Context<ShValue>> newFailed = new ArrayList<>();
        List<Context<ShValue>> newStopped = new ArrayList<>();
        for (Context<T> ctx : ctxList) {
            ContextSet<A> cs = mapper.apply(ctx);
            live.addAll(cs.ctxList);
            newFailed.addAll(cs.failed);
            newStopped.addAll(cs.stopped);
        }
        newFailed.addAll(failed);
        newStopped.addAll(stopped);
        return create(session, live, newFailed, newStopped);
    }

    /** Replaces the result value of every live context. */
    public <A> ContextSet<A> returnValue(A value) {
        List<Context<A>> live = new ArrayList<>(ctxList.size());
        for (Context<T> ctx : ctxList) {
            live.add(ctx.setRetVal(value));
        }
        return new ContextSet<>(session, live, failed, stopped);
    }

    /** Same contexts, results typed as {@code Object}. */
    public ContextSet<Object> asObjects() {
        List<Context<Object>> live = new ArrayList<>(ctxList.size());
        for (Context<T> ctx : ctxList) {
            live.add(ctx.setRetVal((Object) ctx.retVal));
        }
        return new ContextSet<>(session, live, failed, stopped);
    }

    /** Fails every live context with {@code errMsg}. */
    public <A> ContextSet<A> fail(String errMsg, CodeSource source) {
        List<Context<ShValue>> newFailed = new ArrayList<>(failed);
        List<Context<ShValue>> newStopped = new ArrayList<>(stopped);
        for (Context<T> ctx : ctxList) {
            file(session, ctx.failWithMsg(errMsg, source), newFailed, newStopped);
        }
        return new ContextSet<>(session, Collections.emptyList(), newFailed, newStopped);
    }

    /** Concatenates live paths; failed and stopped paths are merged by fail id, later entries winning. */
    public ContextSet<T> join(ContextSet<T> other) {
        List<Context<T>> live = new ArrayList<>(ctxList.size() + other.ctxList.size());
        live.addAll(ctxList);
        live.addAll(other.ctxList);

        Map<Integer, Context<ShValue>> failedById = new LinkedHashMap<>();
        for (Context<ShValue> ctx : failed) failedById.put(ctx.failId, ctx);
        for (Context<ShValue> ctx : other.failed) failedById.put(ctx.failId, ctx);

        Map<Integer, Context<ShValue>> stoppedById = new LinkedHashMap<>();
        for (Context<ShValue> ctx : stopped) stoppedById.put(ctx.failId, ctx);
        for (Context<ShValue> ctx : other.stopped) stoppedById.put(ctx.failId, ctx);

        AnalysisSession s = session != null ? session : other.session;
        return create(s, live, new ArrayList<>(failedById.values()), new ArrayList<>(stoppedById.values()));
    }

    public ContextSet<T> require(Constraint ctr, String failMsg, CodeSource source) {
        return require(Collections.singletonList(ctr), failMsg, source);
    }

    /**
     * Adds soft constraints to every live context. A context whose set becomes invalid fails
     * with {@code failMsg} followed by the rendered constraints.
     */
    public ContextSet<T> require(List<Constraint> ctrs, String failMsg, CodeSource source) {
        List<Constraint> messaged = new ArrayList<>(ctrs.size());
        for (Constraint c : ctrs) {
            messaged.add(c.withMessage(failMsg));
        }
        return map(ctx -> {
            ConstraintSet next = ctx.ctrSet.requireAll(messaged);
            if (!next.isValid()) {
                StringBuilder ctrMsg = new StringBuilder();
                for (int i = 0; i < messaged.size(); i++) {
                    if (i > 0) ctrMsg.append(" /\\ \n");
                    ctrMsg.append(messaged.get(i));
                }
                String head = failMsg == null || failMsg.isEmpty() ? "runtime constraint mismatch" : failMsg;
                return ctx.setCtrSet(next).failWithMsg(head + "\n  CONSTRAINTS:\n" + ctrMsg + "\n", source);
            }
            return ctx.setCtrSet(next);
        });
    }

    public ContextSet<T> guarantee(Constraint ctr) {
        return map(ctx -> ctx.setCtrSet(ctx.ctrSet.guarantee(ctr)));
    }

    public ContextSet<T> guarantee(List<Constraint> ctrs) {
        return map(ctx -> ctx.setCtrSet(ctx.ctrSet.guaranteeAll(ctrs)));
    }

    /**
     * Forks every live context on {@code ctr}. A branch whose path constraint is immediately
     * false is dropped.
     */
    public Branches<T> ifThenElse(Constraint ctr, CodeSource source) {
        List<Context<T>> thenPath = new ArrayList<>();
        List<Context<T>> elsePath = new ArrayList<>();
        for (Context<T> ctx : ctxList) {
            ConstraintSet thenSet = ctx.ctrSet.addIf(ctr.withMessage("true path"));
            if (thenSet.isValid()) {
                thenPath.add(ctx.setCtrSet(thenSet));
            }
            ConstraintSet elseSet = ctx.ctrSet.addIf(ctx.ctrSet.genNot(ctr, source).withMessage("false path"));
            if (elseSet.isValid()) {
                elsePath.add(ctx.setCtrSet(elseSet));
            }
        }
        return new Branches<>(create(session, thenPath, failed, stopped), create(session, elsePath, failed, stopped));
    }

    public ContextSet<T> addLog(String message, CodeSource source) {
        return map(ctx -> ctx.addLog(message, source));
    }

    public ContextSet<T> addLogValue(ShValue value) {
        return map(ctx -> ctx.addLogValue(value));
    }

    // ===================== PURE CALL PRUNING =====================

    /**
     * Merges the two paths a function call forked into when the call is observably pure for
     * the caller: no soft constraints were added, the new constraints only mention symbols
     * created by the call (or the two paths differ by exactly one condition and its negation),
     * both return values are equal and no heap entry below the caller's high-water mark
     * changed. The merged context gets the caller's constraint set back.
     *
     * @param oldCtx    the caller context right before the call
     * @param symIdMax  largest symbol id that existed before the call
     */
    public ContextSet<T> prunePureFunctionCall(Context<?> oldCtx, int symIdMax) {
        if (ctxList.size() != 2) return this;

        ShHeap oldHeap = oldCtx.heap;
        int heapLimit = oldHeap.addrMax;

        Context<T> left = ctxList.get(0);
        Context<T> right = ctxList.get(1);
        ConstraintSet leftSet = left.ctrSet;
        ConstraintSet rightSet = right.ctrSet;
        int leftLen = leftSet.count();
        int rightLen = rightSet.count();

        int oldSoftLen = oldCtx.ctrSet.getSoftIds().size();
        if (leftSet.getSoftIds().size() != oldSoftLen || rightSet.getSoftIds().size() != oldSoftLen) {
            return this;
        }

        if (leftSet.notPrunedCtrMax() >= leftLen) {
            List<Context<T>> next = new ArrayList<>(ctxList);
            next.set(1, right.setCtrSet(rightSet.markChecked(rightLen)));
            return new ContextSet<>(session, next, failed, stopped);
        } else if (rightSet.notPrunedCtrMax() >= rightLen) {
            List<Context<T>> next = new ArrayList<>(ctxList);
            next.set(0, left.setCtrSet(leftSet.markChecked(leftLen)));
            return new ContextSet<>(session, next, failed, stopped);
        }

        List<Context<T>> marked = new ArrayList<>(2);
        marked.add(left.setCtrSet(leftSet.markChecked(leftLen)));
        marked.add(right.setCtrSet(rightSet.markChecked(rightLen)));
        ContextSet<T> markedSet = new ContextSet<>(session, marked, failed, stopped);

        int oldLen = oldCtx.ctrSet.count();
        if (!(onlyFreshSymbols(leftSet, oldLen, symIdMax) && onlyFreshSymbols(rightSet, oldLen, symIdMax))
                && !isComplementaryFork(leftSet, rightSet, oldLen)) {
            return markedSet;
        }

        ShValue leftRet = left.retVal instanceof ShValue ? (ShValue) left.retVal : SVNone.create(null);
        ShValue rightRet = right.retVal instanceof ShValue ? (ShValue) right.retVal : SVNone.create(null);
        ValueMatcher matcher = new ValueMatcher(left, right, heapLimit, symIdMax);
        if (!matcher.eq(leftRet, rightRet)) {
            return markedSet;
        }

        Map<Integer, ShValue> pure = oldHeap.entriesUpTo(heapLimit);
        if (!left.heap.entriesUpTo(heapLimit).equals(pure) || !right.heap.entriesUpTo(heapLimit).equals(pure)) {
            return markedSet;
        }

        Debug.get().d(Debug.TAG_CTX, "pruned pure call: 2 paths merged");
        return create(session, Collections.singletonList(left.setCtrSet(oldCtx.ctrSet)), failed, stopped);
    }

    private static boolean onlyFreshSymbols(ConstraintSet set, int from, int symIdMax) {
        for (int i = from; i < set.count(); i++) {
            for (int sym : set.getConstraint(i).extractSymbols()) {
                if (sym <= symIdMax) return false;
            }
        }
        return true;
    }

    /** True when each side added exactly one constraint and one is the negation of the other. */
    private static boolean isComplementaryFork(ConstraintSet leftSet, ConstraintSet rightSet, int from) {
        if (leftSet.count() != from + 1 || rightSet.count() != from + 1) return false;
        Constraint l = leftSet.getConstraint(from);
        Constraint r = rightSet.getConstraint(from);
        if (r instanceof Constraint.Not && ((Constraint.Not) r).constraint.id == l.id) return true;
        return l instanceof Constraint.Not && ((Constraint.Not) l).constraint.id == r.id;
    }

    /**
     * Deep equality of two return values. Objects at or below the heap limit must have the
     * same address; newer objects are matched through an address map built greedily.
     */
    private static final class ValueMatcher {
        private final Context<?> left;
        private final Context<?> right;
        private final int heapLimit;
        private final int symIdMax;
        private final Map<Integer, Integer> eqMap = new HashMap<>();

        ValueMatcher(Context<?> left, Context<?> right, int heapLimit, int symIdMax) {
            this.left = left;
            this.right = right;
            this.heapLimit = heapLimit;
            this.symIdMax = symIdMax;
        }

        boolean eq(ShValue lv, ShValue rv) {
            lv = left.heap.fetchAddr(lv);
            rv = right.heap.fetchAddr(rv);
            if (lv == null && rv == null) return true;
            if (lv == null || rv == null) return false;
            if (lv.type() != rv.type()) return false;

            switch (lv.type()) {
                case INT:
                    return symbolicEq(((SVInt) lv).value, ((SVInt) rv).value);
                case FLOAT:
                    return symbolicEq(((SVFloat) lv).value, ((SVFloat) rv).value);
                case STRING:
                    return symbolicEq(((SVString) lv).value, ((SVString) rv).value);
                case BOOL:
                    return symbolicEq(((SVBool) lv).value, ((SVBool) rv).value);
                case OBJECT:
                case SIZE:
                    return objectEq((ObjectLike) lv, (ObjectLike) rv);
                case FUNC:
                case ERROR:
                    return lv == rv;
                case NONE:
                case NOT_IMPL:
                case UNDEF:
                    return true;
                default:
                    return false;
            }
        }

        private boolean symbolicEq(SymExp l, SymExp r) {
            SymExp ls = ExpSimplifier.simplifyExp(left.ctrSet, l);
            SymExp rs = ExpSimplifier.simplifyExp(right.ctrSet, r);
            for (int sym : ls.extractSymbols()) {
                if (sym > symIdMax) return false;
            }
            for (int sym : rs.extractSymbols()) {
                if (sym > symIdMax) return false;
            }
            return SymExp.isStructuallyEq(ls, rs);
        }

        private boolean objectEq(ObjectLike lo, ObjectLike ro) {
            int laddr = lo.addr().addr;
            int raddr = ro.addr().addr;
            if (laddr <= heapLimit || raddr <= heapLimit) {
                return laddr == raddr;
            }
            Integer mapped = eqMap.get(laddr);
            if (mapped != null) {
                return mapped == raddr;
            }
            eqMap.put(laddr, raddr);

            if (lo.shape() != null) {
                if (ro.shape() == null) return false;
                SymExp ls = ExpSimplifier.simplifyExp(left.ctrSet, lo.shape());
                SymExp rs = ExpSimplifier.simplifyExp(right.ctrSet, ro.shape());
                if (!SymExp.isStructuallyEq(ls, rs)) return false;
            } else if (ro.shape() != null) {
                return false;
            }

            SVObject l = lo.object();
            SVObject r = ro.object();
            if (l.keyValues.size() != r.keyValues.size() || l.indices.size() != r.indices.size()
                    || l.attrs.size() != r.attrs.size()) {
                return false;
            }
            for (Map.Entry<String, ShValue> e : l.keyValues.entrySet()) {
                if (!eq(e.getValue(), r.keyValues.get(e.getKey()))) return false;
            }
            for (Map.Entry<Integer, ShValue> e : l.indices.entrySet()) {
                if (!eq(e.getValue(), r.indices.get(e.getKey()))) return false;
            }
            for (Map.Entry<String, ShValue> e : l.attrs.entrySet()) {
                if (!eq(e.getValue(), r.attrs.get(e.getKey()))) return false;
            }
            return true;
        }
    }

    @Override
    public String toString() {
        return "ContextSet{live=" + ctxList.size() + ", failed=" + failed.size() + ", stopped=" + stopped.size() + "}";
    }
}
