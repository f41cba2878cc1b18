package com.shapetea.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.shapetea.constraint.CSResult;
import com.shapetea.constraint.Constraint;
import com.shapetea.constraint.ConstraintSet;
import com.shapetea.constraint.ConstraintType;
import com.shapetea.constraint.ExpSimplifier;
import com.shapetea.context.ShValue.ObjectLike;
import com.shapetea.context.ShValue.SVAddr;
import com.shapetea.context.ShValue.SVError;
import com.shapetea.context.ShValue.SVInt;
import com.shapetea.context.ShValue.SVObject;
import com.shapetea.context.ShValue.SVSize;
import com.shapetea.ir.CodeSource;
import com.shapetea.symbolic.ExpBool;
import com.shapetea.symbolic.ExpNum;
import com.shapetea.symbolic.ExpShape;
import com.shapetea.symbolic.NumRange;
import com.shapetea.symbolic.SymExp;
import com.shapetea.symbolic.SymVal;
import com.shapetea.util.PList;

/**
 * One node of the exploration tree: environment, heap, constraint set and the value the
 * last evaluation step produced. Immutable; every setter returns a new context.
 *
 * <p>A context with {@link #failed} set is a terminated path. It stays a plain context until
 * it is put into a {@link ContextSet}, which files it as failed or stopped.
 */
public final class Context<T> {

    private final AnalysisSession session;

    public final ShEnv env;
    public final ShHeap heap;
    public final ConstraintSet ctrSet;
    public final T retVal;
    public final List<CallFrame> callStack;
    public final PList<ShValue> logs;
    public final ShEnv imported;
    public final String relPath;
    public final SVError failed;
    public final int failId;

    private Context(AnalysisSession session, ShEnv env, ShHeap heap, ConstraintSet ctrSet, T retVal,
                    List<CallFrame> callStack, PList<ShValue> logs, ShEnv imported, String relPath,
                    SVError failed, int failId) {
        this.session = session;
        this.env = env;
        this.heap = heap;
        this.ctrSet = ctrSet;
        this.retVal = retVal;
        this.callStack = callStack;
        this.logs = logs;
        this.imported = imported;
        this.relPath = relPath;
        this.failed = failed;
        this.failId = failId;
    }

    static Context<ShValue> root(AnalysisSession session, ConstraintSet ctrSet, String relPath) {
        return new Context<>(session, ShEnv.empty(), ShHeap.empty(), ctrSet, null, Collections.emptyList(),
                PList.empty(), ShEnv.empty(), relPath == null ? "" : relPath, null, -1);
    }

    public AnalysisSession session() {
        return session;
    }

    // ===================== SETTERS =====================

    public Context<T> setEnv(ShEnv newEnv) {
        return new Context<>(session, newEnv, heap, ctrSet, retVal, callStack, logs, imported, relPath, failed, failId);
    }

    public Context<T> setHeap(ShHeap newHeap) {
        return new Context<>(session, env, newHeap, ctrSet, retVal, callStack, logs, imported, relPath, failed, failId);
    }

    public Context<T> setCtrSet(ConstraintSet newCtrSet) {
        return new Context<>(session, env, heap, newCtrSet, retVal, callStack, logs, imported, relPath, failed, failId);
    }

    public <A> Context<A> setRetVal(A newRetVal) {
        return new Context<>(session, env, heap, ctrSet, newRetVal, callStack, logs, imported, relPath, failed, failId);
    }

    public Context<T> setRelPath(String newRelPath) {
        return new Context<>(session, env, heap, ctrSet, retVal, callStack, logs, imported, newRelPath, failed, failId);
    }

    public Context<T> setImported(ShEnv newImported) {
        return new Context<>(session, env, heap, ctrSet, retVal, callStack, logs, newImported, relPath, failed, failId);
    }

    Context<T> setFailId(int newFailId) {
        return new Context<>(session, env, heap, ctrSet, retVal, callStack, logs, imported, relPath, failed, newFailId);
    }

    public Context<T> addLog(String message, CodeSource source) {
        return addLogValue(SVError.log(message, source));
    }

    public Context<T> addLogValue(ShValue log) {
        return new Context<>(session, env, heap, ctrSet, retVal, callStack, logs.append(log), imported, relPath,
                failed, failId);
    }

    public Context<T> pushCallStack(CallFrame frame) {
        List<CallFrame> next = new ArrayList<>(callStack.size() + 1);
        next.addAll(callStack);
        next.add(frame);
        return new Context<>(session, env, heap, ctrSet, retVal, Collections.unmodifiableList(next), logs, imported,
                relPath, failed, failId);
    }

    public Context<T> popCallStack() {
        if (callStack.isEmpty()) return this;
        List<CallFrame> next = new ArrayList<>(callStack.subList(0, callStack.size() - 1));
        return new Context<>(session, env, heap, ctrSet, retVal, Collections.unmodifiableList(next), logs, imported,
                relPath, failed, failId);
    }

    public ContextSet<T> toSet() {
        return ContextSet.fromCtx(this);
    }

    public <A> ContextSet<A> toSetWith(A value) {
        return ContextSet.fromCtx(setRetVal(value));
    }

    /** Shifts every address to the negative range so a fresh heap can be layered on top. */
    public Context<T> asDefault() {
        int offset = -heap.addrMax - 1;
        return setEnv(env.addOffset(offset)).setHeap(heap.addOffset(offset));
    }

    // ===================== WARN / FAIL =====================

    public Context<ShValue> warn(SVError warning) {
        return this.<ShValue>setRetVal(warning).addLogValue(warning);
    }

    public Context<ShValue> warnWithMsg(String message, CodeSource source) {
        return warn(SVError.warn(message, source));
    }

    /** Logs the warning and returns a tensor of fully unknown shape so execution can continue. */
    public ContextSet<ShValue> warnTensor(SVError warning) {
        Context<T> ctx = addLogValue(warning);
        CodeSource source = warning.source;
        SymVal rank = ctx.genSymInt("WarnTempRank", source);
        SymVal shape = ctx.genSymShape("WarnTempShape", ExpNum.fromSymbol(rank), source);
        return ctx.genTensor(ExpShape.fromSymbol(shape), source).toSet();
    }

    public ContextSet<ShValue> warnTensorWithMsg(String message, CodeSource source) {
        return warnTensor(SVError.warn(message, source));
    }

    /** Logs the warning and returns a Size of fully unknown shape. */
    public Context<ShValue> warnSize(SVError warning) {
        Context<T> ctx = addLogValue(warning);
        CodeSource source = warning.source;
        SymVal rank = ctx.genSymInt("WarnTempRank", source);
        SymVal shape = ctx.genSymShape("WarnTempShape", ExpNum.fromSymbol(rank), source);
        return ctx.genSize(ExpShape.fromSymbol(shape), source);
    }

    public Context<ShValue> warnSizeWithMsg(String message, CodeSource source) {
        return warnSize(SVError.warn(message, source));
    }

    /** Terminates this path. The result value is kept until the context is filed into a set. */
    public Context<T> fail(SVError error) {
        return new Context<>(session, env, heap, ctrSet, retVal, callStack, logs.append(error), imported, relPath,
                error, session.nextFailId());
    }

    public Context<T> failWithMsg(String message, CodeSource source) {
        return fail(SVError.error(message, source));
    }

    /** Fails this path and files it into a set of any result type. */
    public <A> ContextSet<A> failToSet(String message, CodeSource source) {
        return ContextSet.fromCtx(this.<A>setRetVal(null).failWithMsg(message, source));
    }

    public boolean isFailed() {
        return failed != null;
    }

    public boolean isTimedOut() {
        return failed != null && failed.reason.startsWith("timeout expired");
    }

    // ===================== ALLOCATION =====================

    public Context<ShValue> genObject(CodeSource source) {
        ShHeap.Allocated alloc = heap.malloc(source);
        SVObject obj = SVObject.create(alloc.addr, source);
        return setHeap(alloc.heap.setVal(alloc.addr, obj)).setRetVal((ShValue) alloc.addr);
    }

    public Context<ShValue> genList(List<ShValue> values, CodeSource source) {
        return genSequence(values, "list", source);
    }

    public Context<ShValue> genTuple(List<ShValue> values, CodeSource source) {
        return genSequence(values, "tuple", source);
    }

    private Context<ShValue> genSequence(List<ShValue> values, String className, CodeSource source) {
        ShHeap.Allocated alloc = heap.malloc(source);
        SVObject obj = SVObject.create(alloc.addr, source);
        for (int i = 0; i < values.size(); i++) {
            obj = obj.setIndice(i, values.get(i));
        }
        obj = obj.setAttr("$length", SVInt.of(values.size(), source));
        obj = attachMro(obj, className);
        return setHeap(alloc.heap.setVal(alloc.addr, obj)).setRetVal((ShValue) alloc.addr);
    }

    /** Copies {@code __mro__} of the named builtin class when the environment defines it. */
    private SVObject attachMro(SVObject obj, String className) {
        SVAddr classAddr = env.getId(className);
        if (classAddr == null) return obj;
        ShValue classObj = heap.getValRecur(classAddr);
        if (!(classObj instanceof ObjectLike)) return obj;
        ShValue mro = ((ObjectLike) classObj).getAttr("__mro__");
        return mro == null ? obj : obj.setAttr("__mro__", mro);
    }

    /** Allocates a Size value wrapping {@code shape}; returns its address. */
    public Context<ShValue> genSize(ExpShape shape, CodeSource source) {
        ShHeap.Allocated alloc = heap.malloc(source);
        SVObject obj = attachMro(SVObject.create(alloc.addr, source), "Size");
        SVSize size = new SVSize(obj, shape);
        return setHeap(alloc.heap.setVal(alloc.addr, size)).setRetVal((ShValue) alloc.addr);
    }

    /**
     * Allocates a tensor object of the given shape. Its {@code shape} attribute points to a
     * freshly allocated Size.
     */
    public Context<ShValue> genTensor(ExpShape shape, CodeSource source) {
        Context<ShValue> sizeCtx = genSize(shape, source);
        SVAddr sizeAddr = (SVAddr) sizeCtx.retVal;
        ShHeap.Allocated alloc = sizeCtx.heap.malloc(source);
        SVObject tensor = SVObject.create(alloc.addr, source).withShape(shape).setAttr("shape", sizeAddr);
        tensor = sizeCtx.attachMro(tensor, "Tensor");
        return sizeCtx.setHeap(alloc.heap.setVal(alloc.addr, tensor)).setRetVal((ShValue) alloc.addr);
    }

    // ===================== SYMBOLS =====================

    public SymVal genSymInt(String name, CodeSource source) {
        return ctrSet.genSymInt(name, source);
    }

    public SymVal genSymFloat(String name, CodeSource source) {
        return ctrSet.genSymFloat(name, source);
    }

    public SymVal genSymBool(String name, CodeSource source) {
        return ctrSet.genSymBool(name, source);
    }

    public SymVal genSymString(String name, CodeSource source) {
        return ctrSet.genSymString(name, source);
    }

    public SymVal genSymShape(String name, ExpNum rank, CodeSource source) {
        return ctrSet.genSymShape(name, rank, source);
    }

    public Context<ExpNum> genIntEq(String name, ExpNum value, CodeSource source) {
        CSResult<SymVal> res = ctrSet.genSymIntEq(name, value, source);
        return setCtrSet(res.ctrSet).setRetVal((ExpNum) ExpNum.fromSymbol(res.value));
    }

    public Context<ExpNum> genIntGte(String name, ExpNum min, CodeSource source) {
        ExpNum exp = ExpNum.fromSymbol(genSymInt(name, source));
        return guarantee(genLte(min, exp, source)).setRetVal(exp);
    }

    public Context<ExpNum> genIntGte(String name, double min, CodeSource source) {
        return genIntGte(name, ExpNum.fromConst(min, source), source);
    }

    public Context<ExpNum> genFloatGte(String name, ExpNum min, CodeSource source) {
        ExpNum exp = ExpNum.fromSymbol(genSymFloat(name, source));
        return guarantee(genLte(min, exp, source)).setRetVal(exp);
    }

    /**
     * Shape of constant rank. Dimensions given in {@code partialDims} (negative keys count
     * from the end) are used as is and required to be non-negative; every other dimension is
     * a fresh integer symbol {@code >= 0}.
     */
    public ContextSet<ExpShape> genConstRankedShape(int rank, CodeSource source, Map<Integer, ExpNum> partialDims) {
        if (rank < 0) {
            return failToSet("from 'genRankedShape': got negative rank " + rank, source);
        }
        List<ExpNum> dims = new ArrayList<>(rank);
        Context<T> ctx = this;
        for (int i = 0; i < rank; i++) {
            ExpNum part = partialDims == null ? null : partialDims.get(i);
            if (part == null && partialDims != null) {
                part = partialDims.get(i - rank);
            }
            if (part != null) {
                dims.add(part);
                continue;
            }
            Context<ExpNum> dim = ctx.genIntGte("tempDim" + i, 0, source);
            dims.add(dim.retVal);
            ctx = dim.setRetVal(ctx.retVal);
        }

        ExpShape shape = ExpShape.fromConst(rank, dims, source);
        if (partialDims != null && !partialDims.isEmpty()) {
            List<Constraint> nonNeg = new ArrayList<>();
            for (ExpNum part : partialDims.values()) {
                nonNeg.add(ctx.genLte(0, part, source));
            }
            return ctx.require(nonNeg, "from 'genRankedShape': got negative partialDims", source).returnValue(shape);
        }
        return ctx.toSetWith(shape);
    }

    /**
     * Shape of a possibly symbolic rank. A small bounded rank yields a slice of a constant
     * shape of the maximal rank; an unbounded rank yields a shape symbol.
     */
    public ContextSet<ExpShape> genRankedShape(ExpNum rank, CodeSource source, Map<Integer, ExpNum> partialDims) {
        NumRange rankRng = getCachedRange(rank);
        if (rankRng == null || Boolean.TRUE.equals(rankRng.lt(0))) {
            return failToSet("from 'genRankedShape': invalid rank " + rank, source);
        }
        if (rankRng.isConst()) {
            return genConstRankedShape((int) rankRng.end, source, partialDims);
        }

        ContextSet<T> ctxSet;
        if (partialDims != null && !partialDims.isEmpty()) {
            List<Constraint> nonNeg = new ArrayList<>();
            for (ExpNum part : partialDims.values()) {
                nonNeg.add(genLte(0, part, source));
            }
            ctxSet = require(nonNeg, "from 'genRankedShape': got negative partialDims", source);
        } else {
            ctxSet = toSet();
        }

        return ctxSet
                .require(genLte(0, rank, source), "genRankedShape got negative rank " + rank, source)
                .flatMap(ctx -> {
                    if (rankRng.end != Double.POSITIVE_INFINITY && rankRng.end <= 20) {
                        return ctx.genConstRankedShape((int) rankRng.end, source, partialDims)
                                .map(c -> c.setRetVal(
                                        (ExpShape) ExpShape.slice(c.retVal, ExpNum.fromConst(0, source), rank, source)));
                    }
                    SymVal symShape = ctx.genSymShape("temp", rank, source);
                    ExpShape expShape = ExpShape.fromSymbol(symShape);
                    Context<T> guaranteed = ctx;
                    if (partialDims != null) {
                        for (Map.Entry<Integer, ExpNum> e : partialDims.entrySet()) {
                            int idx = e.getKey();
                            ExpNum idxExp = idx >= 0
                                    ? ExpNum.fromConst(idx, source)
                                    : ExpNum.bop(ExpNum.BopType.ADD, rank, idx, source);
                            guaranteed = guaranteed.guarantee(
                                    guaranteed.genEq(ExpNum.index(expShape, idxExp, source), e.getValue(), source));
                        }
                    }
                    return guaranteed.toSetWith(expShape);
                });
    }

    // ===================== CONSTRAINT BUILDERS =====================

    public Constraint genBool(ExpBool pred, CodeSource source) {
        return ctrSet.genEquality(ConstraintType.EQUAL, pred, ExpBool.fromConst(true, source), source);
    }

    public Constraint genEq(SymExp left, SymExp right, CodeSource source) {
        return ctrSet.genEquality(ConstraintType.EQUAL, left, right, source);
    }

    public Constraint genEq(SymExp left, double right, CodeSource source) {
        return genEq(left, ExpNum.fromConst(right, source), source);
    }

    public Constraint genNeq(SymExp left, SymExp right, CodeSource source) {
        return ctrSet.genEquality(ConstraintType.NOT_EQUAL, left, right, source);
    }

    public Constraint genLt(ExpNum left, ExpNum right, CodeSource source) {
        return ctrSet.genNumCompare(ConstraintType.LESS_THAN, left, right, source);
    }

    public Constraint genLt(double left, ExpNum right, CodeSource source) {
        return genLt(ExpNum.fromConst(left, source), right, source);
    }

    public Constraint genLt(ExpNum left, double right, CodeSource source) {
        return genLt(left, ExpNum.fromConst(right, source), source);
    }

    public Constraint genLte(ExpNum left, ExpNum right, CodeSource source) {
        return ctrSet.genNumCompare(ConstraintType.LESS_THAN_OR_EQUAL, left, right, source);
    }

    public Constraint genLte(double left, ExpNum right, CodeSource source) {
        return genLte(ExpNum.fromConst(left, source), right, source);
    }

    public Constraint genLte(ExpNum left, double right, CodeSource source) {
        return genLte(left, ExpNum.fromConst(right, source), source);
    }

    public Constraint genAnd(Constraint left, Constraint right, CodeSource source) {
        return ctrSet.genAnd(left, right, source);
    }

    public Constraint genOr(Constraint left, Constraint right, CodeSource source) {
        return ctrSet.genOr(left, right, source);
    }

    public Constraint genNot(Constraint constraint, CodeSource source) {
        return ctrSet.genNot(constraint, source);
    }

    public Constraint genBroadcastable(ExpShape left, ExpShape right, CodeSource source) {
        return ctrSet.genBroad(left, right, source);
    }

    public Constraint genForall(SymVal symbol, ExpNum rangeStart, ExpNum rangeEnd, Constraint constraint,
                                CodeSource source) {
        return ctrSet.genForall(symbol, rangeStart, rangeEnd, constraint, source);
    }

    public Constraint genFail(String reason, CodeSource source) {
        return ctrSet.genFail(reason, source);
    }

    // ===================== SHAPES =====================

    /** Parsed size: exactly one of {@code shape} and {@code error} is set. */
    public static final class ParsedSize {
        public final ExpShape shape;
        public final String error;

        private ParsedSize(ExpShape shape, String error) {
            this.shape = shape;
            this.error = error;
        }

        public static ParsedSize of(ExpShape shape) {
            return new ParsedSize(shape, null);
        }

        public static ParsedSize error(String error) {
            return new ParsedSize(null, error);
        }
    }

    /**
     * Reads a shape out of a Size or an iterable of integers. A value that cannot be parsed is
     * not a failure; the returned error message lets the caller decide.
     */
    public ContextSet<ParsedSize> parseSize(ShValue iterable, CodeSource source) {
        ShValue sizeObj = heap.fetchAddr(iterable);
        if (!(sizeObj instanceof ObjectLike)) {
            return toSetWith(ParsedSize.error("value is not iterable; cannot parse to size."));
        }
        if (sizeObj instanceof SVSize) {
            return toSetWith(ParsedSize.of(((SVSize) sizeObj).shape));
        }
        SVObject obj = (SVObject) sizeObj;
        ShValue rankValue = heap.fetchAddr(obj.getAttr("$length"));
        if (!(rankValue instanceof SVInt)) {
            return toSetWith(ParsedSize.error("value is not iterable; cannot parse to size."));
        }
        Map<Integer, ExpNum> dims = obj.extractIndexedNumber(heap);
        return genRankedShape(((SVInt) rankValue).value, source, dims).map(ctx -> ctx.setRetVal(ParsedSize.of(ctx.retVal)));
    }

    public ContextSet<ExpShape> shBroadcast(ExpShape left, ExpShape right, CodeSource source) {
        ExpShape broad = ExpSimplifier.simplifyShape(ctrSet, ExpShape.broadcast(left, right, source));
        return require(genBroadcastable(left, right, source), "shape is not broadcastable", source).returnValue(broad);
    }

    /** Drops dimension {@code axis}. */
    public ContextSet<ExpShape> shReduce(ExpShape shape, ExpNum axis, CodeSource source) {
        ExpShape left = ExpShape.slice(shape, null, axis, source);
        ExpShape right = ExpShape.slice(shape, ExpNum.bop(ExpNum.BopType.ADD, axis, 1, source), null, source);
        ExpShape reduced = ExpSimplifier.simplifyShape(ctrSet, ExpShape.concat(left, right, source));
        return toSetWith(reduced);
    }

    public ContextSet<ExpShape> shMatmul(ExpShape left, ExpShape right, CodeSource source) {
        ExpNum leftRank = ExpShape.getRank(left);
        ExpNum rightRank = ExpShape.getRank(right);
        ExpNum leftMDim = ExpNum.index(left, ExpNum.bop(ExpNum.BopType.SUB, leftRank, 1, source), source);
        ExpNum rightMDim = ExpNum.index(right, ExpNum.bop(ExpNum.BopType.SUB, rightRank, 2, source), source);

        List<Constraint> rankCtrs = new ArrayList<>();
        rankCtrs.add(genLte(2, leftRank, source));
        rankCtrs.add(genLte(2, rightRank, source));

        return require(rankCtrs, "from 'matmul': rank should be greater than 1", source)
                .flatMap(ctx -> ctx.require(ctx.genEq(leftMDim, rightMDim, source),
                        "from 'matmul': dimension mismatch", source))
                .flatMap(ctx -> ctx.shBroadcast(
                        ExpShape.slice(left, ExpNum.fromConst(0, source),
                                ExpNum.bop(ExpNum.BopType.SUB, leftRank, 2, source), source),
                        ExpShape.slice(right, ExpNum.fromConst(0, source),
                                ExpNum.bop(ExpNum.BopType.SUB, rightRank, 2, source), source),
                        source))
                .map(ctx -> {
                    ExpNum leftLDim = ExpNum.index(left, ExpNum.bop(ExpNum.BopType.SUB, leftRank, 2, source), source);
                    ExpNum rightRDim = ExpNum.index(right, ExpNum.bop(ExpNum.BopType.SUB, rightRank, 1, source), source);
                    List<ExpNum> last = new ArrayList<>();
                    last.add(leftLDim);
                    last.add(rightRDim);
                    ExpShape matmul = ExpShape.concat(ctx.retVal, ExpShape.fromConst(2, last, source), source);
                    return ctx.setRetVal(ExpSimplifier.simplifyShape(ctx.ctrSet, matmul));
                });
    }

    /** Inserts a new dimension of size {@code count} before {@code axis}. */
    public ContextSet<ExpShape> shRepeat(ExpShape shape, ExpNum axis, ExpNum count, CodeSource source) {
        ExpNum rank = ExpShape.getRank(shape);
        Constraint axisCtr = genAnd(genLte(0, axis, source), genLte(axis, rank, source), source);
        Constraint countCtr = genLte(0, count, source);
        List<Constraint> ctrs = new ArrayList<>();
        ctrs.add(axisCtr);
        ctrs.add(countCtr);

        return require(ctrs, "shRepeat constraint failed", source).map(ctx -> {
            ExpShape leftShape = ExpShape.slice(shape, null, axis, source);
            ExpShape rightShape = ExpShape.slice(shape, axis, null, source);
            List<ExpNum> countDim = new ArrayList<>();
            countDim.add(count);
            ExpShape repeated = ExpShape.concat(
                    ExpShape.concat(leftShape, ExpShape.fromConst(1, countDim, source), source), rightShape, source);
            return ctx.setRetVal(ExpSimplifier.simplifyShape(ctx.ctrSet, repeated));
        });
    }

    /**
     * Maps a possibly negative axis into {@code [0, rank)} by adding the rank. A symbolic axis
     * forks on its sign.
     */
    public ContextSet<ExpNum> normalizeAxis(ExpNum axis, ExpNum rank, CodeSource source) {
        ExpNum shifted = ExpNum.bop(ExpNum.BopType.ADD, rank, axis, source);
        if (axis.isConst()) {
            return toSetWith(axis.constValue() < 0 ? ExpSimplifier.simplifyNum(ctrSet, shifted) : axis);
        }
        ContextSet.Branches<T> branches = ifThenElse(genLte(0, axis, source), source);
        ContextSet<ExpNum> positive = branches.thenSet.returnValue(axis);
        ContextSet<ExpNum> negative = branches.elseSet.map(
                ctx -> ctx.setRetVal(ExpSimplifier.simplifyNum(ctx.ctrSet, shifted)));
        return positive.join(negative);
    }

    /** Swaps two non-negative axes. */
    public ContextSet<ExpShape> shTranspose(ExpShape shape, ExpNum axis0, ExpNum axis1, CodeSource source) {
        ExpShape swapped = ExpShape.setDim(
                ExpShape.setDim(shape, axis0, ExpNum.index(shape, axis1, source), source),
                axis1, ExpNum.index(shape, axis0, source), source);
        return toSetWith(ExpSimplifier.simplifyShape(ctrSet, swapped));
    }

    /** Inserts a dimension of size 1 before {@code axis}; {@code axis} may equal the rank. */
    public ContextSet<ExpShape> shUnsqueeze(ExpShape shape, ExpNum axis, CodeSource source) {
        ExpNum rank = ExpShape.getRank(shape);
        List<Constraint> ctrs = new ArrayList<>();
        ctrs.add(genLte(0, axis, source));
        ctrs.add(genLte(axis, rank, source));

        return require(ctrs, "from 'LibCall.shape.unsqueeze': dim must be within rank", source).map(ctx -> {
            List<ExpNum> one = new ArrayList<>();
            one.add(ExpNum.fromConst(1, source));
            ExpShape unsqueezed = ExpShape.concat(
                    ExpShape.concat(ExpShape.slice(shape, null, axis, source), ExpShape.fromConst(1, one, source),
                            source),
                    ExpShape.slice(shape, axis, null, source), source);
            return ctx.setRetVal(ExpSimplifier.simplifyShape(ctx.ctrSet, unsqueezed));
        });
    }

    /** Collapses dimensions {@code start..end} (inclusive) into their product. */
    public ContextSet<ExpShape> shFlatten(ExpShape shape, ExpNum start, ExpNum end, CodeSource source) {
        ExpNum rank = ExpShape.getRank(shape);
        ExpNum afterEnd = ExpNum.bop(ExpNum.BopType.ADD, end, 1, source);
        List<Constraint> ctrs = new ArrayList<>();
        ctrs.add(genLte(0, start, source));
        ctrs.add(genLte(start, end, source));
        ctrs.add(genLt(end, rank, source));

        return require(ctrs, "from 'LibCall.shape.flatten': start_dim and end_dim must be within rank", source)
                .map(ctx -> {
                    List<ExpNum> middle = new ArrayList<>();
                    middle.add(ExpNum.numel(ExpShape.slice(shape, start, afterEnd, source), source));
                    ExpShape flat = ExpShape.concat(
                            ExpShape.concat(ExpShape.slice(shape, null, start, source),
                                    ExpShape.fromConst(1, middle, source), source),
                            ExpShape.slice(shape, afterEnd, null, source), source);
                    return ctx.setRetVal(ExpSimplifier.simplifyShape(ctx.ctrSet, flat));
                });
    }

    /** Reinterprets {@code shape} as {@code target}; both must hold the same number of elements. */
    public ContextSet<ExpShape> shView(ExpShape shape, ExpShape target, CodeSource source) {
        Constraint sameNumel = genEq(ExpNum.numel(shape, source), ExpNum.numel(target, source), source);
        return require(sameNumel, "from 'LibCall.shape.view': number of elements mismatch", source)
                .map(ctx -> ctx.setRetVal(ExpSimplifier.simplifyShape(ctx.ctrSet, target)));
    }

    /**
     * Concatenates along a non-negative axis. Every shape must have the rank of the first one
     * and agree with it outside the axis.
     */
    public ContextSet<ExpShape> shCat(List<ExpShape> shapes, ExpNum axis, CodeSource source) {
        ExpShape first = shapes.get(0);
        ExpNum rank = ExpShape.getRank(first);
        ExpNum next = ExpNum.bop(ExpNum.BopType.ADD, axis, 1, source);
        ExpShape front = ExpShape.slice(first, null, axis, source);
        ExpShape back = ExpShape.slice(first, next, null, source);

        List<Constraint> ctrs = new ArrayList<>();
        ctrs.add(genLte(0, axis, source));
        ctrs.add(genLt(axis, rank, source));
        ExpNum thickness = ExpNum.index(first, axis, source);
        for (int i = 1; i < shapes.size(); i++) {
            ExpShape other = shapes.get(i);
            ctrs.add(genEq(ExpShape.getRank(other), rank, source));
            ctrs.add(genEq(front, ExpShape.slice(other, null, axis, source), source));
            ctrs.add(genEq(back, ExpShape.slice(other, next, null, source), source));
            thickness = ExpNum.bop(ExpNum.BopType.ADD, thickness, ExpNum.index(other, axis, source), source);
        }

        List<ExpNum> thick = new ArrayList<>();
        thick.add(thickness);
        ExpShape result = ExpShape.concat(ExpShape.concat(front, ExpShape.fromConst(1, thick, source), source),
                back, source);
        return require(ctrs, "from 'LibCall.shape.cat': tensor shapes must match, dim must be within rank", source)
                .map(ctx -> ctx.setRetVal(ExpSimplifier.simplifyShape(ctx.ctrSet, result)));
    }

    // ===================== CONSTRAINTS =====================

    public ContextSet<T> require(Constraint ctr, String failMsg, CodeSource source) {
        return toSet().require(ctr, failMsg, source);
    }

    public ContextSet<T> require(List<Constraint> ctrs, String failMsg, CodeSource source) {
        return toSet().require(ctrs, failMsg, source);
    }

    public Context<T> guarantee(Constraint ctr) {
        return setCtrSet(ctrSet.guarantee(ctr));
    }

    public Context<T> guarantee(List<Constraint> ctrs) {
        return setCtrSet(ctrSet.guaranteeAll(ctrs));
    }

    public ContextSet.Branches<T> ifThenElse(Constraint ctr, CodeSource source) {
        return toSet().ifThenElse(ctr, source);
    }

    public NumRange getCachedRange(ExpNum num) {
        return ctrSet.getCachedRange(num);
    }

    public NumRange getCachedRange(double num) {
        return NumRange.fromConst(num);
    }

    public Boolean checkImmediate(Constraint constraint) {
        return ctrSet.checkImmediate(constraint);
    }

    public boolean hasPathCtr() {
        return !ctrSet.getPathIds().isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("ENV: ").append(env).append('\n');
        sb.append("HEAP: ").append(heap).append('\n');
        sb.append("CONSTRAINTS:\n").append(ctrSet).append('\n');
        sb.append("RETVAL: ").append(retVal);
        if (failed != null) {
            sb.append("\nFAILED: ").append(failed);
        }
        return sb.toString();
    }
}
