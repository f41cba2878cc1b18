package com.shapetea.constraint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.shapetea.ir.CodeSource;
import com.shapetea.symbolic.ExpBool;
import com.shapetea.symbolic.ExpNum;
import com.shapetea.symbolic.ExpShape;
import com.shapetea.symbolic.ExpString;
import com.shapetea.symbolic.LinearForm;
import com.shapetea.symbolic.NumRange;
import com.shapetea.symbolic.SymExp;
import com.shapetea.symbolic.SymVal;
import com.shapetea.symbolic.SymbolType;
import com.shapetea.util.PList;
import com.shapetea.util.PMap;

/**
 * Immutable, persistent set of constraints collected along one execution path.
 *
 * <p>The pool only ever grows. Three index lists partition it by role: hard constraints
 * (guaranteed facts, refine the caches), soft constraints (requirements that may be
 * violated, never refine the caches) and path constraints (branch conditions, refine the
 * caches). Every mutator returns a new set; forks share structure through {@link PList}
 * and {@link PMap}.
 */
public final class ConstraintSet {

    private final IdManager idManager;
    private final boolean immediateCheck;

    private PList<Constraint> ctrPool;
    private PList<Integer> hardCtr;
    private PList<Integer> softCtr;
    private PList<Integer> pathCtr;
    private int notPrunedCtrMax;
    private PMap<Integer, Integer> ctrIdCache;
    private PMap<Integer, NumRange> rangeCache;
    private PMap<Integer, String> stringCache;
    private PMap<Integer, Set<String>> nonStringCache;
    private boolean valid;

    private ConstraintSet(IdManager idManager, boolean immediateCheck) {
        this.idManager = idManager;
        this.immediateCheck = immediateCheck;
        this.ctrPool = PList.empty();
        this.hardCtr = PList.empty();
        this.softCtr = PList.empty();
        this.pathCtr = PList.empty();
        this.notPrunedCtrMax = -1;
        this.ctrIdCache = PMap.empty();
        this.rangeCache = PMap.empty();
        this.stringCache = PMap.empty();
        this.nonStringCache = PMap.empty();
        this.valid = true;
    }

    public static ConstraintSet create(IdManager idManager) {
        return new ConstraintSet(idManager, true);
    }

    /**
     * @param immediateCheck when false, require/guarantee/addIf append without asking
     *                       {@link #checkImmediate(Constraint)} first.
     */
    public static ConstraintSet create(IdManager idManager, boolean immediateCheck) {
        return new ConstraintSet(idManager, immediateCheck);
    }

    private ConstraintSet copy() {
        ConstraintSet c = new ConstraintSet(idManager, immediateCheck);
        c.ctrPool = ctrPool;
        c.hardCtr = hardCtr;
        c.softCtr = softCtr;
        c.pathCtr = pathCtr;
        c.notPrunedCtrMax = notPrunedCtrMax;
        c.ctrIdCache = ctrIdCache;
        c.rangeCache = rangeCache;
        c.stringCache = stringCache;
        c.nonStringCache = nonStringCache;
        c.valid = valid;
        return c;
    }

    // ===================== ACCESSORS =====================

    public IdManager idManager() { return idManager; }

    public boolean isValid() { return valid; }

    public boolean immediateCheckEnabled() { return immediateCheck; }

    public int count() { return ctrPool.size(); }

    public List<Integer> getHardIds() { return hardCtr.toList(); }

    public List<Integer> getSoftIds() { return softCtr.toList(); }

    public List<Integer> getPathIds() { return pathCtr.toList(); }

    public int notPrunedCtrMax() { return notPrunedCtrMax; }

    /** The raw pool in insertion order. */
    public List<Constraint> getRawConstraints() {
        return ctrPool.toList();
    }

    public Constraint getConstraint(int poolIndex) {
        return ctrPool.get(poolIndex);
    }

    /** The pool with every constraint simplified against the current caches. */
    public List<Constraint> getConstraints() {
        List<Constraint> out = new ArrayList<>(ctrPool.size());
        for (Constraint c : ctrPool) {
            out.add(ExpSimplifier.simplifyConstraint(this, c));
        }
        return out;
    }

    public NumRange getSymbolRange(SymVal symbol) {
        return rangeCache.get(symbol.id);
    }

    public ConstraintSet invalidate() {
        if (!valid) return this;
        ConstraintSet c = copy();
        c.valid = false;
        return c;
    }

    /** Marks every constraint up to {@code max} (pool length) as already inspected by call pruning. */
    public ConstraintSet markChecked(int max) {
        ConstraintSet c = copy();
        c.notPrunedCtrMax = max;
        return c;
    }

    // ===================== ADDING CONSTRAINTS =====================

    /** Appends a soft constraint. A trivially false one marks the set invalid but is still kept. */
    public ConstraintSet require(Constraint constraint) {
        if (immediateCheck) {
            Boolean imm = checkImmediate(constraint);
            if (Boolean.TRUE.equals(imm)) {
                return this;
            } else if (Boolean.FALSE.equals(imm)) {
                return invalidate().pushSoft(constraint);
            }
        }
        return pushSoft(constraint);
    }

    public ConstraintSet requireAll(List<Constraint> constraints) {
        ConstraintSet cs = this;
        for (Constraint c : constraints) cs = cs.require(c);
        return cs;
    }

    /** Appends a hard constraint and refines the caches from it. */
    public ConstraintSet guarantee(Constraint constraint) {
        if (immediateCheck) {
            Boolean imm = checkImmediate(constraint);
            if (Boolean.TRUE.equals(imm)) {
                return this;
            } else if (Boolean.FALSE.equals(imm)) {
                return invalidate().pushHard(constraint);
            }
        }
        return cacheConstraint(constraint).pushHard(constraint);
    }

    public ConstraintSet guaranteeAll(List<Constraint> constraints) {
        ConstraintSet cs = this;
        for (Constraint c : constraints) cs = cs.guarantee(c);
        return cs;
    }

    /** Appends a path (branch) constraint and refines the caches from it. */
    public ConstraintSet addIf(Constraint constraint) {
        if (immediateCheck) {
            Boolean imm = checkImmediate(constraint);
            if (Boolean.TRUE.equals(imm)) {
                return this;
            } else if (Boolean.FALSE.equals(imm)) {
                return invalidate().pushPath(constraint);
            }
        }
        return cacheConstraint(constraint).pushPath(constraint);
    }

    public ConstraintSet addIfAll(List<Constraint> constraints) {
        ConstraintSet cs = this;
        for (Constraint c : constraints) cs = cs.addIf(c);
        return cs;
    }

    private ConstraintSet cacheConstraint(Constraint constraint) {
        return new ConstraintSolver(this).solve(constraint).ctrSet();
    }

    private ConstraintSet pushHard(Constraint constraint) {
        if (ctrIdCache.containsKey(constraint.id)) return this;
        ConstraintSet c = copy();
        c.hardCtr = hardCtr.append(ctrPool.size());
        c.pushPool(constraint);
        return c;
    }

    private ConstraintSet pushSoft(Constraint constraint) {
        if (ctrIdCache.containsKey(constraint.id)) return this;
        ConstraintSet c = copy();
        c.softCtr = softCtr.append(ctrPool.size());
        c.pushPool(constraint);
        return c;
    }

    private ConstraintSet pushPath(Constraint constraint) {
        if (ctrIdCache.containsKey(constraint.id)) return this;
        ConstraintSet c = copy();
        c.pathCtr = pathCtr.append(ctrPool.size());
        c.pushPool(constraint);
        return c;
    }

    // only called on a fresh copy
    private void pushPool(Constraint constraint) {
        ctrIdCache = ctrIdCache.put(constraint.id, ctrPool.size());
        ctrPool = ctrPool.append(constraint);
    }

    // ===================== CACHE UPDATES (solver) =====================

    ConstraintSet withRange(int symbolId, NumRange range) {
        ConstraintSet c = copy();
        c.rangeCache = rangeCache.put(symbolId, range);
        return c;
    }

    ConstraintSet withString(int symbolId, String value) {
        ConstraintSet c = copy();
        c.stringCache = stringCache.put(symbolId, value);
        return c;
    }

    ConstraintSet withNonString(int symbolId, String value) {
        Set<String> prev = nonStringCache.get(symbolId);
        if (prev != null && prev.contains(value)) return this;
        Set<String> next = prev == null ? new HashSet<>() : new HashSet<>(prev);
        next.add(value);
        ConstraintSet c = copy();
        c.nonStringCache = nonStringCache.put(symbolId, Collections.unmodifiableSet(next));
        return c;
    }

    // ===================== SYMBOL GENERATION =====================

    public SymVal genSymInt(String name, CodeSource source) {
        return SymVal.of(SymbolType.INT, idManager.getSymId(), name, source);
    }

    public SymVal genSymFloat(String name, CodeSource source) {
        return SymVal.of(SymbolType.FLOAT, idManager.getSymId(), name, source);
    }

    public SymVal genSymBool(String name, CodeSource source) {
        return SymVal.of(SymbolType.BOOL, idManager.getSymId(), name, source);
    }

    public SymVal genSymString(String name, CodeSource source) {
        return SymVal.of(SymbolType.STRING, idManager.getSymId(), name, source);
    }

    public SymVal genSymShape(String name, ExpNum rank, CodeSource source) {
        return SymVal.shape(idManager.getSymId(), name, rank, source);
    }

    /** Fresh integer symbol guaranteed to be {@code >= min}. */
    public CSResult<SymVal> genSymIntGte(String name, ExpNum min, CodeSource source) {
        SymVal sym = genSymInt(name, source);
        Constraint ctr = genNumCompare(ConstraintType.LESS_THAN_OR_EQUAL, min, ExpNum.fromSymbol(sym), source);
        return new CSResult<>(sym, guarantee(ctr));
    }

    public CSResult<SymVal> genSymIntGte(String name, double min, CodeSource source) {
        return genSymIntGte(name, ExpNum.fromConst(min, source), source);
    }

    /**
     * Fresh integer symbol guaranteed to equal {@code value}. When the value already has a
     * valid cached range the range is copied onto the symbol directly.
     */
    public CSResult<SymVal> genSymIntEq(String name, ExpNum value, CodeSource source) {
        SymVal sym = genSymInt(name, source);
        Constraint ctr = genEquality(ConstraintType.EQUAL, ExpNum.fromSymbol(sym), value, source);
        NumRange range = getCachedRange(value);
        if (range != null && range.valid()) {
            return new CSResult<>(sym, withRange(sym.id, range).pushHard(ctr));
        }
        return new CSResult<>(sym, guarantee(ctr));
    }

    public CSResult<SymVal> genSymFloatGte(String name, ExpNum min, CodeSource source) {
        SymVal sym = genSymFloat(name, source);
        Constraint ctr = genNumCompare(ConstraintType.LESS_THAN_OR_EQUAL, min, ExpNum.fromSymbol(sym), source);
        return new CSResult<>(sym, guarantee(ctr));
    }

    /**
     * Constant-ranked shape. With {@code dims == null} every dimension is a fresh
     * non-negative integer symbol named {@code <name>_dim<i>}.
     */
    public CSResult<ExpShape.Const> genShaped(String name, int rank, List<ExpNum> dims, CodeSource source) {
        if (rank < 0) {
            throw new IllegalArgumentException("making shape '" + name + "' got negative rank " + rank);
        }
        ConstraintSet cs = this;
        List<ExpNum> newDims = new ArrayList<>(rank);
        if (dims == null) {
            for (int i = 0; i < rank; i++) {
                CSResult<SymVal> dim = cs.genSymIntGte(name + "_dim" + i, 0, source);
                cs = dim.ctrSet;
                newDims.add(ExpNum.fromSymbol(dim.value));
            }
        } else {
            newDims.addAll(dims);
        }
        return new CSResult<>(ExpShape.fromConst(rank, newDims, source), cs);
    }

    /** Reifies a boolean as 0/1 through {@code (b && n == 1) || (!b && n == 0)}. */
    public CSResult<ExpNum> castBoolToInt(ExpBool exp, CodeSource source) {
        if (exp.opType() == ExpBool.OpType.CONST) {
            return new CSResult<>(ExpNum.fromConst(((ExpBool.Const) exp).value ? 1 : 0, source), this);
        }
        Boolean isTrue = checkImmediate(exp);
        if (isTrue != null) {
            return new CSResult<>(ExpNum.fromConst(isTrue ? 1 : 0, source), this);
        }

        Constraint ctr = genFromBool(exp, source);
        Constraint ctrNot = genNot(ctr, source);
        ExpNum num = ExpNum.fromSymbol(genSymInt("num$castbool_" + ctr.id, source));
        Constraint numZero = genEquality(ConstraintType.EQUAL, num, ExpNum.fromConst(0, source), source);
        Constraint numOne = genEquality(ConstraintType.EQUAL, num, ExpNum.fromConst(1, source), source);
        Constraint finalCtr = genOr(genAnd(ctr, numOne, source), genAnd(ctrNot, numZero, source), source);
        return new CSResult<>(num, guarantee(finalCtr));
    }

    /** Truthiness of a number. Returns null when the expression has no numeric range. */
    public CSResult<ExpBool> castNumToBool(ExpNum exp, CodeSource source) {
        NumRange range = getCachedRange(exp);
        if (range == null) {
            return null;
        }
        if (Boolean.TRUE.equals(range.gt(0)) || Boolean.TRUE.equals(range.lt(0))) {
            return new CSResult<>(ExpBool.fromConst(true, source), this);
        } else if (Boolean.TRUE.equals(range.eq(0))) {
            return new CSResult<>(ExpBool.fromConst(false, source), this);
        }

        Constraint isZero = genEquality(ConstraintType.EQUAL, exp, ExpNum.fromConst(0, source), source);
        Constraint isNZero = genEquality(ConstraintType.NOT_EQUAL, exp, ExpNum.fromConst(0, source), source);
        SymVal sym = genSymBool("bool$castnum_" + isZero.id, source);
        ExpBool expSym = ExpBool.fromSymbol(sym);
        Constraint ctrSym = genFromBool(expSym, source);
        Constraint finalCtr = genOr(
                genAnd(ctrSym, isNZero, source),
                genAnd(genNot(ctrSym, source), isZero, source),
                source);
        return new CSResult<>(expSym, guarantee(finalCtr));
    }

    // ===================== CONSTRAINT GENERATION =====================

    public Constraint genFromBool(ExpBool exp, CodeSource source) {
        return new Constraint.FromBool(idManager.getCtrId(), exp, source, null);
    }

    public Constraint.Compare genEquality(ConstraintType type, SymExp left, SymExp right, CodeSource source) {
        if (type != ConstraintType.EQUAL && type != ConstraintType.NOT_EQUAL) {
            throw new IllegalArgumentException("not an equality: " + type);
        }
        return new Constraint.Compare(idManager.getCtrId(), type, left, right, source, null);
    }

    public Constraint.Compare genNumCompare(ConstraintType type, ExpNum left, ExpNum right, CodeSource source) {
        if (!type.isCompare()) {
            throw new IllegalArgumentException("not a comparison: " + type);
        }
        return new Constraint.Compare(idManager.getCtrId(), type, left, right, source, null);
    }

    public Constraint genAnd(Constraint left, Constraint right, CodeSource source) {
        return new Constraint.Logic(idManager.getCtrId(), ConstraintType.AND, left, right, source, null);
    }

    public Constraint genOr(Constraint left, Constraint right, CodeSource source) {
        return new Constraint.Logic(idManager.getCtrId(), ConstraintType.OR, left, right, source, null);
    }

    public Constraint genNot(Constraint constraint, CodeSource source) {
        return new Constraint.Not(idManager.getCtrId(), constraint, source, null);
    }

    public Constraint genBroad(ExpShape left, ExpShape right, CodeSource source) {
        return new Constraint.Broadcastable(idManager.getCtrId(), left, right, source, null);
    }

    public Constraint genForall(SymVal symbol, ExpNum rangeStart, ExpNum rangeEnd, Constraint constraint,
                                CodeSource source) {
        return new Constraint.Forall(idManager.getCtrId(), symbol, rangeStart, rangeEnd, constraint, source, null);
    }

    public Constraint genFail(String reason, CodeSource source) {
        return new Constraint.Fail(idManager.getCtrId(), reason, source, null);
    }

    // ===================== RANGE / SHAPE / STRING CACHES =====================

    /** Conservative range of a numeric expression, or null when unknown or empty. */
    public NumRange getCachedRange(ExpNum exp) {
        switch (exp.opType()) {
            case CONST:
                return NumRange.fromConst(exp.constValue());
            case UOP: {
                ExpNum.Uop uop = (ExpNum.Uop) exp;
                NumRange base = getCachedRange(uop.baseValue);
                if (base == null) return null;
                NumRange rng;
                switch (uop.uopType) {
                    case NEG: rng = base.neg(); break;
                    case CEIL: rng = base.ceil(); break;
                    case FLOOR: rng = base.floor(); break;
                    default: rng = base.abs(); break;
                }
                return rng.valid() ? rng : null;
            }
            case BOP: {
                ExpNum.Bop bop = (ExpNum.Bop) exp;
                NumRange left = getCachedRange(bop.left);
                NumRange right = getCachedRange(bop.right);
                if (left == null || right == null) return null;
                NumRange calced = calcRangeBop(bop.bopType, left, right);
                return calced.valid() ? calced : null;
            }
            case SYMBOL: {
                NumRange cache = rangeCache.get(((ExpNum.Symbol) exp).symbol.id);
                if (cache == null) return NumRange.genTop();
                return cache.valid() ? cache : null;
            }
            case MAX:
            case MIN: {
                List<ExpNum> values = exp.opType() == ExpNum.OpType.MAX
                        ? ((ExpNum.Max) exp).values : ((ExpNum.Min) exp).values;
                if (values.isEmpty()) return null;
                NumRange acc = null;
                for (ExpNum v : values) {
                    NumRange r = getCachedRange(v);
                    if (r == null) return null;
                    if (acc == null) acc = r;
                    else acc = exp.opType() == ExpNum.OpType.MAX ? acc.max(r) : acc.min(r);
                }
                return acc.valid() ? acc : null;
            }
            case INDEX:
                return getIndexRange((ExpNum.Index) exp);
            case NUMEL: {
                List<ExpNum> dims = getCachedShape(((ExpNum.Numel) exp).shape);
                if (dims == null) return null;
                NumRange rng = NumRange.fromConst(1);
                for (ExpNum dim : dims) {
                    NumRange dimRng = getCachedRange(dim);
                    if (dimRng == null) return null;
                    rng = rng.mul(dimRng);
                }
                return rng.valid() ? rng : null;
            }
            default:
                return null;
        }
    }

    private NumRange getIndexRange(ExpNum.Index exp) {
        NumRange idxRng = getCachedRange(exp.index);
        if (idxRng == null || !idxRng.valid()) return null;
        if (!idxRng.isConst()) return NumRange.genGte(0);
        double idx = idxRng.start;
        ExpShape shape = exp.baseShape;

        switch (shape.opType()) {
            case CONST: {
                List<ExpNum> dims = ((ExpShape.Const) shape).dims;
                if (idx >= 0 && idx < dims.size()) {
                    return getCachedRange(dims.get((int) idx));
                }
                return null;
            }
            case SET: {
                ExpShape.SetDim set = (ExpShape.SetDim) shape;
                NumRange setIdx = getCachedRange(set.axis);
                if (setIdx == null) return null;
                if (setIdx.isConst() && setIdx.start == idx) return getCachedRange(set.dim);
                if (setIdx.contains(idx)) return NumRange.genGte(0);
                return getCachedRange(ExpNum.index(set.baseShape, idx, exp.source));
            }
            default: {
                List<ExpNum> dims = getCachedShape(shape);
                if (dims == null || idx < 0 || idx >= dims.size()) return null;
                return getCachedRange(dims.get((int) idx));
            }
        }
    }

    private static NumRange calcRangeBop(ExpNum.BopType type, NumRange left, NumRange right) {
        switch (type) {
            case ADD: return left.add(right);
            case SUB: return left.sub(right);
            case MUL: return left.mul(right);
            case FLOORDIV: return left.floordiv(right);
            case TRUEDIV: return left.truediv(right);
            default: return left.mod(right);
        }
    }

    /**
     * Dimensions of a shape if they are statically listable. Symbols, slices, concats and
     * broadcasts are not resolved here and answer null.
     */
    public List<ExpNum> getCachedShape(ExpShape exp) {
        switch (exp.opType()) {
            case CONST:
                return ((ExpShape.Const) exp).dims;
            case SET: {
                ExpShape.SetDim set = (ExpShape.SetDim) exp;
                List<ExpNum> base = getCachedShape(set.baseShape);
                NumRange axis = getCachedRange(set.axis);
                if (base != null && axis != null && axis.isConst() && axis.start >= 0 && base.size() > axis.end) {
                    List<ExpNum> temp = new ArrayList<>(base);
                    temp.set((int) axis.start, set.dim);
                    return temp;
                }
                return null;
            }
            default:
                return null;
        }
    }

    /** Concrete value of a string expression, or null if it is not statically known. */
    public String getCachedString(ExpString exp) {
        switch (exp.opType()) {
            case CONST:
                return ((ExpString.Const) exp).value;
            case CONCAT: {
                ExpString.Concat c = (ExpString.Concat) exp;
                String left = getCachedString(c.left);
                String right = getCachedString(c.right);
                return left != null && right != null ? left + right : null;
            }
            case SLICE: {
                ExpString.Slice s = (ExpString.Slice) exp;
                String str = getCachedString(s.baseString);
                if (str == null) return null;
                int len = str.length();
                double start = 0;
                double end = len;
                if (s.start != null) {
                    NumRange r = getCachedRange(s.start);
                    if (r == null || !r.isConst()) return null;
                    start = r.start;
                }
                if (s.end != null) {
                    NumRange r = getCachedRange(s.end);
                    if (r == null || !r.isConst()) return null;
                    end = r.end;
                }
                int from = absIndexByLen(len, start);
                int to = absIndexByLen(len, end);
                return from < to ? str.substring(from, to) : "";
            }
            case SYMBOL:
                return stringCache.get(((ExpString.Symbol) exp).symbol.id);
            default:
                return null;
        }
    }

    static int absIndexByLen(int len, double index) {
        int i = (int) index;
        if (i < 0) i = len + i;
        return Math.max(0, Math.min(len, i));
    }

    /** True if {@code exp} provably differs from {@code tester}, null if unknown. */
    public Boolean checkNonString(ExpString exp, String tester) {
        String cached = getCachedString(exp);
        if (cached != null) {
            return !cached.equals(tester);
        }
        if (exp.opType() == ExpString.OpType.SYMBOL) {
            Set<String> nonSet = nonStringCache.get(((ExpString.Symbol) exp).symbol.id);
            if (nonSet != null && nonSet.contains(tester)) {
                return true;
            }
        }
        return null;
    }

    // ===================== IMMEDIATE CHECK =====================

    /** Three-valued decision of a boolean expression against the caches. */
    public Boolean checkImmediate(ExpBool exp) {
        if (exp.opType() == ExpBool.OpType.CONST) {
            return ((ExpBool.Const) exp).value;
        }
        return checkImmediate(Constraint.fromExp(exp));
    }

    /**
     * Three-valued decision of a constraint: true if it provably holds, false if it
     * provably fails, null when undecided.
     */
    public Boolean checkImmediate(Constraint constraint) {
        switch (constraint.type()) {
            case EXP_BOOL: {
                ExpBool exp = ((Constraint.FromBool) constraint).exp;
                if (exp.opType() == ExpBool.OpType.CONST) return ((ExpBool.Const) exp).value;
                return checkImmediate(Constraint.fromExp(exp));
            }
            case EQUAL:
                return checkEqual((Constraint.Compare) constraint);
            case NOT_EQUAL:
                return checkNotEqual((Constraint.Compare) constraint);
            case AND: {
                Constraint.Logic l = (Constraint.Logic) constraint;
                Boolean left = checkImmediate(l.left);
                if (Boolean.FALSE.equals(left)) return false;
                Boolean right = checkImmediate(l.right);
                if (Boolean.TRUE.equals(left)) return right;
                return Boolean.FALSE.equals(right) ? Boolean.FALSE : null;
            }
            case OR: {
                Constraint.Logic l = (Constraint.Logic) constraint;
                Boolean left = checkImmediate(l.left);
                if (Boolean.TRUE.equals(left)) return true;
                Boolean right = checkImmediate(l.right);
                if (Boolean.FALSE.equals(left)) return right;
                return Boolean.TRUE.equals(right) ? Boolean.TRUE : null;
            }
            case NOT: {
                Boolean inner = checkImmediate(((Constraint.Not) constraint).constraint);
                return inner == null ? null : !inner;
            }
            case LESS_THAN:
            case LESS_THAN_OR_EQUAL:
                return checkLess((Constraint.Compare) constraint);
            case BROADCASTABLE:
                return checkBroadcastable((Constraint.Broadcastable) constraint);
            case FORALL:
                return null;
            case FAIL:
                return false;
            default:
                return null;
        }
    }

    private Boolean checkEqual(Constraint.Compare c) {
        SymExp leftExp = ExpSimplifier.simplifyExp(this, c.left);
        SymExp rightExp = ExpSimplifier.simplifyExp(this, c.right);
        if (leftExp.kind() != rightExp.kind()) {
            return false;
        }
        switch (leftExp.kind()) {
            case NUM: {
                NumRange left = getCachedRange((ExpNum) leftExp);
                NumRange right = getCachedRange((ExpNum) rightExp);
                if (left != null && right != null && left.isConst() && right.isConst()) {
                    return left.start == right.start;
                }
                Double diff = constantDifference((ExpNum) leftExp, (ExpNum) rightExp);
                if (diff != null) return diff == 0;
                break;
            }
            case BOOL: {
                Boolean left = boolValue((ExpBool) leftExp);
                Boolean right = boolValue((ExpBool) rightExp);
                if (left != null && right != null) return left.equals(right);
                break;
            }
            case SHAPE: {
                if (leftExp instanceof ExpShape.Const && rightExp instanceof ExpShape.Const) {
                    List<ExpNum> ld = ((ExpShape.Const) leftExp).dims;
                    List<ExpNum> rd = ((ExpShape.Const) rightExp).dims;
                    if (ld.size() != rd.size()) return false;
                    for (int i = 0; i < ld.size(); i++) {
                        ExpNum l = ld.get(i);
                        ExpNum r = rd.get(i);
                        if (l.isConst() && r.isConst() && l.constValue() != r.constValue()) return false;
                    }
                }
                break;
            }
            case STRING: {
                String left = getCachedString((ExpString) leftExp);
                String right = getCachedString((ExpString) rightExp);
                if (left != null && right != null) return left.equals(right);
                break;
            }
            default:
                break;
        }
        return SymExp.isStructuallyEq(leftExp, rightExp) ? Boolean.TRUE : null;
    }

    private Boolean checkNotEqual(Constraint.Compare c) {
        SymExp leftExp = ExpSimplifier.simplifyExp(this, c.left);
        SymExp rightExp = ExpSimplifier.simplifyExp(this, c.right);
        if (leftExp.kind() != rightExp.kind()) {
            return true;
        }
        switch (leftExp.kind()) {
            case NUM: {
                NumRange left = getCachedRange((ExpNum) leftExp);
                NumRange right = getCachedRange((ExpNum) rightExp);
                if (left == null || right == null) return null;
                if (left.isConst() && right.isConst()) return left.start != right.start;
                if (Boolean.TRUE.equals(left.ltRange(right)) || Boolean.TRUE.equals(right.ltRange(left))) return true;
                Double diff = constantDifference((ExpNum) leftExp, (ExpNum) rightExp);
                if (diff != null) return diff != 0;
                return null;
            }
            case BOOL: {
                Boolean left = checkImmediate((ExpBool) leftExp);
                Boolean right = checkImmediate((ExpBool) rightExp);
                if (left != null && right != null) return !left.equals(right);
                return null;
            }
            case STRING: {
                ExpString left = (ExpString) leftExp;
                ExpString right = (ExpString) rightExp;
                if (SymExp.isStructuallyEq(left, right)) return false;
                if (right.opType() == ExpString.OpType.CONST) {
                    return checkNonString(left, ((ExpString.Const) right).value);
                }
                if (left.opType() == ExpString.OpType.CONST) {
                    return checkNonString(right, ((ExpString.Const) left).value);
                }
                return null;
            }
            case SHAPE:
                return SymExp.isStructuallyEq(leftExp, rightExp) ? Boolean.FALSE : null;
            default:
                return null;
        }
    }

    private Boolean checkLess(Constraint.Compare c) {
        boolean strict = c.type == ConstraintType.LESS_THAN;
        NumRange left = getCachedRange(c.numLeft());
        NumRange right = getCachedRange(c.numRight());
        if (left != null && right != null) {
            Boolean decided = strict ? left.ltRange(right) : left.lteRange(right);
            if (decided != null) return decided;
        }
        Double diff = constantDifference(
                (ExpNum) ExpSimplifier.simplifyExp(this, c.left),
                (ExpNum) ExpSimplifier.simplifyExp(this, c.right));
        if (diff == null) return null;
        return strict ? diff < 0 : diff <= 0;
    }

    // left - right if it normalises to a constant, e.g. x - (x + 1) = -1
    private static Double constantDifference(ExpNum left, ExpNum right) {
        LinearForm form = LinearForm.normalize(ExpNum.bop(ExpNum.BopType.SUB, left, right, left.source));
        if (!form.isConstant()) return null;
        double v = form.constant.toNum();
        return Double.isNaN(v) ? null : v;
    }

    private Boolean boolValue(ExpBool exp) {
        switch (exp.opType()) {
            case CONST:
                return ((ExpBool.Const) exp).value;
            case SYMBOL: {
                NumRange range = rangeCache.get(((ExpBool.Symbol) exp).symbol.id);
                if (range != null && range.isConst()) return range.start != 0;
                return null;
            }
            default:
                return checkImmediate(Constraint.fromExp(exp));
        }
    }

    private Boolean checkBroadcastable(Constraint.Broadcastable c) {
        ExpShape left = (ExpShape) ExpSimplifier.simplifyExp(this, c.left);
        ExpShape right = (ExpShape) ExpSimplifier.simplifyExp(this, c.right);
        if (!(left instanceof ExpShape.Const) || !(right instanceof ExpShape.Const)) {
            return null;
        }
        ExpShape.Const l = (ExpShape.Const) left;
        ExpShape.Const r = (ExpShape.Const) right;
        ExpShape.Const base = l.rank < r.rank ? r : l;
        ExpShape.Const other = base == l ? r : l;
        int rankDiff = base.dims.size() - other.dims.size();
        boolean undecided = false;
        for (int i = rankDiff; i < base.dims.size(); i++) {
            BroadcastResult dim = selectBroadcastable(base.dims.get(i), other.dims.get(i - rankDiff));
            if (dim.isImpossible()) {
                return false;
            } else if (dim.isUndecided()) {
                undecided = true;
            }
        }
        return undecided ? null : Boolean.TRUE;
    }

    /**
     * Numpy broadcast rule for one pair of dims: a constant 1 yields the other side,
     * two unequal constants (or disjoint ranges) are impossible, structurally equal dims
     * yield the left one.
     */
    public BroadcastResult selectBroadcastable(ExpNum left, ExpNum right) {
        NumRange leftRng = getCachedRange(left);
        NumRange rightRng = getCachedRange(right);
        if (leftRng == null || rightRng == null) return BroadcastResult.UNDECIDED;

        if (leftRng.isConst()) {
            double ln = leftRng.start;
            if (ln == 1) return BroadcastResult.of(right);
            if (rightRng.isConst()) {
                if (rightRng.start == 1) return BroadcastResult.of(left);
                if (ln != rightRng.start) return BroadcastResult.IMPOSSIBLE;
                return BroadcastResult.of(left);
            }
            if (!rightRng.contains(ln)) return BroadcastResult.IMPOSSIBLE;
        }
        if (rightRng.isConst()) {
            double rn = rightRng.start;
            if (rn == 1) return BroadcastResult.of(left);
            if (!leftRng.contains(rn)) return BroadcastResult.IMPOSSIBLE;
        }
        if (!leftRng.intersect(rightRng).valid()) return BroadcastResult.IMPOSSIBLE;
        if (SymExp.isStructuallyEq(left, right)) return BroadcastResult.of(left);
        return BroadcastResult.UNDECIDED;
    }

    // ===================== RENDERING =====================

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        List<Constraint> simplified = getConstraints();
        Set<Integer> hard = new HashSet<>(hardCtr);
        Set<Integer> path = new HashSet<>(pathCtr);
        for (int i = 0; i < simplified.size(); i++) {
            Constraint c = simplified.get(i);
            String role = hard.contains(i) ? "H" : path.contains(i) ? "P" : "S";
            if (i > 0) sb.append('\n');
            sb.append(i + 1).append(" [").append(role).append("]: ").append(c);
            if (c.source != null) sb.append(" - ").append(c.source);
        }
        return sb.toString();
    }
}
