package com.shapetea.constraint;

import java.util.ArrayList;
import java.util.List;

import com.shapetea.ir.CodeSource;
import com.shapetea.symbolic.ExpBool;
import com.shapetea.symbolic.ExpNum;
import com.shapetea.symbolic.ExpNum.BopType;
import com.shapetea.symbolic.ExpShape;
import com.shapetea.symbolic.ExpString;
import com.shapetea.symbolic.NumRange;
import com.shapetea.symbolic.SymExp;

/**
 * Structural simplification of symbolic expressions against the caches of a
 * {@link ConstraintSet}: constant folding, canonical re-association of constants, and
 * collapse of symbols whose cached range is a single value.
 *
 * <p>The simplifier never decides satisfiability; that is {@link ConstraintSet#checkImmediate}'s job.
 */
public final class ExpSimplifier {

    private ExpSimplifier() {
    }

    public static SymExp simplifyExp(ConstraintSet ctrSet, SymExp exp) {
        switch (exp.kind()) {
            case STRING: return simplifyString(ctrSet, (ExpString) exp);
            case BOOL: return simplifyBool(ctrSet, (ExpBool) exp);
            case NUM: return simplifyNum(ctrSet, (ExpNum) exp);
            default: return simplifyShape(ctrSet, (ExpShape) exp);
        }
    }

    public static Constraint simplifyConstraint(ConstraintSet ctrSet, Constraint ctr) {
        switch (ctr.type()) {
            case AND:
            case OR: {
                Constraint.Logic l = (Constraint.Logic) ctr;
                return l.with(l.type, simplifyConstraint(ctrSet, l.left), simplifyConstraint(ctrSet, l.right));
            }
            case EQUAL:
            case NOT_EQUAL:
            case LESS_THAN:
            case LESS_THAN_OR_EQUAL: {
                Constraint.Compare c = (Constraint.Compare) ctr;
                return c.withOperands(c.type, simplifyExp(ctrSet, c.left), simplifyExp(ctrSet, c.right));
            }
            case EXP_BOOL: {
                Constraint.FromBool b = (Constraint.FromBool) ctr;
                return new Constraint.FromBool(b.id, simplifyBool(ctrSet, b.exp), b.source, b.message);
            }
            case BROADCASTABLE: {
                Constraint.Broadcastable b = (Constraint.Broadcastable) ctr;
                return new Constraint.Broadcastable(b.id, simplifyShape(ctrSet, b.left),
                        simplifyShape(ctrSet, b.right), b.source, b.message);
            }
            case FORALL: {
                Constraint.Forall f = (Constraint.Forall) ctr;
                return new Constraint.Forall(f.id, f.symbol, simplifyNum(ctrSet, f.rangeStart),
                        simplifyNum(ctrSet, f.rangeEnd), simplifyConstraint(ctrSet, f.constraint), f.source, f.message);
            }
            case NOT: {
                Constraint.Not n = (Constraint.Not) ctr;
                return new Constraint.Not(n.id, simplifyConstraint(ctrSet, n.constraint), n.source, n.message);
            }
            default:
                return ctr;
        }
    }

    // ===================== STRING =====================

    public static ExpString simplifyString(ConstraintSet ctrSet, ExpString exp) {
        switch (exp.opType()) {
            case CONCAT: {
                ExpString.Concat c = (ExpString.Concat) exp;
                ExpString left = simplifyString(ctrSet, c.left);
                ExpString right = simplifyString(ctrSet, c.right);
                if (left instanceof ExpString.Const && right instanceof ExpString.Const) {
                    return ExpString.fromConst(((ExpString.Const) left).value + ((ExpString.Const) right).value,
                            exp.source);
                }
                return ExpString.concat(left, right, exp.source);
            }
            case SLICE: {
                ExpString.Slice s = (ExpString.Slice) exp;
                ExpString base = simplifyString(ctrSet, s.baseString);
                ExpNum start = s.start != null ? simplifyNum(ctrSet, s.start) : null;
                ExpNum end = s.end != null ? simplifyNum(ctrSet, s.end) : null;
                if (base instanceof ExpString.Const
                        && (start == null || start.isConst())
                        && (end == null || end.isConst())) {
                    String value = ((ExpString.Const) base).value;
                    int len = value.length();
                    int from = start == null ? 0 : ConstraintSet.absIndexByLen(len, start.constValue());
                    int to = end == null ? len : ConstraintSet.absIndexByLen(len, end.constValue());
                    if (from <= to) return ExpString.fromConst(value.substring(from, to), exp.source);
                }
                return ExpString.slice(base, start, end, exp.source);
            }
            case SYMBOL: {
                String cached = ctrSet.getCachedString(exp);
                return cached != null ? ExpString.fromConst(cached, exp.source) : exp;
            }
            default:
                return exp;
        }
    }

    // ===================== BOOL =====================

    public static ExpBool simplifyBool(ConstraintSet ctrSet, ExpBool exp) {
        switch (exp.opType()) {
            case AND: {
                ExpBool.Logic l = (ExpBool.Logic) exp;
                ExpBool left = simplifyBool(ctrSet, l.left);
                ExpBool right = simplifyBool(ctrSet, l.right);
                if (left instanceof ExpBool.Const) {
                    return ((ExpBool.Const) left).value ? right : left;
                } else if (right instanceof ExpBool.Const) {
                    return ((ExpBool.Const) right).value ? left : right;
                }
                return ExpBool.and(left, right, exp.source);
            }
            case OR: {
                ExpBool.Logic l = (ExpBool.Logic) exp;
                ExpBool left = simplifyBool(ctrSet, l.left);
                ExpBool right = simplifyBool(ctrSet, l.right);
                if (left instanceof ExpBool.Const) {
                    return ((ExpBool.Const) left).value ? left : right;
                } else if (right instanceof ExpBool.Const) {
                    return ((ExpBool.Const) right).value ? right : left;
                }
                return ExpBool.or(left, right, exp.source);
            }
            case EQUAL:
            case NOT_EQUAL: {
                ExpBool.Compare c = (ExpBool.Compare) exp;
                SymExp left = simplifyExp(ctrSet, c.left);
                SymExp right = simplifyExp(ctrSet, c.right);
                Boolean same = constEquals(left, right);
                if (same != null) {
                    return ExpBool.fromConst(exp.opType() == ExpBool.OpType.EQUAL ? same : !same, exp.source);
                }
                return exp.opType() == ExpBool.OpType.EQUAL
                        ? ExpBool.eq(left, right, exp.source)
                        : ExpBool.neq(left, right, exp.source);
            }
            case LESS_THAN:
            case LESS_THAN_OR_EQUAL: {
                ExpBool.Compare c = (ExpBool.Compare) exp;
                ExpNum left = simplifyNum(ctrSet, c.numLeft());
                ExpNum right = simplifyNum(ctrSet, c.numRight());
                if (left.isConst() && right.isConst()) {
                    boolean v = exp.opType() == ExpBool.OpType.LESS_THAN
                            ? left.constValue() < right.constValue()
                            : left.constValue() <= right.constValue();
                    return ExpBool.fromConst(v, exp.source);
                }
                return exp.opType() == ExpBool.OpType.LESS_THAN
                        ? ExpBool.lt(left, right, exp.source)
                        : ExpBool.lte(left, right, exp.source);
            }
            case NOT: {
                ExpBool base = simplifyBool(ctrSet, ((ExpBool.Not) exp).baseBool);
                switch (base.opType()) {
                    case EQUAL: {
                        ExpBool.Compare c = (ExpBool.Compare) base;
                        return ExpBool.neq(c.left, c.right, exp.source);
                    }
                    case NOT_EQUAL: {
                        ExpBool.Compare c = (ExpBool.Compare) base;
                        return ExpBool.eq(c.left, c.right, exp.source);
                    }
                    case CONST:
                        return ExpBool.fromConst(!((ExpBool.Const) base).value, exp.source);
                    case LESS_THAN: {
                        ExpBool.Compare c = (ExpBool.Compare) base;
                        return ExpBool.lte(c.numRight(), c.numLeft(), exp.source);
                    }
                    case LESS_THAN_OR_EQUAL: {
                        ExpBool.Compare c = (ExpBool.Compare) base;
                        return ExpBool.lt(c.numRight(), c.numLeft(), exp.source);
                    }
                    case NOT:
                        return ((ExpBool.Not) base).baseBool;
                    default:
                        return ExpBool.not(base, exp.source);
                }
            }
            case SYMBOL: {
                NumRange rng = ctrSet.getSymbolRange(((ExpBool.Symbol) exp).symbol);
                if (rng != null && rng.isConst()) {
                    return ExpBool.fromConst(rng.start != 0, exp.source);
                }
                return exp;
            }
            default:
                return exp;
        }
    }

    private static Boolean constEquals(SymExp left, SymExp right) {
        if (left instanceof ExpNum.Const && right instanceof ExpNum.Const) {
            return ((ExpNum.Const) left).value == ((ExpNum.Const) right).value;
        }
        if (left instanceof ExpBool.Const && right instanceof ExpBool.Const) {
            return ((ExpBool.Const) left).value == ((ExpBool.Const) right).value;
        }
        if (left instanceof ExpString.Const && right instanceof ExpString.Const) {
            return ((ExpString.Const) left).value.equals(((ExpString.Const) right).value);
        }
        return null;
    }

    // ===================== NUM =====================

    public static ExpNum simplifyNum(ConstraintSet ctrSet, ExpNum exp) {
        switch (exp.opType()) {
            case UOP:
                return simplifyUop(ctrSet, (ExpNum.Uop) exp);
            case BOP:
                return simplifyBop(ctrSet, (ExpNum.Bop) exp);
            case CONST:
                return exp;
            case INDEX:
                return simplifyIndex(ctrSet, (ExpNum.Index) exp);
            case MAX:
            case MIN: {
                boolean isMax = exp.opType() == ExpNum.OpType.MAX;
                List<ExpNum> raw = isMax ? ((ExpNum.Max) exp).values : ((ExpNum.Min) exp).values;
                List<ExpNum> values = new ArrayList<>(raw.size());
                boolean allConst = !raw.isEmpty();
                for (ExpNum v : raw) {
                    ExpNum s = simplifyNum(ctrSet, v);
                    allConst &= s.isConst();
                    values.add(s);
                }
                if (allConst) {
                    double acc = values.get(0).constValue();
                    for (ExpNum v : values) {
                        acc = isMax ? Math.max(acc, v.constValue()) : Math.min(acc, v.constValue());
                    }
                    return ExpNum.fromConst(acc, exp.source);
                }
                return isMax ? ExpNum.max(values, exp.source) : ExpNum.min(values, exp.source);
            }
            case NUMEL:
                return simplifyNumel(ctrSet, (ExpNum.Numel) exp);
            case SYMBOL: {
                NumRange rng = ctrSet.getSymbolRange(((ExpNum.Symbol) exp).symbol);
                if (rng != null && rng.isConst()) {
                    return ExpNum.fromConst(rng.start, exp.source);
                }
                return exp;
            }
            default:
                return exp;
        }
    }

    private static double applyUop(ExpNum.UopType type, double v) {
        switch (type) {
            case NEG: return -v;
            case FLOOR: return Math.floor(v);
            case CEIL: return Math.ceil(v);
            default: return Math.abs(v);
        }
    }

    private static ExpNum simplifyUop(ConstraintSet ctrSet, ExpNum.Uop exp) {
        ExpNum base = simplifyNum(ctrSet, exp.baseValue);
        if (base.isConst()) {
            return ExpNum.fromConst(applyUop(exp.uopType, base.constValue()), exp.source);
        }
        if (base instanceof ExpNum.Uop) {
            ExpNum.Uop inner = (ExpNum.Uop) base;
            switch (exp.uopType) {
                case CEIL:
                case FLOOR:
                    if (ExpNum.isStructuallyInt(base)) return base;
                    break;
                case NEG:
                    if (inner.uopType == ExpNum.UopType.NEG) return inner.baseValue;
                    break;
                case ABS:
                    if (inner.uopType == ExpNum.UopType.ABS) return base;
                    break;
                default:
                    break;
            }
        } else if ((exp.uopType == ExpNum.UopType.CEIL || exp.uopType == ExpNum.UopType.FLOOR)
                && ExpNum.isStructuallyInt(base)) {
            return base;
        }

        NumRange rng = ctrSet.getCachedRange(base);
        if (rng != null) {
            if (rng.isConst()) {
                return ExpNum.fromConst(applyUop(exp.uopType, rng.start), exp.source);
            }
            if (exp.uopType == ExpNum.UopType.ABS) {
                if (Boolean.TRUE.equals(rng.gte(0))) {
                    return base;
                } else if (Boolean.TRUE.equals(rng.lte(0))) {
                    return simplifyNum(ctrSet, ExpNum.uop(ExpNum.UopType.NEG, base, exp.source));
                }
            }
        }
        return ExpNum.uop(exp.uopType, base, exp.source);
    }

    private static ExpNum simplifyBop(ConstraintSet ctrSet, ExpNum.Bop exp) {
        ExpNum left = simplifyNum(ctrSet, exp.left);
        ExpNum right = simplifyNum(ctrSet, exp.right);
        BopType op = exp.bopType;
        CodeSource src = exp.source;

        if (left.isConst()) {
            ExpNum folded = foldLeftConst(op, left.constValue(), right, src);
            if (folded != null) return folded;
        } else if (right.isConst()) {
            ExpNum folded = foldRightConst(op, left, right.constValue(), src);
            if (folded != null) return folded;
        }
        return ExpNum.bop(op, left, right, src);
    }

    // L op right
    private static ExpNum foldLeftConst(BopType op, double lv, ExpNum right, CodeSource src) {
        if (lv == 0) {
            switch (op) {
                case ADD:
                    return right;
                case FLOORDIV:
                case TRUEDIV:
                case MOD:
                case MUL:
                    return ExpNum.fromConst(0, src);
                default:
                    break;
            }
        } else if (lv == 1 && op == BopType.MUL) {
            return right;
        }

        if (right.isConst()) {
            double rv = right.constValue();
            switch (op) {
                case ADD: return ExpNum.fromConst(lv + rv, src);
                case SUB: return ExpNum.fromConst(lv - rv, src);
                case MUL: return ExpNum.fromConst(lv * rv, src);
                case FLOORDIV: return rv == 0 ? null : ExpNum.fromConst(Math.floor(lv / rv), src);
                case TRUEDIV: return rv == 0 ? null : ExpNum.fromConst(lv / rv, src);
                default: return rv == 0 ? null : ExpNum.fromConst(NumRange.pyMod(lv, rv), src);
            }
        }
        if (!(right instanceof ExpNum.Bop)) return null;

        ExpNum.Bop rb = (ExpNum.Bop) right;
        ExpNum rl = rb.left;
        ExpNum rr = rb.right;
        switch (rb.bopType) {
            case ADD:
                if (rl.isConst()) {
                    double c = rl.constValue();
                    if (op == BopType.ADD) return ExpNum.bop(BopType.ADD, lv + c, rr, src);
                    if (op == BopType.SUB) return ExpNum.bop(BopType.SUB, lv - c, rr, src);
                    if (op == BopType.MUL) {
                        return ExpNum.bop(BopType.ADD, lv * c, ExpNum.bop(BopType.MUL, lv, rr, src), src);
                    }
                }
                if (rr.isConst()) {
                    double c = rr.constValue();
                    if (op == BopType.ADD) return ExpNum.bop(BopType.ADD, lv + c, rl, src);
                    if (op == BopType.SUB) return ExpNum.bop(BopType.SUB, lv - c, rl, src);
                    if (op == BopType.MUL) {
                        return ExpNum.bop(BopType.ADD, ExpNum.bop(BopType.MUL, lv, rl, src), lv * c, src);
                    }
                }
                break;
            case SUB:
                if (rl.isConst()) {
                    double c = rl.constValue();
                    if (op == BopType.ADD) return ExpNum.bop(BopType.SUB, lv + c, rr, src);
                    if (op == BopType.SUB) return ExpNum.bop(BopType.ADD, lv - c, rr, src);
                    if (op == BopType.MUL) {
                        return ExpNum.bop(BopType.SUB, lv * c, ExpNum.bop(BopType.MUL, lv, rr, src), src);
                    }
                }
                if (rr.isConst()) {
                    double c = rr.constValue();
                    if (op == BopType.ADD) return ExpNum.bop(BopType.ADD, lv - c, rl, src);
                    if (op == BopType.SUB) return ExpNum.bop(BopType.SUB, lv + c, rl, src);
                    if (op == BopType.MUL) {
                        return ExpNum.bop(BopType.SUB, ExpNum.bop(BopType.MUL, lv, rl, src), lv * c, src);
                    }
                }
                break;
            case MUL:
                if (rl.isConst()) {
                    double c = rl.constValue();
                    if (op == BopType.MUL) return ExpNum.bop(BopType.MUL, lv * c, rr, src);
                    if (op == BopType.TRUEDIV && c != 0) return ExpNum.bop(BopType.TRUEDIV, lv / c, rr, src);
                }
                if (rr.isConst()) {
                    double c = rr.constValue();
                    if (op == BopType.MUL) return ExpNum.bop(BopType.MUL, lv * c, rl, src);
                    if (op == BopType.TRUEDIV && c != 0) return ExpNum.bop(BopType.TRUEDIV, lv / c, rl, src);
                }
                break;
            case TRUEDIV:
                if (rl.isConst() && op == BopType.MUL) {
                    return ExpNum.bop(BopType.TRUEDIV, lv * rl.constValue(), rr, src);
                }
                break;
            default:
                break;
        }
        return null;
    }

    // left op R
    private static ExpNum foldRightConst(BopType op, ExpNum left, double rv, CodeSource src) {
        if (rv == 0) {
            switch (op) {
                case ADD:
                case SUB:
                    return left;
                case MUL:
                    return ExpNum.fromConst(0, src);
                default:
                    break;
            }
        } else if (rv == 1) {
            switch (op) {
                case TRUEDIV:
                case MUL:
                    return left;
                case FLOORDIV:
                    if (ExpNum.isStructuallyInt(left)) return left;
                    break;
                default:
                    break;
            }
        }
        if (!(left instanceof ExpNum.Bop)) return null;

        ExpNum.Bop lb = (ExpNum.Bop) left;
        ExpNum ll = lb.left;
        ExpNum lr = lb.right;
        switch (lb.bopType) {
            case ADD:
                if (ll.isConst()) {
                    double c = ll.constValue();
                    if (op == BopType.ADD) return ExpNum.bop(BopType.ADD, lr, c + rv, src);
                    if (op == BopType.SUB) return ExpNum.bop(BopType.ADD, lr, c - rv, src);
                    if (op == BopType.MUL) {
                        return ExpNum.bop(BopType.ADD, c * rv, ExpNum.bop(BopType.MUL, lr, rv, src), src);
                    }
                }
                if (lr.isConst()) {
                    double c = lr.constValue();
                    if (op == BopType.ADD) return ExpNum.bop(BopType.ADD, ll, c + rv, src);
                    if (op == BopType.SUB) return ExpNum.bop(BopType.ADD, ll, c - rv, src);
                    if (op == BopType.MUL) {
                        return ExpNum.bop(BopType.ADD, ExpNum.bop(BopType.MUL, ll, rv, src), c * rv, src);
                    }
                }
                break;
            case SUB:
                if (ll.isConst()) {
                    double c = ll.constValue();
                    if (op == BopType.ADD) return ExpNum.bop(BopType.SUB, c + rv, lr, src);
                    if (op == BopType.SUB) return ExpNum.bop(BopType.SUB, c - rv, lr, src);
                    if (op == BopType.MUL) {
                        return ExpNum.bop(BopType.SUB, c * rv, ExpNum.bop(BopType.MUL, lr, rv, src), src);
                    }
                }
                if (lr.isConst()) {
                    double c = lr.constValue();
                    if (op == BopType.ADD) return ExpNum.bop(BopType.ADD, ll, rv - c, src);
                    if (op == BopType.SUB) return ExpNum.bop(BopType.ADD, ll, -c - rv, src);
                    if (op == BopType.MUL) {
                        return ExpNum.bop(BopType.SUB, ExpNum.bop(BopType.MUL, ll, rv, src), c * rv, src);
                    }
                }
                break;
            case MUL:
                if (ll.isConst()) {
                    double c = ll.constValue();
                    if (op == BopType.MUL) return ExpNum.bop(BopType.MUL, c * rv, lr, src);
                    if (op == BopType.TRUEDIV) return ExpNum.bop(BopType.MUL, c / rv, lr, src);
                }
                if (lr.isConst()) {
                    double c = lr.constValue();
                    if (op == BopType.MUL) return ExpNum.bop(BopType.MUL, ll, c * rv, src);
                    if (op == BopType.TRUEDIV) return ExpNum.bop(BopType.MUL, ll, c / rv, src);
                }
                break;
            case TRUEDIV:
                if (ll.isConst() && op == BopType.MUL) {
                    return ExpNum.bop(BopType.TRUEDIV, ll.constValue() * rv, lr, src);
                }
                break;
            default:
                break;
        }
        return null;
    }

    private static ExpNum simplifyIndex(ConstraintSet ctrSet, ExpNum.Index exp) {
        ExpShape base = simplifyShape(ctrSet, exp.baseShape);
        ExpNum idx = simplifyNum(ctrSet, exp.index);
        if (!idx.isConst() || !NumRange.isInteger(idx.constValue())) {
            return ExpNum.index(base, idx, exp.source);
        }

        double index = idx.constValue();
        while (true) {
            switch (base.opType()) {
                case CONST: {
                    List<ExpNum> dims = ((ExpShape.Const) base).dims;
                    if (0 <= index && index < dims.size()) {
                        return simplifyNum(ctrSet, dims.get((int) index));
                    }
                    return ExpNum.index(base, ExpNum.fromConst(index, idx.source), exp.source);
                }
                case CONCAT: {
                    ExpShape.Concat c = (ExpShape.Concat) base;
                    ExpNum firstRank = ExpShape.getRank(c.left);
                    NumRange rankRng = ctrSet.getCachedRange(firstRank);
                    if (rankRng != null && Boolean.TRUE.equals(rankRng.lte(index))) {
                        if (rankRng.isConst()) {
                            base = c.right;
                            index -= rankRng.start;
                        } else {
                            return ExpNum.index(c.right,
                                    ExpNum.bop(BopType.SUB, ExpNum.fromConst(index, idx.source), firstRank, idx.source),
                                    exp.source);
                        }
                    } else if (rankRng != null && Boolean.TRUE.equals(rankRng.gte(index + 1))) {
                        base = c.left;
                    } else {
                        return ExpNum.index(base, ExpNum.fromConst(index, idx.source), exp.source);
                    }
                    break;
                }
                case SET: {
                    ExpShape.SetDim set = (ExpShape.SetDim) base;
                    NumRange axisRng = ctrSet.getCachedRange(set.axis);
                    if (axisRng == null || (!axisRng.isConst() && axisRng.contains(index))) {
                        return ExpNum.index(base, ExpNum.fromConst(index, idx.source), exp.source);
                    }
                    if (axisRng.isConst() && axisRng.start == index) {
                        return set.dim.withSource(exp.source);
                    }
                    base = set.baseShape;
                    break;
                }
                default:
                    return ExpNum.index(base, ExpNum.fromConst(index, idx.source), exp.source);
            }
        }
    }

    private static ExpNum simplifyNumel(ConstraintSet ctrSet, ExpNum.Numel exp) {
        ExpShape base = simplifyShape(ctrSet, exp.shape);
        if (base instanceof ExpShape.Const) {
            ExpNum numel = null;
            for (ExpNum dim : ((ExpShape.Const) base).dims) {
                numel = numel == null ? dim : ExpNum.bop(BopType.MUL, numel, dim, exp.source);
            }
            // numel of a scalar is 1
            return numel == null ? ExpNum.fromConst(1, exp.source) : simplifyNum(ctrSet, numel);
        } else if (base instanceof ExpShape.Concat) {
            ExpShape.Concat c = (ExpShape.Concat) base;
            return simplifyNum(ctrSet, ExpNum.bop(BopType.MUL,
                    ExpNum.numel(c.left, exp.source), ExpNum.numel(c.right, exp.source), exp.source));
        }
        return ExpNum.numel(base, exp.source);
    }

    // ===================== SHAPE =====================

    public static ExpShape simplifyShape(ConstraintSet ctrSet, ExpShape exp) {
        switch (exp.opType()) {
            case BROADCAST: {
                ExpShape.Broadcast b = (ExpShape.Broadcast) exp;
                ExpShape left = simplifyShape(ctrSet, b.left);
                ExpShape right = simplifyShape(ctrSet, b.right);
                if (left instanceof ExpShape.Const && right instanceof ExpShape.Const) {
                    ExpShape.Const l = (ExpShape.Const) left;
                    ExpShape.Const r = (ExpShape.Const) right;
                    ExpShape.Const baseShape = l.rank < r.rank ? r : l;
                    ExpShape.Const other = baseShape == l ? r : l;
                    int rankDiff = baseShape.dims.size() - other.dims.size();
                    List<ExpNum> dims = new ArrayList<>(baseShape.dims.size());
                    boolean simple = true;
                    for (int i = 0; i < baseShape.dims.size(); i++) {
                        if (i < rankDiff) {
                            dims.add(baseShape.dims.get(i));
                            continue;
                        }
                        BroadcastResult dim = ctrSet.selectBroadcastable(baseShape.dims.get(i),
                                other.dims.get(i - rankDiff));
                        if (!dim.isSelected()) {
                            simple = false;
                            break;
                        }
                        dims.add(dim.dim);
                    }
                    if (simple) {
                        return ExpShape.fromConst(baseShape.rank, dims, exp.source);
                    }
                }
                return ExpShape.broadcast(left, right, exp.source);
            }
            case CONCAT: {
                ExpShape.Concat c = (ExpShape.Concat) exp;
                ExpShape left = simplifyShape(ctrSet, c.left);
                ExpShape right = simplifyShape(ctrSet, c.right);
                if (left instanceof ExpShape.Const && right instanceof ExpShape.Const) {
                    ExpShape.Const l = (ExpShape.Const) left;
                    ExpShape.Const r = (ExpShape.Const) right;
                    List<ExpNum> dims = new ArrayList<>(l.dims);
                    dims.addAll(r.dims);
                    return ExpShape.fromConst(l.rank + r.rank, dims, exp.source);
                }
                return ExpShape.concat(left, right, exp.source);
            }
            case SET: {
                ExpShape.SetDim s = (ExpShape.SetDim) exp;
                ExpShape base = simplifyShape(ctrSet, s.baseShape);
                ExpNum axis = simplifyNum(ctrSet, s.axis);
                ExpNum dim = simplifyNum(ctrSet, s.dim);
                if (base instanceof ExpShape.Const && axis.isConst()) {
                    ExpShape.Const c = (ExpShape.Const) base;
                    double idx = axis.constValue();
                    if (0 <= idx && idx < c.rank && NumRange.isInteger(idx)) {
                        List<ExpNum> dims = new ArrayList<>(c.dims);
                        dims.set((int) idx, dim);
                        return ExpShape.fromConst(c.rank, dims, exp.source);
                    }
                }
                return ExpShape.setDim(base, axis, dim, exp.source);
            }
            case SLICE: {
                ExpShape.Slice s = (ExpShape.Slice) exp;
                ExpShape base = simplifyShape(ctrSet, s.baseShape);
                ExpNum start = s.start != null ? simplifyNum(ctrSet, s.start) : null;
                ExpNum end = s.end != null ? simplifyNum(ctrSet, s.end) : null;
                if (base instanceof ExpShape.Const) {
                    ExpShape.Const c = (ExpShape.Const) base;
                    double startPos = start == null ? 0 : start.isConst() ? start.constValue() : -1;
                    double endPos = end == null ? c.rank : end.isConst() ? end.constValue() : -1;
                    if (startPos >= 0 && endPos >= 0 && NumRange.isInteger(startPos) && NumRange.isInteger(endPos)) {
                        int from = (int) Math.min(startPos, c.dims.size());
                        int to = (int) Math.min(endPos, c.dims.size());
                        List<ExpNum> dims = from < to ? new ArrayList<>(c.dims.subList(from, to)) : new ArrayList<>();
                        return ExpShape.fromConst(dims.size(), dims, exp.source);
                    }
                }
                return ExpShape.slice(base, start, end, exp.source);
            }
            case CONST: {
                ExpShape.Const c = (ExpShape.Const) exp;
                List<ExpNum> dims = new ArrayList<>(c.dims.size());
                for (ExpNum d : c.dims) dims.add(simplifyNum(ctrSet, d));
                return ExpShape.fromConst(c.rank, dims, exp.source);
            }
            case SYMBOL: {
                List<ExpNum> dims = ctrSet.getCachedShape(exp);
                if (dims != null) return ExpShape.fromConst(dims.size(), dims, exp.source);
                return exp;
            }
            default:
                return exp;
        }
    }
}
