package com.shapetea.symbolic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A numeric expression normalised to {@code c1*e1 + c2*e2 + ... + constant}, where every
 * {@code ei} is an indivisible sub-expression (a symbol, or a non-linear term) and every
 * coefficient is a {@link Fraction}. Terms with a zero coefficient are dropped.
 */
public final class LinearForm {

    public static final class Term {
        public final ExpNum exp;
        public final Fraction coeff;

        public Term(ExpNum exp, Fraction coeff) {
            this.exp = exp;
            this.coeff = coeff;
        }

        Term withCoeff(Fraction c) {
            return new Term(exp, c);
        }

        @Override
        public String toString() {
            return coeff + "*" + exp;
        }
    }

    public final List<Term> terms;
    public final Fraction constant;

    public LinearForm(List<Term> terms, Fraction constant) {
        this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
        this.constant = constant;
    }

    private static LinearForm single(ExpNum exp) {
        return new LinearForm(List.of(new Term(exp, Fraction.ONE)), Fraction.ZERO);
    }

    private static LinearForm constOnly(Fraction value) {
        return new LinearForm(List.of(), value);
    }

    public boolean isConstant() {
        return terms.isEmpty();
    }

    public LinearForm neg() {
        List<Term> list = new ArrayList<>(terms.size());
        for (Term t : terms) list.add(t.withCoeff(t.coeff.neg()));
        return new LinearForm(list, constant.neg());
    }

    static List<Term> merge(List<Term> list1, List<Term> list2) {
        List<Term> main = list1.size() >= list2.size() ? list1 : list2;
        List<Term> sub = main == list1 ? list2 : list1;
        List<Term> merged = new ArrayList<>(main);
        int leftLen = merged.size();
        for (Term right : sub) {
            boolean found = false;
            for (int i = 0; i < leftLen; i++) {
                Term left = merged.get(i);
                if (left.exp.equals(right.exp)) {
                    merged.set(i, left.withCoeff(left.coeff.add(right.coeff)));
                    found = true;
                    break;
                }
            }
            if (!found) merged.add(right);
        }
        merged.removeIf(t -> t.coeff.isZero());
        return merged;
    }

    public static LinearForm normalize(ExpNum exp) {
        switch (exp.opType()) {
            case CONST:
                return constOnly(Fraction.of(exp.constValue()));
            case SYMBOL:
                return single(exp);
            case UOP: {
                ExpNum.Uop uop = (ExpNum.Uop) exp;
                if (uop.uopType == ExpNum.UopType.NEG) {
                    return normalize(uop.baseValue).neg();
                }
                return single(exp);
            }
            case BOP:
                return normalizeBop((ExpNum.Bop) exp);
            default:
                return single(exp);
        }
    }

    private static LinearForm normalizeBop(ExpNum.Bop exp) {
        LinearForm left = normalize(exp.left);
        LinearForm right = normalize(exp.right);
        switch (exp.bopType) {
            case SUB:
                right = right.neg();
                return new LinearForm(merge(left.terms, right.terms), left.constant.add(right.constant));
            case ADD:
                return new LinearForm(merge(left.terms, right.terms), left.constant.add(right.constant));
            case MUL: {
                List<Term> list = new ArrayList<>();
                for (Term l : left.terms) {
                    List<Term> temp = new ArrayList<>();
                    for (Term r : right.terms) {
                        temp.add(new Term(ExpNum.bop(ExpNum.BopType.MUL, l.exp, r.exp, exp.source), l.coeff.mul(r.coeff)));
                    }
                    list = merge(list, temp);
                }
                if (!right.constant.isZero()) {
                    List<Term> temp = new ArrayList<>();
                    for (Term l : left.terms) temp.add(l.withCoeff(l.coeff.mul(right.constant)));
                    list = merge(list, temp);
                }
                if (!left.constant.isZero()) {
                    List<Term> temp = new ArrayList<>();
                    for (Term r : right.terms) temp.add(r.withCoeff(r.coeff.mul(left.constant)));
                    list = merge(list, temp);
                }
                Fraction cst = left.constant.mul(right.constant);
                return new LinearForm(list, cst);
            }
            case MOD:
                if (left.isConstant() && right.isConstant()) {
                    return constOnly(Fraction.of(NumRange.pyMod(left.constant.toNum(), right.constant.toNum())));
                }
                return single(ExpNum.bop(ExpNum.BopType.MOD, left.toExp(), right.toExp(), exp.source));
            case FLOORDIV:
                if (left.isConstant() && right.isConstant() && !right.constant.isZero()) {
                    return constOnly(left.constant.div(right.constant).floor());
                }
                return single(ExpNum.bop(ExpNum.BopType.FLOORDIV, left.toExp(), right.toExp(), exp.source));
            case TRUEDIV:
                if (right.isConstant() && !right.constant.isZero()) {
                    List<Term> list = new ArrayList<>();
                    for (Term t : left.terms) list.add(t.withCoeff(t.coeff.div(right.constant)));
                    return new LinearForm(list, left.constant.div(right.constant));
                }
                return single(ExpNum.bop(ExpNum.BopType.TRUEDIV, left.toExp(), right.toExp(), exp.source));
            default:
                return single(exp);
        }
    }

    /** Rebuilds an expression tree from the normal form. */
    public ExpNum toExp() {
        ExpNum left = null;
        for (Term t : terms) {
            Fraction coeff = t.coeff.norm();
            ExpNum right;
            if (coeff.down == 1) {
                right = coeff.up == 1 ? t.exp : ExpNum.bop(ExpNum.BopType.MUL, t.exp, coeff.up, t.exp.source);
            } else if (coeff.up == 1) {
                right = ExpNum.bop(ExpNum.BopType.TRUEDIV, t.exp, coeff.down, t.exp.source);
            } else {
                right = ExpNum.bop(ExpNum.BopType.TRUEDIV,
                        ExpNum.bop(ExpNum.BopType.MUL, t.exp, coeff.up, t.exp.source), coeff.down, t.exp.source);
            }
            left = left == null ? right : ExpNum.bop(ExpNum.BopType.ADD, left, right, left.source);
        }
        Fraction cst = constant.norm();
        if (cst.up == 0) {
            return left != null ? left : ExpNum.fromConst(0, null);
        }
        ExpNum cstExp = cst.down == 1
                ? ExpNum.fromConst(cst.up, null)
                : ExpNum.bop(ExpNum.BopType.TRUEDIV, ExpNum.fromConst(cst.up, null), cst.down, null);
        return left != null ? ExpNum.bop(ExpNum.BopType.ADD, left, cstExp, left.source) : cstExp;
    }

    @Override
    public String toString() {
        return terms + " + " + constant;
    }
}
