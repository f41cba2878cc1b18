package com.shapetea.constraint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.shapetea.debug.Debug;
import com.shapetea.symbolic.ExpBool;
import com.shapetea.symbolic.ExpNum;
import com.shapetea.symbolic.ExpString;
import com.shapetea.symbolic.Fraction;
import com.shapetea.symbolic.LinearForm;
import com.shapetea.symbolic.NumRange;
import com.shapetea.symbolic.SymExp;
import com.shapetea.symbolic.SymVal;
import com.shapetea.symbolic.SymbolType;

/**
 * Incremental cache refinement for hard and path constraints.
 *
 * <p>A constraint is simplified, then destructed into primitive comparisons: conjunctions
 * are split, negations pushed inward, and a disjunction survives only when one side is
 * immediately false. Each primitive that normalises to {@code coeff * sym  op  const}
 * narrows the range of {@code sym}. Equalities against string constants feed the string
 * caches. Anything else is left alone; the constraint is still recorded by the caller.
 */
public final class ConstraintSolver {

    static final int MAX_STEPS = 100;

    enum SolveType { LT, LTE, GT, GTE, EQ, NEQ }

    private ConstraintSet ctrSet;

    public ConstraintSolver(ConstraintSet ctrSet) {
        this.ctrSet = ctrSet;
    }

    public ConstraintSet ctrSet() {
        return ctrSet;
    }

    public ConstraintSolver solve(Constraint constraint) {
        List<Constraint> primitives = destruct(ExpSimplifier.simplifyConstraint(ctrSet, constraint), 0);
        for (Constraint ctr : primitives) {
            solvePrimitive(ctr);
        }
        return this;
    }

    public ConstraintSolver solveAll(List<Constraint> constraints) {
        for (Constraint c : constraints) solve(c);
        return this;
    }

    // ===================== destructing =====================

    private List<Constraint> destruct(Constraint constraint, int depth) {
        if (depth > MAX_STEPS) {
            Debug.get().w(Debug.TAG_SOLVER, "constraint nesting exceeds " + MAX_STEPS + "; ignored for caching");
            return Collections.emptyList();
        }
        switch (constraint.type()) {
            case EXP_BOOL:
                return destruct(Constraint.fromExp(((Constraint.FromBool) constraint).exp), depth + 1);
            case EQUAL:
            case NOT_EQUAL: {
                Constraint.Compare c = (Constraint.Compare) constraint;
                if (c.left.kind() != c.right.kind()) return Collections.emptyList();
                return Collections.singletonList(constraint);
            }
            case NOT: {
                Constraint negated = Constraint.negate(((Constraint.Not) constraint).constraint);
                if (negated.type() == ConstraintType.NOT) return Collections.emptyList();
                return destruct(negated, depth + 1);
            }
            case AND: {
                Constraint.Logic l = (Constraint.Logic) constraint;
                List<Constraint> out = new ArrayList<>(destruct(l.left, depth + 1));
                out.addAll(destruct(l.right, depth + 1));
                return out;
            }
            case OR: {
                Constraint.Logic l = (Constraint.Logic) constraint;
                Boolean leftVal = ctrSet.checkImmediate(l.left);
                if (Boolean.TRUE.equals(leftVal)) {
                    return Collections.emptyList();
                } else if (Boolean.FALSE.equals(leftVal)) {
                    return destruct(l.right, depth + 1);
                }
                Boolean rightVal = ctrSet.checkImmediate(l.right);
                if (Boolean.FALSE.equals(rightVal)) {
                    return destruct(l.left, depth + 1);
                }
                return Collections.emptyList();
            }
            case LESS_THAN:
            case LESS_THAN_OR_EQUAL:
                return Collections.singletonList(constraint);
            default:
                // forall / broadcastable / fail carry no range information
                return Collections.emptyList();
        }
    }

    private void solvePrimitive(Constraint ctr) {
        if (!(ctr instanceof Constraint.Compare)) return;
        Constraint.Compare c = (Constraint.Compare) ctr;
        switch (c.left.kind()) {
            case NUM:
                solveNum(c);
                break;
            case STRING:
                solveString(c);
                break;
            case BOOL:
                solveBool(c);
                break;
            default:
                break;
        }
    }

    // ===================== numbers =====================

    private void solveNum(Constraint.Compare c) {
        SolveType type;
        switch (c.type) {
            case LESS_THAN: type = SolveType.LT; break;
            case LESS_THAN_OR_EQUAL: type = SolveType.LTE; break;
            case EQUAL: type = SolveType.EQ; break;
            default: type = SolveType.NEQ; break;
        }

        // left - right  op  0  ==>  sum(coeff * term)  op  -constant
        LinearForm form = LinearForm.normalize(ExpNum.bop(ExpNum.BopType.SUB, c.numLeft(), c.numRight(), c.source));
        Fraction right = Fraction.ZERO.sub(form.constant).norm();

        ExpNum.Symbol symbol = null;
        Fraction coeff = Fraction.ZERO;
        int steps = 0;
        for (LinearForm.Term term : form.terms) {
            if (++steps > MAX_STEPS) {
                Debug.get().w(Debug.TAG_SOLVER, "solver step count exceeded maximal loop limit");
                return;
            }
            if (!(term.exp instanceof ExpNum.Symbol)) {
                // non-linear remainder (index, numel, products of symbols ...)
                return;
            }
            ExpNum.Symbol sym = (ExpNum.Symbol) term.exp;
            if (symbol != null && symbol.symbol.id != sym.symbol.id) {
                // more than one variable
                return;
            }
            symbol = sym;
            coeff = coeff.add(term.coeff).norm();
        }
        if (symbol == null || coeff.isZero()) return;

        resolve(symbol.symbol, coeff, right, type);
    }

    private void resolve(SymVal symbol, Fraction coeff, Fraction right, SolveType type) {
        Fraction bound = right.div(coeff);
        if (coeff.up * coeff.down < 0) {
            type = flip(type);
        }
        double num = bound.toNum();
        if (Double.isNaN(num)) return;

        NumRange range = ctrSet.getSymbolRange(symbol);
        if (type == SolveType.NEQ) {
            if (range == null) return;
            NumRange trimmed = null;
            if (range.end == num && range.hasEnd) {
                trimmed = new NumRange(range.start, range.end, range.hasStart, false);
            } else if (range.start == num && range.hasStart) {
                trimmed = new NumRange(range.start, range.end, false, range.hasEnd);
            }
            if (trimmed == null) return;
            store(symbol, trimmed);
            return;
        }

        NumRange subRange;
        switch (type) {
            case LT: subRange = NumRange.genLt(num); break;
            case LTE: subRange = NumRange.genLte(num); break;
            case GT: subRange = NumRange.genGt(num); break;
            case GTE: subRange = NumRange.genGte(num); break;
            default: subRange = NumRange.fromConst(num); break;
        }
        store(symbol, range == null ? subRange : range.intersect(subRange));
    }

    private void store(SymVal symbol, NumRange range) {
        if (symbol.type == SymbolType.INT) {
            range = range.toIntRange();
        }
        if (range == null) {
            // empty integer range; the immediate check owns invalidation
            Debug.get().d(Debug.TAG_SOLVER, "range of " + symbol.name + " became empty");
            return;
        }
        Debug.get().t(Debug.TAG_SOLVER, symbol.name + " in " + range);
        ctrSet = ctrSet.withRange(symbol.id, range);
    }

    private static SolveType flip(SolveType type) {
        switch (type) {
            case LT: return SolveType.GT;
            case LTE: return SolveType.GTE;
            case GT: return SolveType.LT;
            case GTE: return SolveType.LTE;
            default: return type;
        }
    }

    // ===================== strings / bools =====================

    private void solveString(Constraint.Compare c) {
        ExpString left = (ExpString) c.left;
        ExpString right = (ExpString) c.right;
        ExpString.Symbol sym;
        String value;
        if (left instanceof ExpString.Symbol && right instanceof ExpString.Const) {
            sym = (ExpString.Symbol) left;
            value = ((ExpString.Const) right).value;
        } else if (right instanceof ExpString.Symbol && left instanceof ExpString.Const) {
            sym = (ExpString.Symbol) right;
            value = ((ExpString.Const) left).value;
        } else {
            return;
        }
        if (c.type == ConstraintType.EQUAL) {
            ctrSet = ctrSet.withString(sym.symbol.id, value);
        } else if (c.type == ConstraintType.NOT_EQUAL) {
            ctrSet = ctrSet.withNonString(sym.symbol.id, value);
        }
    }

    private void solveBool(Constraint.Compare c) {
        SymExp symSide;
        boolean value;
        if (c.left instanceof ExpBool.Symbol && c.right instanceof ExpBool.Const) {
            symSide = c.left;
            value = ((ExpBool.Const) c.right).value;
        } else if (c.right instanceof ExpBool.Symbol && c.left instanceof ExpBool.Const) {
            symSide = c.right;
            value = ((ExpBool.Const) c.left).value;
        } else {
            return;
        }
        if (c.type == ConstraintType.NOT_EQUAL) {
            value = !value;
        } else if (c.type != ConstraintType.EQUAL) {
            return;
        }
        SymVal sym = ((ExpBool.Symbol) symSide).symbol;
        ctrSet = ctrSet.withRange(sym.id, NumRange.fromConst(value ? 1 : 0));
    }
}
