package com.shapetea.constraint;

import com.shapetea.ir.CodeSource;
import com.shapetea.symbolic.ExpBool;
import com.shapetea.symbolic.ExpNum;
import com.shapetea.symbolic.ExpShape;
import com.shapetea.symbolic.SymExp;
import com.shapetea.symbolic.SymVal;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable constraint node. Every node built through a {@link ConstraintSet} carries a
 * fresh id; helper nodes produced while rewriting (negation, boolean lowering) use id -1
 * and never enter a constraint pool.
 */
public abstract class Constraint {

    public final int id;
    public final CodeSource source;
    /** Optional human readable reason attached by require/guarantee callers. */
    public final String message;

    protected Constraint(int id, CodeSource source, String message) {
        this.id = id;
        this.source = source;
        this.message = message;
    }

    public abstract ConstraintType type();

    public abstract Constraint withMessage(String message);

    protected abstract void collectSymbols(List<Integer> out);

    public final List<Integer> extractSymbols() {
        List<Integer> out = new ArrayList<>();
        collectSymbols(out);
        return out;
    }

    // ===================== nodes =====================

    /** A raw boolean expression used as a constraint. */
    public static final class FromBool extends Constraint {
        public final ExpBool exp;

        public FromBool(int id, ExpBool exp, CodeSource source, String message) {
            super(id, source, message);
            this.exp = Objects.requireNonNull(exp);
        }

        @Override public ConstraintType type() { return ConstraintType.EXP_BOOL; }
        @Override public FromBool withMessage(String m) { return new FromBool(id, exp, source, m); }
        @Override protected void collectSymbols(List<Integer> out) { out.addAll(exp.extractSymbols()); }
        @Override public String toString() { return exp.toString(); }
    }

    /** Equal / NotEqual over any expressions, LessThan / LessThanOrEqual over numbers. */
    public static final class Compare extends Constraint {
        public final ConstraintType type;
        public final SymExp left;
        public final SymExp right;

        public Compare(int id, ConstraintType type, SymExp left, SymExp right, CodeSource source, String message) {
            super(id, source, message);
            if (!type.isCompare()) {
                throw new IllegalArgumentException("not a comparison: " + type);
            }
            this.type = type;
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        @Override public ConstraintType type() { return type; }
        @Override public Compare withMessage(String m) { return new Compare(id, type, left, right, source, m); }

        public Compare withOperands(ConstraintType newType, SymExp l, SymExp r) {
            return new Compare(id, newType, l, r, source, message);
        }

        public ExpNum numLeft() { return (ExpNum) left; }
        public ExpNum numRight() { return (ExpNum) right; }

        @Override
        protected void collectSymbols(List<Integer> out) {
            out.addAll(left.extractSymbols());
            out.addAll(right.extractSymbols());
        }

        @Override
        public String toString() {
            String op;
            switch (type) {
                case EQUAL: op = "=="; break;
                case NOT_EQUAL: op = "!="; break;
                case LESS_THAN: op = "<"; break;
                default: op = "<="; break;
            }
            return "(" + left + " " + op + " " + right + ")";
        }
    }

    public static final class Logic extends Constraint {
        public final ConstraintType type;
        public final Constraint left;
        public final Constraint right;

        public Logic(int id, ConstraintType type, Constraint left, Constraint right, CodeSource source, String message) {
            super(id, source, message);
            if (type != ConstraintType.AND && type != ConstraintType.OR) {
                throw new IllegalArgumentException("not a connective: " + type);
            }
            this.type = type;
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        @Override public ConstraintType type() { return type; }
        @Override public Logic withMessage(String m) { return new Logic(id, type, left, right, source, m); }

        public Logic with(ConstraintType newType, Constraint l, Constraint r) {
            return new Logic(id, newType, l, r, source, message);
        }

        @Override
        protected void collectSymbols(List<Integer> out) {
            left.collectSymbols(out);
            right.collectSymbols(out);
        }

        @Override
        public String toString() {
            return "(" + left + (type == ConstraintType.AND ? " && " : " || ") + right + ")";
        }
    }

    public static final class Not extends Constraint {
        public final Constraint constraint;

        public Not(int id, Constraint constraint, CodeSource source, String message) {
            super(id, source, message);
            this.constraint = Objects.requireNonNull(constraint);
        }

        @Override public ConstraintType type() { return ConstraintType.NOT; }
        @Override public Not withMessage(String m) { return new Not(id, constraint, source, m); }
        @Override protected void collectSymbols(List<Integer> out) { constraint.collectSymbols(out); }
        @Override public String toString() { return "~(" + constraint + ")"; }
    }

    /** {@code forall symbol in [start, end): constraint}. */
    public static final class Forall extends Constraint {
        public final SymVal symbol;
        public final ExpNum rangeStart;
        public final ExpNum rangeEnd;
        public final Constraint constraint;

        public Forall(int id, SymVal symbol, ExpNum rangeStart, ExpNum rangeEnd, Constraint constraint,
                      CodeSource source, String message) {
            super(id, source, message);
            this.symbol = symbol;
            this.rangeStart = rangeStart;
            this.rangeEnd = rangeEnd;
            this.constraint = constraint;
        }

        @Override public ConstraintType type() { return ConstraintType.FORALL; }

        @Override
        public Forall withMessage(String m) {
            return new Forall(id, symbol, rangeStart, rangeEnd, constraint, source, m);
        }

        @Override
        protected void collectSymbols(List<Integer> out) {
            constraint.collectSymbols(out);
            out.addAll(rangeStart.extractSymbols());
            out.addAll(rangeEnd.extractSymbols());
        }

        @Override
        public String toString() {
            return "forall[" + symbol.name + " in (" + rangeStart + ":" + rangeEnd + ")](" + constraint + ")";
        }
    }

    public static final class Broadcastable extends Constraint {
        public final ExpShape left;
        public final ExpShape right;

        public Broadcastable(int id, ExpShape left, ExpShape right, CodeSource source, String message) {
            super(id, source, message);
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        @Override public ConstraintType type() { return ConstraintType.BROADCASTABLE; }
        @Override public Broadcastable withMessage(String m) { return new Broadcastable(id, left, right, source, m); }

        @Override
        protected void collectSymbols(List<Integer> out) {
            out.addAll(left.extractSymbols());
            out.addAll(right.extractSymbols());
        }

        @Override public String toString() { return "broadcastable(" + left + ", " + right + ")"; }
    }

    public static final class Fail extends Constraint {
        public final String reason;

        public Fail(int id, String reason, CodeSource source, String message) {
            super(id, source, message);
            this.reason = reason;
        }

        @Override public ConstraintType type() { return ConstraintType.FAIL; }
        @Override public Fail withMessage(String m) { return new Fail(id, reason, source, m); }
        @Override protected void collectSymbols(List<Integer> out) {}
        @Override public String toString() { return "fail(" + reason + ")"; }
    }

    // ===================== rewriting helpers =====================

    /** Lowers a boolean expression into constraint structure. Produced nodes have id -1. */
    public static Constraint fromExp(ExpBool exp) {
        switch (exp.opType()) {
            case SYMBOL:
            case CONST:
                return new Compare(-1, ConstraintType.EQUAL, exp, ExpBool.fromConst(true, exp.source), exp.source, null);
            case EQUAL:
            case NOT_EQUAL:
            case LESS_THAN:
            case LESS_THAN_OR_EQUAL: {
                ExpBool.Compare c = (ExpBool.Compare) exp;
                ConstraintType t;
                switch (exp.opType()) {
                    case EQUAL: t = ConstraintType.EQUAL; break;
                    case NOT_EQUAL: t = ConstraintType.NOT_EQUAL; break;
                    case LESS_THAN: t = ConstraintType.LESS_THAN; break;
                    default: t = ConstraintType.LESS_THAN_OR_EQUAL; break;
                }
                return new Compare(-1, t, c.left, c.right, exp.source, null);
            }
            case NOT:
                return new Not(-1, fromExp(((ExpBool.Not) exp).baseBool), exp.source, null);
            case AND:
            case OR: {
                ExpBool.Logic l = (ExpBool.Logic) exp;
                return new Logic(-1, exp.opType() == ExpBool.OpType.AND ? ConstraintType.AND : ConstraintType.OR,
                        fromExp(l.left), fromExp(l.right), exp.source, null);
            }
            default:
                throw new IllegalStateException("unknown bool op " + exp.opType());
        }
    }

    /** Pushes a negation through the constraint (De Morgan, flipped comparisons). */
    public static Constraint negate(Constraint constraint) {
        switch (constraint.type()) {
            case EXP_BOOL:
                return negate(fromExp(((FromBool) constraint).exp));
            case EQUAL: {
                Compare c = (Compare) constraint;
                return c.withOperands(ConstraintType.NOT_EQUAL, c.left, c.right);
            }
            case NOT_EQUAL: {
                Compare c = (Compare) constraint;
                return c.withOperands(ConstraintType.EQUAL, c.left, c.right);
            }
            case LESS_THAN: {
                Compare c = (Compare) constraint;
                return c.withOperands(ConstraintType.LESS_THAN_OR_EQUAL, c.right, c.left);
            }
            case LESS_THAN_OR_EQUAL: {
                Compare c = (Compare) constraint;
                return c.withOperands(ConstraintType.LESS_THAN, c.right, c.left);
            }
            case AND: {
                Logic l = (Logic) constraint;
                return l.with(ConstraintType.OR, negate(l.left), negate(l.right));
            }
            case OR: {
                Logic l = (Logic) constraint;
                return l.with(ConstraintType.AND, negate(l.left), negate(l.right));
            }
            case NOT:
                return ((Not) constraint).constraint;
            case FAIL:
                return fromExp(ExpBool.fromConst(true, constraint.source));
            default:
                return new Not(-1, constraint, constraint.source, null);
        }
    }
}
