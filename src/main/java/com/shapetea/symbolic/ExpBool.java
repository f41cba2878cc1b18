package com.shapetea.symbolic;

import com.shapetea.ir.CodeSource;

import java.util.List;
import java.util.Objects;

/** Boolean symbolic expressions. */
public abstract class ExpBool extends SymExp {

    public enum OpType { CONST, SYMBOL, EQUAL, NOT_EQUAL, LESS_THAN, LESS_THAN_OR_EQUAL, NOT, AND, OR }

    protected ExpBool(CodeSource source) {
        super(source);
    }

    @Override
    public final Kind kind() {
        return Kind.BOOL;
    }

    public abstract OpType opType();

    @Override
    public abstract ExpBool withSource(CodeSource source);

    public static Const fromConst(boolean value, CodeSource source) {
        return new Const(value, source);
    }

    public static Symbol fromSymbol(SymVal symbol) {
        if (symbol.type != SymbolType.BOOL) {
            throw new IllegalArgumentException("not a boolean symbol: " + symbol);
        }
        return new Symbol(symbol, symbol.source);
    }

    public static Compare eq(SymExp left, SymExp right, CodeSource source) {
        return new Compare(OpType.EQUAL, left, right, source);
    }

    public static Compare neq(SymExp left, SymExp right, CodeSource source) {
        return new Compare(OpType.NOT_EQUAL, left, right, source);
    }

    public static Compare lt(ExpNum left, ExpNum right, CodeSource source) {
        return new Compare(OpType.LESS_THAN, left, right, source);
    }

    public static Compare lte(ExpNum left, ExpNum right, CodeSource source) {
        return new Compare(OpType.LESS_THAN_OR_EQUAL, left, right, source);
    }

    public static Not not(ExpBool base, CodeSource source) {
        return new Not(base, source != null ? source : base.source);
    }

    public static Logic and(ExpBool left, ExpBool right, CodeSource source) {
        return new Logic(OpType.AND, left, right, source);
    }

    public static Logic or(ExpBool left, ExpBool right, CodeSource source) {
        return new Logic(OpType.OR, left, right, source);
    }

    public static final class Const extends ExpBool {
        public final boolean value;

        Const(boolean value, CodeSource source) {
            super(source);
            this.value = value;
        }

        @Override public OpType opType() { return OpType.CONST; }
        @Override public Const withSource(CodeSource s) { return new Const(value, s); }
        @Override protected void collectSymbols(List<Integer> out) {}
        @Override public boolean equals(Object o) { return o instanceof Const && ((Const) o).value == value; }
        @Override public int hashCode() { return Boolean.hashCode(value); }
        @Override public String toString() { return Boolean.toString(value); }
    }

    public static final class Symbol extends ExpBool {
        public final SymVal symbol;

        Symbol(SymVal symbol, CodeSource source) {
            super(source);
            this.symbol = symbol;
        }

        @Override public OpType opType() { return OpType.SYMBOL; }
        @Override public Symbol withSource(CodeSource s) { return new Symbol(symbol, s); }
        @Override protected void collectSymbols(List<Integer> out) { out.add(symbol.id); }
        @Override public boolean equals(Object o) { return o instanceof Symbol && ((Symbol) o).symbol.id == symbol.id; }
        @Override public int hashCode() { return symbol.id * 7; }
        @Override public String toString() { return symbol.name; }
    }

    /**
     * Binary comparison. Equality works over any pair of expressions of one kind,
     * ordering comparisons are numeric only.
     */
    public static final class Compare extends ExpBool {
        public final OpType op;
        public final SymExp left;
        public final SymExp right;

        Compare(OpType op, SymExp left, SymExp right, CodeSource source) {
            super(source);
            this.op = op;
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        @Override public OpType opType() { return op; }
        @Override public Compare withSource(CodeSource s) { return new Compare(op, left, right, s); }

        public ExpNum numLeft() { return (ExpNum) left; }
        public ExpNum numRight() { return (ExpNum) right; }

        @Override
        protected void collectSymbols(List<Integer> out) {
            left.collectSymbols(out);
            right.collectSymbols(out);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Compare)) return false;
            Compare c = (Compare) o;
            return op == c.op && left.equals(c.left) && right.equals(c.right);
        }

        @Override public int hashCode() { return Objects.hash(op, left, right); }

        @Override
        public String toString() {
            String sym;
            switch (op) {
                case EQUAL: sym = "=="; break;
                case NOT_EQUAL: sym = "!="; break;
                case LESS_THAN: sym = "<"; break;
                default: sym = "<="; break;
            }
            return "(" + left + " " + sym + " " + right + ")";
        }
    }

    public static final class Not extends ExpBool {
        public final ExpBool baseBool;

        Not(ExpBool baseBool, CodeSource source) {
            super(source);
            this.baseBool = Objects.requireNonNull(baseBool);
        }

        @Override public OpType opType() { return OpType.NOT; }
        @Override public Not withSource(CodeSource s) { return new Not(baseBool, s); }
        @Override protected void collectSymbols(List<Integer> out) { baseBool.collectSymbols(out); }
        @Override public boolean equals(Object o) { return o instanceof Not && ((Not) o).baseBool.equals(baseBool); }
        @Override public int hashCode() { return 31 + baseBool.hashCode(); }
        @Override public String toString() { return "~(" + baseBool + ")"; }
    }

    public static final class Logic extends ExpBool {
        public final OpType op;
        public final ExpBool left;
        public final ExpBool right;

        Logic(OpType op, ExpBool left, ExpBool right, CodeSource source) {
            super(source);
            this.op = op;
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        @Override public OpType opType() { return op; }
        @Override public Logic withSource(CodeSource s) { return new Logic(op, left, right, s); }

        @Override
        protected void collectSymbols(List<Integer> out) {
            left.collectSymbols(out);
            right.collectSymbols(out);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Logic)) return false;
            Logic l = (Logic) o;
            return op == l.op && left.equals(l.left) && right.equals(l.right);
        }

        @Override public int hashCode() { return Objects.hash(op, left, right); }

        @Override
        public String toString() {
            return "(" + left + (op == OpType.AND ? " && " : " || ") + right + ")";
        }
    }
}
