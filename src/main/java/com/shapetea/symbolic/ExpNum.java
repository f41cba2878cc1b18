package com.shapetea.symbolic;

import com.shapetea.ir.CodeSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Numeric (int or float) symbolic expressions. */
public abstract class ExpNum extends SymExp {

    public enum OpType { CONST, SYMBOL, BOP, INDEX, MAX, NUMEL, UOP, MIN }

    public enum BopType {
        ADD("+"), SUB("-"), MUL("*"), TRUEDIV("/."), FLOORDIV("//"), MOD("%");

        private final String symbol;

        BopType(String symbol) { this.symbol = symbol; }

        public String symbol() { return symbol; }
    }

    public enum UopType {
        NEG("-"), FLOOR("floor"), CEIL("ceil"), ABS("abs");

        private final String symbol;

        UopType(String symbol) { this.symbol = symbol; }

        public String symbol() { return symbol; }
    }

    protected ExpNum(CodeSource source) {
        super(source);
    }

    @Override
    public final Kind kind() {
        return Kind.NUM;
    }

    public abstract OpType opType();

    @Override
    public abstract ExpNum withSource(CodeSource source);

    public boolean isConst() {
        return opType() == OpType.CONST;
    }

    /** Value of a constant node. Callers check {@link #isConst()} first. */
    public double constValue() {
        return ((Const) this).value;
    }

    // ===================== factories =====================

    public static Const fromConst(double value, CodeSource source) {
        return new Const(value, false, source);
    }

    public static Const box(double value, CodeSource source) {
        return new Const(value, true, source);
    }

    public static Symbol fromSymbol(SymVal symbol) {
        if (!symbol.isNumeric()) {
            throw new IllegalArgumentException("not a numeric symbol: " + symbol);
        }
        return new Symbol(symbol, symbol.source);
    }

    public static Bop bop(BopType type, ExpNum left, ExpNum right, CodeSource source) {
        return new Bop(type, left, right, source);
    }

    public static Bop bop(BopType type, ExpNum left, double right, CodeSource source) {
        return new Bop(type, left, fromConst(right, source), source);
    }

    public static Bop bop(BopType type, double left, ExpNum right, CodeSource source) {
        return new Bop(type, fromConst(left, source), right, source);
    }

    public static Index index(ExpShape baseShape, ExpNum index, CodeSource source) {
        return new Index(baseShape, index, source != null ? source : baseShape.source);
    }

    public static Index index(ExpShape baseShape, double index, CodeSource source) {
        return index(baseShape, fromConst(index, null), source);
    }

    public static Max max(List<ExpNum> values, CodeSource source) {
        return new Max(values, source);
    }

    public static Min min(List<ExpNum> values, CodeSource source) {
        return new Min(values, source);
    }

    public static Numel numel(ExpShape shape, CodeSource source) {
        return new Numel(shape, source != null ? source : shape.source);
    }

    public static Uop uop(UopType type, ExpNum base, CodeSource source) {
        return new Uop(type, base, source);
    }

    /** True when the expression is integral by construction (no true division, int symbols only). */
    public static boolean isStructuallyInt(ExpNum exp) {
        switch (exp.opType()) {
            case BOP: {
                Bop b = (Bop) exp;
                if (b.bopType == BopType.TRUEDIV) return false;
                return isStructuallyInt(b.left) && isStructuallyInt(b.right);
            }
            case CONST:
                return NumRange.isInteger(((Const) exp).value);
            case MAX:
                return ((Max) exp).values.stream().allMatch(ExpNum::isStructuallyInt);
            case MIN:
                return ((Min) exp).values.stream().allMatch(ExpNum::isStructuallyInt);
            case SYMBOL:
                return ((Symbol) exp).symbol.type == SymbolType.INT;
            case NUMEL:
            case INDEX:
                return true;
            case UOP: {
                Uop u = (Uop) exp;
                if (u.uopType == UopType.FLOOR || u.uopType == UopType.CEIL) return true;
                return isStructuallyInt(u.baseValue);
            }
            default:
                return false;
        }
    }

    // ===================== nodes =====================

    public static final class Const extends ExpNum {
        public final double value;
        /** Boxed constants are produced by the frontend for literal placeholders and print the same way. */
        public final boolean boxed;

        Const(double value, boolean boxed, CodeSource source) {
            super(source);
            this.value = value + 0.0;
            this.boxed = boxed;
        }

        @Override public OpType opType() { return OpType.CONST; }
        @Override public Const withSource(CodeSource s) { return new Const(value, boxed, s); }
        @Override protected void collectSymbols(List<Integer> out) {}

        @Override
        public boolean equals(Object o) {
            return o instanceof Const && ((Const) o).value == value;
        }

        @Override public int hashCode() { return Double.hashCode(value); }
        @Override public String toString() { return NumRange.formatNum(value); }
    }

    public static final class Symbol extends ExpNum {
        public final SymVal symbol;

        Symbol(SymVal symbol, CodeSource source) {
            super(source);
            this.symbol = symbol;
        }

        @Override public OpType opType() { return OpType.SYMBOL; }
        @Override public Symbol withSource(CodeSource s) { return new Symbol(symbol, s); }
        @Override protected void collectSymbols(List<Integer> out) { out.add(symbol.id); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Symbol && ((Symbol) o).symbol.id == symbol.id;
        }

        @Override public int hashCode() { return symbol.id; }
        @Override public String toString() { return symbol.name; }
    }

    public static final class Bop extends ExpNum {
        public final BopType bopType;
        public final ExpNum left;
        public final ExpNum right;

        Bop(BopType bopType, ExpNum left, ExpNum right, CodeSource source) {
            super(source);
            this.bopType = Objects.requireNonNull(bopType);
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        @Override public OpType opType() { return OpType.BOP; }
        @Override public Bop withSource(CodeSource s) { return new Bop(bopType, left, right, s); }

        @Override
        protected void collectSymbols(List<Integer> out) {
            left.collectSymbols(out);
            right.collectSymbols(out);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Bop)) return false;
            Bop b = (Bop) o;
            return bopType == b.bopType && left.equals(b.left) && right.equals(b.right);
        }

        @Override public int hashCode() { return Objects.hash(bopType, left, right); }

        @Override
        public String toString() {
            return "(" + left + " " + bopType.symbol() + " " + right + ")";
        }
    }

    /** 0-based dimension of a shape. */
    public static final class Index extends ExpNum {
        public final ExpShape baseShape;
        public final ExpNum index;

        Index(ExpShape baseShape, ExpNum index, CodeSource source) {
            super(source);
            this.baseShape = Objects.requireNonNull(baseShape);
            this.index = Objects.requireNonNull(index);
        }

        @Override public OpType opType() { return OpType.INDEX; }
        @Override public Index withSource(CodeSource s) { return new Index(baseShape, index, s); }

        @Override
        protected void collectSymbols(List<Integer> out) {
            baseShape.collectSymbols(out);
            index.collectSymbols(out);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Index)) return false;
            Index i = (Index) o;
            return index.equals(i.index) && baseShape.equals(i.baseShape);
        }

        @Override public int hashCode() { return Objects.hash(baseShape, index); }
        @Override public String toString() { return "index(" + baseShape + ", " + index + ")"; }
    }

    public static final class Max extends ExpNum {
        public final List<ExpNum> values;

        Max(List<ExpNum> values, CodeSource source) {
            super(source);
            this.values = List.copyOf(values);
        }

        @Override public OpType opType() { return OpType.MAX; }
        @Override public Max withSource(CodeSource s) { return new Max(values, s); }
        @Override protected void collectSymbols(List<Integer> out) { values.forEach(v -> v.collectSymbols(out)); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Max && ((Max) o).values.equals(values);
        }

        @Override public int hashCode() { return 17 + values.hashCode(); }
        @Override public String toString() { return "max(" + joinValues(values) + ")"; }
    }

    public static final class Min extends ExpNum {
        public final List<ExpNum> values;

        Min(List<ExpNum> values, CodeSource source) {
            super(source);
            this.values = List.copyOf(values);
        }

        @Override public OpType opType() { return OpType.MIN; }
        @Override public Min withSource(CodeSource s) { return new Min(values, s); }
        @Override protected void collectSymbols(List<Integer> out) { values.forEach(v -> v.collectSymbols(out)); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Min && ((Min) o).values.equals(values);
        }

        @Override public int hashCode() { return 19 + values.hashCode(); }
        @Override public String toString() { return "min(" + joinValues(values) + ")"; }
    }

    public static final class Numel extends ExpNum {
        public final ExpShape shape;

        Numel(ExpShape shape, CodeSource source) {
            super(source);
            this.shape = Objects.requireNonNull(shape);
        }

        @Override public OpType opType() { return OpType.NUMEL; }
        @Override public Numel withSource(CodeSource s) { return new Numel(shape, s); }
        @Override protected void collectSymbols(List<Integer> out) { shape.collectSymbols(out); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Numel && ((Numel) o).shape.equals(shape);
        }

        @Override public int hashCode() { return 23 + shape.hashCode(); }
        @Override public String toString() { return "numel(" + shape + ")"; }
    }

    public static final class Uop extends ExpNum {
        public final UopType uopType;
        public final ExpNum baseValue;

        Uop(UopType uopType, ExpNum baseValue, CodeSource source) {
            super(source);
            this.uopType = Objects.requireNonNull(uopType);
            this.baseValue = Objects.requireNonNull(baseValue);
        }

        @Override public OpType opType() { return OpType.UOP; }
        @Override public Uop withSource(CodeSource s) { return new Uop(uopType, baseValue, s); }
        @Override protected void collectSymbols(List<Integer> out) { baseValue.collectSymbols(out); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Uop)) return false;
            Uop u = (Uop) o;
            return uopType == u.uopType && baseValue.equals(u.baseValue);
        }

        @Override public int hashCode() { return Objects.hash(uopType, baseValue); }
        @Override public String toString() { return uopType.symbol() + "(" + baseValue + ")"; }
    }

    static String joinValues(List<ExpNum> values) {
        List<String> parts = new ArrayList<>(values.size());
        for (ExpNum v : values) parts.add(v.toString());
        return String.join(", ", parts);
    }
}
