package com.shapetea.symbolic;

import com.shapetea.ir.CodeSource;

import java.util.List;
import java.util.Objects;

/** String symbolic expressions. */
public abstract class ExpString extends SymExp {

    public enum OpType { CONST, SYMBOL, SLICE, CONCAT }

    protected ExpString(CodeSource source) {
        super(source);
    }

    @Override
    public final Kind kind() {
        return Kind.STRING;
    }

    public abstract OpType opType();

    @Override
    public abstract ExpString withSource(CodeSource source);

    public static Const fromConst(String value, CodeSource source) {
        return new Const(value, source);
    }

    public static Symbol fromSymbol(SymVal symbol) {
        if (symbol.type != SymbolType.STRING) {
            throw new IllegalArgumentException("not a string symbol: " + symbol);
        }
        return new Symbol(symbol, symbol.source);
    }

    /** Slice with 0-based exclusive end. A null bound means "from start" / "to end". */
    public static Slice slice(ExpString base, ExpNum start, ExpNum end, CodeSource source) {
        return new Slice(base, start, end, source);
    }

    public static Concat concat(ExpString left, ExpString right, CodeSource source) {
        return new Concat(left, right, source);
    }

    public static final class Const extends ExpString {
        public final String value;

        Const(String value, CodeSource source) {
            super(source);
            this.value = Objects.requireNonNull(value);
        }

        @Override public OpType opType() { return OpType.CONST; }
        @Override public Const withSource(CodeSource s) { return new Const(value, s); }
        @Override protected void collectSymbols(List<Integer> out) {}
        @Override public boolean equals(Object o) { return o instanceof Const && ((Const) o).value.equals(value); }
        @Override public int hashCode() { return value.hashCode(); }
        @Override public String toString() { return value; }
    }

    public static final class Symbol extends ExpString {
        public final SymVal symbol;

        Symbol(SymVal symbol, CodeSource source) {
            super(source);
            this.symbol = symbol;
        }

        @Override public OpType opType() { return OpType.SYMBOL; }
        @Override public Symbol withSource(CodeSource s) { return new Symbol(symbol, s); }
        @Override protected void collectSymbols(List<Integer> out) { out.add(symbol.id); }
        @Override public boolean equals(Object o) { return o instanceof Symbol && ((Symbol) o).symbol.id == symbol.id; }
        @Override public int hashCode() { return symbol.id * 11; }
        @Override public String toString() { return symbol.name; }
    }

    public static final class Slice extends ExpString {
        public final ExpString baseString;
        public final ExpNum start;
        public final ExpNum end;

        Slice(ExpString baseString, ExpNum start, ExpNum end, CodeSource source) {
            super(source);
            this.baseString = Objects.requireNonNull(baseString);
            this.start = start;
            this.end = end;
        }

        @Override public OpType opType() { return OpType.SLICE; }
        @Override public Slice withSource(CodeSource s) { return new Slice(baseString, start, end, s); }

        @Override
        protected void collectSymbols(List<Integer> out) {
            baseString.collectSymbols(out);
            collect(start, out);
            collect(end, out);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Slice)) return false;
            Slice s = (Slice) o;
            return baseString.equals(s.baseString) && Objects.equals(start, s.start) && Objects.equals(end, s.end);
        }

        @Override public int hashCode() { return Objects.hash(baseString, start, end); }
        @Override public String toString() { return "slice(" + baseString + ", " + str(start) + ", " + str(end) + ")"; }
    }

    public static final class Concat extends ExpString {
        public final ExpString left;
        public final ExpString right;

        Concat(ExpString left, ExpString right, CodeSource source) {
            super(source);
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        @Override public OpType opType() { return OpType.CONCAT; }
        @Override public Concat withSource(CodeSource s) { return new Concat(left, right, s); }

        @Override
        protected void collectSymbols(List<Integer> out) {
            left.collectSymbols(out);
            right.collectSymbols(out);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Concat)) return false;
            Concat c = (Concat) o;
            return left.equals(c.left) && right.equals(c.right);
        }

        @Override public int hashCode() { return Objects.hash(left, right, 3); }
        @Override public String toString() { return "concat(" + left + ", " + right + ")"; }
    }
}
