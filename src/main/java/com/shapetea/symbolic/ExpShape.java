package com.shapetea.symbolic;

import com.shapetea.ir.CodeSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Tensor shape expressions. */
public abstract class ExpShape extends SymExp {

    public enum OpType { CONST, SYMBOL, SET, SLICE, CONCAT, BROADCAST }

    protected ExpShape(CodeSource source) {
        super(source);
    }

    @Override
    public final Kind kind() {
        return Kind.SHAPE;
    }

    public abstract OpType opType();

    @Override
    public abstract ExpShape withSource(CodeSource source);

    // ===================== factories =====================

    public static Const fromConst(int rank, List<ExpNum> dims, CodeSource source) {
        return new Const(rank, dims, source);
    }

    public static Const fromConstDims(List<Double> dims, CodeSource source) {
        List<ExpNum> list = new ArrayList<>(dims.size());
        for (double d : dims) list.add(ExpNum.fromConst(d, source));
        return new Const(list.size(), list, source);
    }

    public static Symbol fromSymbol(SymVal symbol) {
        if (symbol.type != SymbolType.SHAPE) {
            throw new IllegalArgumentException("not a shape symbol: " + symbol);
        }
        return new Symbol(symbol, symbol.source);
    }

    public static SetDim setDim(ExpShape base, ExpNum axis, ExpNum dim, CodeSource source) {
        return new SetDim(base, axis, dim, source);
    }

    /** Slice over the dimension list, 0-based exclusive end; null bounds are open. */
    public static Slice slice(ExpShape base, ExpNum start, ExpNum end, CodeSource source) {
        return new Slice(base, start, end, source != null ? source : base.source);
    }

    public static Concat concat(ExpShape left, ExpShape right, CodeSource source) {
        return new Concat(left, right, source);
    }

    public static Broadcast broadcast(ExpShape left, ExpShape right, CodeSource source) {
        return new Broadcast(left, right, source);
    }

    /** Rank of the shape, folded to a constant where the structure allows it. */
    public static ExpNum getRank(ExpShape exp) {
        switch (exp.opType()) {
            case CONST:
                return ExpNum.fromConst(((Const) exp).rank, null);
            case SYMBOL:
                return ((Symbol) exp).symbol.rank;
            case SET:
                return getRank(((SetDim) exp).baseShape);
            case SLICE: {
                Slice s = (Slice) exp;
                ExpNum start = s.start == null ? ExpNum.fromConst(0, null) : s.start;
                ExpNum end = s.end == null ? getRank(s.baseShape) : s.end;
                if (start.isConst() && end.isConst()) {
                    double diff = end.constValue() - start.constValue();
                    return ExpNum.fromConst(diff >= 0 ? diff : 0, null);
                }
                return ExpNum.bop(ExpNum.BopType.SUB, end, start, exp.source);
            }
            case CONCAT: {
                Concat c = (Concat) exp;
                ExpNum left = getRank(c.left);
                ExpNum right = getRank(c.right);
                if (left.isConst() && right.isConst()) {
                    return ExpNum.fromConst(left.constValue() + right.constValue(), null);
                }
                return ExpNum.bop(ExpNum.BopType.ADD, left, right, exp.source);
            }
            case BROADCAST: {
                Broadcast b = (Broadcast) exp;
                ExpNum left = getRank(b.left);
                ExpNum right = getRank(b.right);
                if (left.isConst() && right.isConst()) {
                    return ExpNum.fromConst(Math.max(left.constValue(), right.constValue()), null);
                }
                return ExpNum.max(List.of(left, right), exp.source);
            }
            default:
                throw new IllegalStateException("unknown shape op " + exp.opType());
        }
    }

    // ===================== nodes =====================

    public static final class Const extends ExpShape {
        public final int rank;
        public final List<ExpNum> dims;

        Const(int rank, List<ExpNum> dims, CodeSource source) {
            super(source);
            this.rank = rank;
            this.dims = List.copyOf(dims);
        }

        @Override public OpType opType() { return OpType.CONST; }
        @Override public Const withSource(CodeSource s) { return new Const(rank, dims, s); }
        @Override protected void collectSymbols(List<Integer> out) { dims.forEach(d -> d.collectSymbols(out)); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Const)) return false;
            Const c = (Const) o;
            return rank == c.rank && dims.equals(c.dims);
        }

        @Override public int hashCode() { return rank * 31 + dims.hashCode(); }

        @Override
        public String toString() {
            List<String> parts = new ArrayList<>(dims.size());
            for (ExpNum d : dims) parts.add(d.toString());
            return "T[" + String.join(",", parts) + "]";
        }
    }

    public static final class Symbol extends ExpShape {
        public final SymVal symbol;

        Symbol(SymVal symbol, CodeSource source) {
            super(source);
            this.symbol = symbol;
        }

        @Override public OpType opType() { return OpType.SYMBOL; }
        @Override public Symbol withSource(CodeSource s) { return new Symbol(symbol, s); }
        @Override protected void collectSymbols(List<Integer> out) { out.add(symbol.id); }
        @Override public boolean equals(Object o) { return o instanceof Symbol && ((Symbol) o).symbol.id == symbol.id; }
        @Override public int hashCode() { return symbol.id * 13; }
        @Override public String toString() { return "TSym[" + symbol.name + "; " + symbol.rank + "]"; }
    }

    public static final class SetDim extends ExpShape {
        public final ExpShape baseShape;
        public final ExpNum axis;
        public final ExpNum dim;

        SetDim(ExpShape baseShape, ExpNum axis, ExpNum dim, CodeSource source) {
            super(source);
            this.baseShape = Objects.requireNonNull(baseShape);
            this.axis = Objects.requireNonNull(axis);
            this.dim = Objects.requireNonNull(dim);
        }

        @Override public OpType opType() { return OpType.SET; }
        @Override public SetDim withSource(CodeSource s) { return new SetDim(baseShape, axis, dim, s); }

        @Override
        protected void collectSymbols(List<Integer> out) {
            baseShape.collectSymbols(out);
            axis.collectSymbols(out);
            dim.collectSymbols(out);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof SetDim)) return false;
            SetDim s = (SetDim) o;
            return axis.equals(s.axis) && dim.equals(s.dim) && baseShape.equals(s.baseShape);
        }

        @Override public int hashCode() { return Objects.hash(baseShape, axis, dim); }
        @Override public String toString() { return "set(" + baseShape + ", " + axis + ", " + dim + ")"; }
    }

    public static final class Slice extends ExpShape {
        public final ExpShape baseShape;
        public final ExpNum start;
        public final ExpNum end;

        Slice(ExpShape baseShape, ExpNum start, ExpNum end, CodeSource source) {
            super(source);
            this.baseShape = Objects.requireNonNull(baseShape);
            this.start = start;
            this.end = end;
        }

        @Override public OpType opType() { return OpType.SLICE; }
        @Override public Slice withSource(CodeSource s) { return new Slice(baseShape, start, end, s); }

        @Override
        protected void collectSymbols(List<Integer> out) {
            baseShape.collectSymbols(out);
            collect(start, out);
            collect(end, out);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Slice)) return false;
            Slice s = (Slice) o;
            return baseShape.equals(s.baseShape) && Objects.equals(start, s.start) && Objects.equals(end, s.end);
        }

        @Override public int hashCode() { return Objects.hash(baseShape, start, end); }
        @Override public String toString() { return "slice(" + baseShape + ", " + str(start) + ", " + str(end) + ")"; }
    }

    public static final class Concat extends ExpShape {
        public final ExpShape left;
        public final ExpShape right;

        Concat(ExpShape left, ExpShape right, CodeSource source) {
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

        @Override public int hashCode() { return Objects.hash(left, right, 5); }
        @Override public String toString() { return "concat(" + left + ", " + right + ")"; }
    }

    public static final class Broadcast extends ExpShape {
        public final ExpShape left;
        public final ExpShape right;

        Broadcast(ExpShape left, ExpShape right, CodeSource source) {
            super(source);
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        @Override public OpType opType() { return OpType.BROADCAST; }
        @Override public Broadcast withSource(CodeSource s) { return new Broadcast(left, right, s); }

        @Override
        protected void collectSymbols(List<Integer> out) {
            left.collectSymbols(out);
            right.collectSymbols(out);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Broadcast)) return false;
            Broadcast b = (Broadcast) o;
            return left.equals(b.left) && right.equals(b.right);
        }

        @Override public int hashCode() { return Objects.hash(left, right, 7); }
        @Override public String toString() { return "broadcast(" + left + ", " + right + ")"; }
    }
}
