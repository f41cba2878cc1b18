package com.shapetea.symbolic;

import com.shapetea.ir.CodeSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the symbolic expression algebra.
 *
 * Expressions are immutable trees. {@code equals} is structural and ignores the attached
 * source, symbols compare by id.
 */
public abstract class SymExp {

    public enum Kind { SHAPE, NUM, BOOL, STRING }

    public final CodeSource source;

    protected SymExp(CodeSource source) {
        this.source = source;
    }

    public abstract Kind kind();

    /** Same expression re-tagged with another source. */
    public abstract SymExp withSource(CodeSource source);

    protected abstract void collectSymbols(List<Integer> out);

    /** Ids of every symbol referenced by this expression, in tree order (duplicates kept). */
    public final List<Integer> extractSymbols() {
        List<Integer> list = new ArrayList<>();
        collectSymbols(list);
        return list;
    }

    public static void collect(SymExp exp, List<Integer> out) {
        if (exp != null) exp.collectSymbols(out);
    }

    /** Null-tolerant structural equality. */
    public static boolean isStructuallyEq(SymExp left, SymExp right) {
        if (left == null) return right == null;
        if (right == null) return false;
        return left.equals(right);
    }

    public static String str(SymExp exp) {
        return exp == null ? ":" : exp.toString();
    }
}
