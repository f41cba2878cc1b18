package com.shapetea.plugins;

/**
 * User override for the value a {@code randInt}/{@code randFloat} call produces for a given
 * name prefix: an unconstrained symbol, a fixed number, or a symbol within optional bounds.
 */
public final class VariableRange {

    private static final VariableRange UNBOUNDED = new VariableRange(null, null, null);

    private final Double fixed;
    private final Double lower;
    private final Double upper;

    private VariableRange(Double fixed, Double lower, Double upper) {
        this.fixed = fixed;
        this.lower = lower;
        this.upper = upper;
    }

    public static VariableRange unbounded() {
        return UNBOUNDED;
    }

    public static VariableRange fixed(double value) {
        return new VariableRange(value, null, null);
    }

    /** Either bound may be null. */
    public static VariableRange between(Double lower, Double upper) {
        return new VariableRange(null, lower, upper);
    }

    public boolean isFixed() {
        return fixed != null;
    }

    public Double fixedValue() {
        return fixed;
    }

    public Double lower() {
        return lower;
    }

    public Double upper() {
        return upper;
    }

    @Override
    public String toString() {
        if (fixed != null) return String.valueOf(fixed);
        if (lower == null && upper == null) return "null";
        return "[" + lower + ", " + upper + "]";
    }
}
