package com.shapetea.constraint;

import com.shapetea.symbolic.ExpNum;

/**
 * Outcome of selecting the broadcast dimension of two dims: the selected dim, provably
 * impossible, or undecided.
 */
public final class BroadcastResult {

    public static final BroadcastResult IMPOSSIBLE = new BroadcastResult(null, false);
    public static final BroadcastResult UNDECIDED = new BroadcastResult(null, true);

    public final ExpNum dim;
    private final boolean undecided;

    private BroadcastResult(ExpNum dim, boolean undecided) {
        this.dim = dim;
        this.undecided = undecided;
    }

    public static BroadcastResult of(ExpNum dim) {
        return new BroadcastResult(dim, false);
    }

    public boolean isSelected() {
        return dim != null;
    }

    public boolean isImpossible() {
        return dim == null && !undecided;
    }

    public boolean isUndecided() {
        return undecided;
    }

    @Override
    public String toString() {
        if (dim != null) return dim.toString();
        return undecided ? "undecided" : "impossible";
    }
}
