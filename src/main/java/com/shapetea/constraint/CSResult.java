package com.shapetea.constraint;

/** A generated value paired with the constraint set that was extended to produce it. */
public final class CSResult<T> {

    public final T value;
    public final ConstraintSet ctrSet;

    public CSResult(T value, ConstraintSet ctrSet) {
        this.value = value;
        this.ctrSet = ctrSet;
    }
}
