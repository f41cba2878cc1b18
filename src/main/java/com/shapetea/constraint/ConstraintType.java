package com.shapetea.constraint;

public enum ConstraintType {
    EXP_BOOL,
    EQUAL,
    NOT_EQUAL,
    AND,
    OR,
    NOT,
    LESS_THAN,
    LESS_THAN_OR_EQUAL,
    FORALL,
    BROADCASTABLE,
    FAIL;

    public boolean isCompare() {
        return this == EQUAL || this == NOT_EQUAL || this == LESS_THAN || this == LESS_THAN_OR_EQUAL;
    }
}
