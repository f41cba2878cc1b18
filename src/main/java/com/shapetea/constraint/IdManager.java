package com.shapetea.constraint;

/**
 * Monotonic id source for constraints and symbols. One instance is created per analysis
 * run and shared by every forked path; ids are pre-incremented so the first id is 1.
 */
public final class IdManager {

    private int ctrIdMax;
    private int symIdMax;

    public int getCtrId() {
        return ++ctrIdMax;
    }

    public int getSymId() {
        return ++symIdMax;
    }

    public int ctrIdMax() {
        return ctrIdMax;
    }

    public int symIdMax() {
        return symIdMax;
    }
}
