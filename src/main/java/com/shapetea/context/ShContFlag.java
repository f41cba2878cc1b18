package com.shapetea.context;

/** Control-flow marker a statement leaves as its result: fell through, continue, or break. */
public enum ShContFlag {
    RUN, CNT, BRK
}
