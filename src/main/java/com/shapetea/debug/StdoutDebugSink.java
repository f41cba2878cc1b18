package com.shapetea.debug;

import java.io.PrintStream;

/** Prints "[LEVEL] tag: message" lines at or above a minimum level. */
public final class StdoutDebugSink implements DebugSink {

    private final DebugLevel minLevel;
    private final PrintStream out;

    public StdoutDebugSink(DebugLevel minLevel) {
        this(minLevel, System.out);
    }

    public StdoutDebugSink(DebugLevel minLevel, PrintStream out) {
        this.minLevel = (minLevel == null) ? DebugLevel.INFO : minLevel;
        this.out = out;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.atLeast(minLevel)) return;
        out.println("[" + level + "] " + tag + ": " + message);
        if (error != null) error.printStackTrace(out);
    }
}
