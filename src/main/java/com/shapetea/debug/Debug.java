package com.shapetea.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for all ShapeTea components.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Silent by default; analysis results never depend on the installed sink
 */
public final class Debug {

    public static final String TAG_SOLVER = "shapetea.solver";
    public static final String TAG_CTX = "shapetea.ctx";
    public static final String TAG_INTERP = "shapetea.interp";
    public static final String TAG_LIBCALL = "shapetea.libcall";
    public static final String TAG_SERVICE = "shapetea.service";

    // Must be initialised before INSTANCE: static fields run in source order.
    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // intentionally empty
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    /** True when a non-default sink is installed. Lets hot paths skip building messages. */
    public boolean enabled() {
        DebugSink sink = sinkRef.get();
        return sink != null && sink != NOOP;
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        DebugSink sink = sinkRef.get();
        (sink == null ? NOOP : sink).log(level, tag, message, error);
    }
}
