package com.shapetea.context;

/**
 * Cooperative cancellation for one analysis run. Consulted whenever a context set is built;
 * once tripped every live path of that set is failed with the returned reason.
 */
public final class PathGovernor {

    public static final PathGovernor UNLIMITED = new PathGovernor(0, 0);

    private final int maxPath;
    private final long timeoutMs;
    private long startedAt = -1;

    public PathGovernor(int maxPath, long timeoutMs) {
        this.maxPath = maxPath;
        this.timeoutMs = timeoutMs;
    }

    public int maxPath() {
        return maxPath;
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    /** Starts the wall clock. */
    public void start() {
        startedAt = System.currentTimeMillis();
    }

    /** Failure reason for a set with {@code liveCount} running paths, or null when it may proceed. */
    public String check(int liveCount) {
        if (maxPath > 0 && liveCount > maxPath) {
            return "path count exceeded (" + maxPath + ")";
        }
        if (timeoutMs > 0 && startedAt >= 0 && liveCount > 0
                && System.currentTimeMillis() - startedAt > timeoutMs) {
            return "timeout expired (" + timeoutMs + "ms)";
        }
        return null;
    }
}
