package com.shapetea.service;

/**
 * Receives engine exceptions thrown while an entry runs. When a reporter is installed the
 * analysis returns an aborted, empty result instead of rethrowing.
 */
public interface AnalysisErrorReporter {
    void report(String entryName, RuntimeException error);
}
