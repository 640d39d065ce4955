package com.wf.stress.loader;

/**
 * Outcome of one endpoint within a run.
 */
public final class TargetResult {

    private final String endpoint;
    private final boolean ran;
    private final boolean healthWaitInterrupted;
    private final int containerCount;
    private final int cleanupErrors;
    private final RunSummary summary;

    public TargetResult(String endpoint, boolean ran, boolean healthWaitInterrupted,
                        int containerCount, int cleanupErrors, RunSummary summary) {
        this.endpoint = endpoint;
        this.ran = ran;
        this.healthWaitInterrupted = healthWaitInterrupted;
        this.containerCount = containerCount;
        this.cleanupErrors = cleanupErrors;
        this.summary = summary;
    }

    public String getEndpoint() {
        return endpoint;
    }

    /**
     * False when the endpoint never became healthy and no workers ran against it.
     */
    public boolean isRan() {
        return ran;
    }

    /**
     * True when a shutdown request cut the health wait short.
     */
    public boolean isHealthWaitInterrupted() {
        return healthWaitInterrupted;
    }

    public int getContainerCount() {
        return containerCount;
    }

    public int getCleanupErrors() {
        return cleanupErrors;
    }

    public RunSummary getSummary() {
        return summary;
    }
}
