package com.threadgraph.integration.contract;

/**
 * Backoff settings for re-running a failed stage. Zero attempts disables retrying.
 */
public interface IThreadGraphRetryPolicy {
    int getMaxAttempts();
    long getInitialIntervalMs();
    double getMultiplier();
    long getMaxIntervalMs();

    default boolean isEnabled() {
        return getMaxAttempts() > 0;
    }
}
