package com.threadgraph.integration.models.state;

/**
 * Fixed policy constants shared by the state contract and the workflows built on it.
 */
public final class ThreadStatePolicy {

    /**
     * Maximum number of validation passes per user turn.
     */
    public static final int ATTEMPT_CAP = 3;

    /**
     * Confidence at or above which gathered findings skip validation.
     */
    public static final double CONFIDENCE_THRESHOLD = 6.0;

    public static final double CONFIDENCE_MIN = 0.0;
    public static final double CONFIDENCE_MAX = 10.0;

    private ThreadStatePolicy() {
    }
}
