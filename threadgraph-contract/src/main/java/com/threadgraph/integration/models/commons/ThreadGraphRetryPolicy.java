package com.threadgraph.integration.models.commons;

import com.threadgraph.integration.contract.IThreadGraphRetryPolicy;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.Serializable;

/**
 * Validated retry settings. Unset values fall back to 2 attempts, 500 ms initial backoff doubling up to 5 s.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ThreadGraphRetryPolicy implements IThreadGraphRetryPolicy, Serializable {

    public static final int DEFAULT_MAX_ATTEMPTS = 2;
    public static final long DEFAULT_INITIAL_INTERVAL_MS = 500;
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final long DEFAULT_MAX_INTERVAL_MS = 5000;

    private final int maxAttempts;
    private final long initialIntervalMs;
    private final double multiplier;
    private final long maxIntervalMs;

    private ThreadGraphRetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.initialIntervalMs = builder.initialIntervalMs;
        this.multiplier = builder.multiplier;
        this.maxIntervalMs = builder.maxIntervalMs;
    }

    public static ThreadGraphRetryPolicy none() {
        return builder().maxAttempts(0).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .initialIntervalMs(initialIntervalMs)
                .multiplier(multiplier)
                .maxIntervalMs(maxIntervalMs);
    }

    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private long initialIntervalMs = DEFAULT_INITIAL_INTERVAL_MS;
        private double multiplier = DEFAULT_MULTIPLIER;
        private long maxIntervalMs = DEFAULT_MAX_INTERVAL_MS;

        private Builder() {
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialIntervalMs(long initialIntervalMs) {
            this.initialIntervalMs = initialIntervalMs;
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxIntervalMs(long maxIntervalMs) {
            this.maxIntervalMs = maxIntervalMs;
            return this;
        }

        /**
         * @throws IllegalArgumentException when attempts are negative, intervals are not positive,
         *                                  the multiplier is below 1 or the cap is below the initial interval
         */
        public ThreadGraphRetryPolicy build() {
            if (maxAttempts < 0) {
                throw new IllegalArgumentException("maxAttempts cannot be negative: " + maxAttempts);
            }
            if (initialIntervalMs <= 0) {
                throw new IllegalArgumentException("initialIntervalMs must be positive: " + initialIntervalMs);
            }
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("multiplier must be at least 1: " + multiplier);
            }
            if (maxIntervalMs < initialIntervalMs) {
                throw new IllegalArgumentException("maxIntervalMs " + maxIntervalMs
                        + " is below initialIntervalMs " + initialIntervalMs);
            }
            return new ThreadGraphRetryPolicy(this);
        }
    }
}
