package com.threadgraph.integration.models.execution;

import com.threadgraph.integration.models.state.ThreadStateUpdate;

import java.util.Objects;

/**
 * What a stage hands back to the executor: either a state update to merge before routing,
 * or a request to suspend the thread until the caller resumes it.
 */
public sealed interface ThreadGraphStageResult
        permits ThreadGraphStageResult.Proceed, ThreadGraphStageResult.Suspend {

    static ThreadGraphStageResult proceed(ThreadStateUpdate update) {
        return new Proceed(update);
    }

    static ThreadGraphStageResult suspend(Object payload, String resumeTarget) {
        return new Suspend(payload, resumeTarget);
    }

    record Proceed(ThreadStateUpdate update) implements ThreadGraphStageResult {
        public Proceed {
            Objects.requireNonNull(update, "update");
        }
    }

    /**
     * @param payload      surfaced to the caller, typically the question to put to the user
     * @param resumeTarget stage that runs once the caller resumes the thread
     */
    record Suspend(Object payload, String resumeTarget) implements ThreadGraphStageResult {
        public Suspend {
            Objects.requireNonNull(resumeTarget, "resumeTarget");
        }
    }
}
