package com.threadgraph.integration.models.execution;

import com.threadgraph.integration.enumerations.ThreadGraphInvocationStatus;
import com.threadgraph.integration.models.state.ThreadState;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of an invoke or resume call.
 */
@Data
@Builder
public class ThreadGraphInvocationResult {

    private final ThreadGraphInvocationStatus status;
    private final String threadId;
    private final ThreadState state;
    /**
     * Present only when the thread suspended.
     */
    private final Object suspensionPayload;

    public static ThreadGraphInvocationResult completed(ThreadState state) {
        return ThreadGraphInvocationResult.builder()
                .status(ThreadGraphInvocationStatus.COMPLETED)
                .threadId(state.getThreadId())
                .state(state)
                .build();
    }

    public static ThreadGraphInvocationResult suspended(ThreadState state, Object payload) {
        return ThreadGraphInvocationResult.builder()
                .status(ThreadGraphInvocationStatus.SUSPENDED)
                .threadId(state.getThreadId())
                .state(state)
                .suspensionPayload(payload)
                .build();
    }

    public boolean isSuspended() {
        return status == ThreadGraphInvocationStatus.SUSPENDED;
    }
}
