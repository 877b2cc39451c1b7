package com.threadgraph.core.exception.thread;

import com.threadgraph.core.exception.ThreadGraphRuntimeException;
import com.threadgraph.core.exception.codes.ThreadGraphInternalErrorCodes;
import com.threadgraph.integration.enumerations.ThreadGraphExecutionState;
import lombok.Getter;

import java.util.Map;

/**
 * Raised when a call does not fit the thread's lifecycle: invoking a suspended thread or resuming one that is not suspended.
 * The stored checkpoint is left untouched.
 */
@Getter
public class ThreadGraphInvalidThreadStateException extends ThreadGraphRuntimeException {

    private final String threadId;
    private final ThreadGraphExecutionState executionState;

    public ThreadGraphInvalidThreadStateException(String threadId, String operation,
                                                  ThreadGraphExecutionState executionState, String reason) {
        super(ThreadGraphInternalErrorCodes.INVALID_THREAD_STATE,
                Map.of("threadId", threadId, "operation", operation, "reason", reason));
        this.threadId = threadId;
        this.executionState = executionState;
    }

    public static ThreadGraphInvalidThreadStateException suspendedOnInvoke(String threadId) {
        return new ThreadGraphInvalidThreadStateException(threadId, "invoke", ThreadGraphExecutionState.WAITING,
                "thread is suspended and only accepts a resume");
    }

    public static ThreadGraphInvalidThreadStateException notSuspendedOnResume(String threadId,
                                                                             ThreadGraphExecutionState executionState) {
        return new ThreadGraphInvalidThreadStateException(threadId, "resume", executionState,
                "thread is not suspended");
    }
}
