package com.threadgraph.core.exception.stage;

import com.threadgraph.core.exception.ThreadGraphRuntimeException;
import com.threadgraph.core.exception.codes.ThreadGraphInternalErrorCodes;
import com.threadgraph.integration.contract.IThreadGraphErrorInfo;
import com.threadgraph.integration.exception.IThreadGraphException;
import lombok.Getter;

import java.util.Map;
import java.util.Objects;

/**
 * A stage, its state update or its router failed. Nothing of the failed step was persisted.
 */
@Getter
public class ThreadGraphStageExecutionException extends ThreadGraphRuntimeException {

    private final String threadId;
    private final String stageName;

    public ThreadGraphStageExecutionException(String threadId, String stageName, Throwable cause) {
        this(ThreadGraphInternalErrorCodes.STAGE_EXECUTION_FAILED, threadId, stageName, cause);
    }

    public ThreadGraphStageExecutionException(IThreadGraphErrorInfo errorInfo, String threadId, String stageName, Throwable cause) {
        super(errorInfo,
                Map.of("threadId", threadId, "stage", stageName,
                        "reason", cause == null ? "unknown" : Objects.toString(cause.getMessage(), cause.getClass().getSimpleName())),
                cause);
        this.threadId = threadId;
        this.stageName = stageName;
    }

    /**
     * The error info reported by the stage itself, when the failure originated from one.
     */
    public IThreadGraphErrorInfo getStageErrorInfo() {
        if (getCause() instanceof IThreadGraphException stageException) {
            return stageException.getErrorInfo();
        }
        return getErrorInfo();
    }
}
