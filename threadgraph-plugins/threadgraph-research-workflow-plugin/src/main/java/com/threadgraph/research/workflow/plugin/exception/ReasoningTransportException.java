package com.threadgraph.research.workflow.plugin.exception;

import com.threadgraph.integration.exception.ThreadGraphStageRuntimeException;
import lombok.Getter;

import java.util.Map;

/**
 * The reasoning service could not be reached or answered with an error status.
 */
@Getter
public class ReasoningTransportException extends ThreadGraphStageRuntimeException {

    private final boolean retryable;

    public ReasoningTransportException(String model, String reason, boolean retryable, Throwable cause) {
        super(ResearchWorkflowErrorCodes.REASONING_TRANSPORT_FAILED, Map.of("model", model, "reason", reason), cause);
        this.retryable = retryable;
    }
}
