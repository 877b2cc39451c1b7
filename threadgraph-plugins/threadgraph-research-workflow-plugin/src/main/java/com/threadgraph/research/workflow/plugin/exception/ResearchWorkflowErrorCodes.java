package com.threadgraph.research.workflow.plugin.exception;

import com.threadgraph.integration.contract.IThreadGraphErrorInfo;
import com.threadgraph.integration.enumerations.ThreadGraphHttpStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum ResearchWorkflowErrorCodes implements IThreadGraphErrorInfo {

    REASONING_EMPTY_RESPONSE(
            "RESEARCH_ERR_0001",
            ThreadGraphHttpStatus.BAD_GATEWAY,
            "Reasoning service returned no text for {purpose}",
            "Retry the turn; persistent empty answers usually mean the prompt was blocked"
    ),

    REASONING_MALFORMED_RESPONSE(
            "RESEARCH_ERR_0002",
            ThreadGraphHttpStatus.BAD_GATEWAY,
            "Reasoning service returned unparseable {type}: {reason}",
            "Retry the turn; check the structured output instructions of the prompt"
    ),

    REASONING_CONSTRAINT_VIOLATION(
            "RESEARCH_ERR_0003",
            ThreadGraphHttpStatus.BAD_GATEWAY,
            "Reasoning service returned an invalid {type}: {violations}",
            "Retry the turn; check the structured output instructions of the prompt"
    ),

    REASONING_TRANSPORT_FAILED(
            "RESEARCH_ERR_0004",
            ThreadGraphHttpStatus.GATEWAY_TIMEOUT,
            "Call to model {model} failed: {reason}",
            "Check connectivity and the API key, then retry"
    ),

    PROMPT_TEMPLATE_MISSING(
            "RESEARCH_ERR_0005",
            ThreadGraphHttpStatus.INTERNAL_SERVER_ERROR,
            "Prompt template {key} is not defined",
            "Add the key to the research workflow prompt bundle"
    )

    ;

    private final String errorCode;
    private final ThreadGraphHttpStatus httpStatus;
    private final String errorTemplate;
    private final String resolutionTemplate;
}
