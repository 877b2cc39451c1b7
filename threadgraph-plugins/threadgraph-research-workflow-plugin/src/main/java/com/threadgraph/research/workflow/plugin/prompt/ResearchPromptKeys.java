package com.threadgraph.research.workflow.plugin.prompt;

public interface ResearchPromptKeys {

    String CLARITY_SYSTEM = "clarity.system";
    String CLARITY_LAST_RESOLVED_SUBJECT = "clarity.last-resolved-subject";
    String CLARITY_FORMAT = "clarity.format";
    String CLARITY_USER = "clarity.user";

    String AWAIT_INPUT_DEFAULT_QUESTION = "await-input.default-question";

    String GATHER_SUBJECT = "gather.subject";
    String GATHER_QUERY = "gather.query";
    String GATHER_INSTRUCTION = "gather.instruction";

    String CONFIDENCE_SYSTEM = "confidence.system";
    String CONFIDENCE_FORMAT = "confidence.format";
    String CONFIDENCE_USER = "confidence.user";

    String VALIDATE_SYSTEM = "validate.system";
    String VALIDATE_FORMAT = "validate.format";
    String VALIDATE_USER = "validate.user";
    String VALIDATE_MISSING_FINDINGS = "validate.missing-findings";
    String VALIDATE_MESSAGE = "validate.message";

    String COMPOSE_SYSTEM = "compose.system";
    String COMPOSE_USER = "compose.user";
}
