package com.threadgraph.research.workflow.plugin.reasoning;

import com.threadgraph.integration.models.message.ThreadGraphChatMessage;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ReasoningRequest {
    private final ReasoningPurpose purpose;
    private final String model;
    /**
     * Sampling temperature; the service default applies when absent.
     */
    private final Double temperature;
    /**
     * Optional system instruction.
     */
    private final String systemInstruction;
    /**
     * Prior conversation sent ahead of the prompt.
     */
    @Builder.Default
    private final List<ThreadGraphChatMessage> history = List.of();
    private final String prompt;
    /**
     * Lets the model consult live web search.
     */
    private final boolean groundedSearch;
    /**
     * Asks for a JSON document instead of free text.
     */
    private final boolean structuredOutput;
}
