package com.threadgraph.research.workflow.plugin.stages;

import com.threadgraph.integration.contract.IThreadGraphStage;
import com.threadgraph.integration.exception.ThreadGraphStageRuntimeException;
import com.threadgraph.research.workflow.plugin.config.ResearchWorkflowConfig;
import com.threadgraph.research.workflow.plugin.exception.ResearchWorkflowErrorCodes;
import com.threadgraph.research.workflow.plugin.prompt.ResearchPromptSource;
import com.threadgraph.research.workflow.plugin.reasoning.IReasoningClient;
import com.threadgraph.research.workflow.plugin.reasoning.ReasoningRequest;
import com.threadgraph.research.workflow.plugin.reasoning.StructuredOutputParser;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Base class of the stages that consult the reasoning service.
 */
public abstract class AbstractReasoningStage implements IThreadGraphStage {

    protected final IReasoningClient reasoningClient;
    protected final ResearchPromptSource prompts;
    protected final StructuredOutputParser outputParser;
    protected final ResearchWorkflowConfig config;

    protected AbstractReasoningStage(IReasoningClient reasoningClient,
                                     ResearchPromptSource prompts,
                                     StructuredOutputParser outputParser,
                                     ResearchWorkflowConfig config) {
        this.reasoningClient = reasoningClient;
        this.prompts = prompts;
        this.outputParser = outputParser;
        this.config = config;
    }

    /**
     * Free-text call. Emits the stripped answer; a blank answer fails with {@code REASONING_EMPTY_RESPONSE}.
     */
    protected Mono<String> generateText(ReasoningRequest request, String purposeDescription) {
        return reasoningClient.generate(request)
                .defaultIfEmpty("")
                .map(String::strip)
                .flatMap(text -> text.isEmpty()
                        ? Mono.error(new ThreadGraphStageRuntimeException(
                                ResearchWorkflowErrorCodes.REASONING_EMPTY_RESPONSE,
                                Map.of("purpose", purposeDescription)))
                        : Mono.just(text));
    }

    /**
     * Structured call. The answer is parsed and validated against {@code type}.
     */
    protected <T> Mono<T> generateStructured(ReasoningRequest request, Class<T> type) {
        return reasoningClient.generate(request)
                .defaultIfEmpty("")
                .map(text -> outputParser.parse(text, type));
    }

    protected String systemInstruction(String systemKey, String formatKey) {
        return prompts.get(systemKey) + "\n\n" + prompts.get(formatKey);
    }

    protected static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
