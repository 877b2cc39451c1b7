package com.threadgraph.research.workflow.plugin.stages;

import com.threadgraph.integration.enumerations.ThreadGraphValidationResult;
import com.threadgraph.integration.models.execution.ThreadGraphStageResult;
import com.threadgraph.integration.models.message.ThreadGraphChatMessage;
import com.threadgraph.integration.models.state.ThreadState;
import com.threadgraph.integration.models.state.ThreadStateUpdate;
import com.threadgraph.research.workflow.plugin.config.ResearchWorkflowConfig;
import com.threadgraph.research.workflow.plugin.prompt.ResearchPromptKeys;
import com.threadgraph.research.workflow.plugin.prompt.ResearchPromptSource;
import com.threadgraph.research.workflow.plugin.reasoning.IReasoningClient;
import com.threadgraph.research.workflow.plugin.reasoning.ReasoningPurpose;
import com.threadgraph.research.workflow.plugin.reasoning.ReasoningRequest;
import com.threadgraph.research.workflow.plugin.reasoning.StructuredOutputParser;
import com.threadgraph.research.workflow.plugin.reasoning.model.ValidationAssessment;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Objects;

/**
 * Grades the gathered findings. Every run counts as one attempt, whatever the grade.
 */
@Slf4j
public class ValidateStage extends AbstractReasoningStage {

    public ValidateStage(IReasoningClient reasoningClient, ResearchPromptSource prompts,
                         StructuredOutputParser outputParser, ResearchWorkflowConfig config) {
        super(reasoningClient, prompts, outputParser, config);
    }

    @Override
    public Mono<ThreadGraphStageResult> execute(ThreadState state) {
        return Mono.defer(() -> {
            String query = Objects.toString(state.getCurrentQuery(), "");
            String findings = blankToNull(state.getResearchFindings());
            ReasoningRequest request = ReasoningRequest.builder()
                    .purpose(ReasoningPurpose.VALIDATION)
                    .model(config.getFastModel())
                    .temperature(config.getValidationTemperature())
                    .systemInstruction(systemInstruction(ResearchPromptKeys.VALIDATE_SYSTEM, ResearchPromptKeys.VALIDATE_FORMAT))
                    .history(state.getMessageHistory())
                    .prompt(prompts.render(ResearchPromptKeys.VALIDATE_USER, Map.of(
                            "query", query,
                            "findings", findings != null ? findings : prompts.get(ResearchPromptKeys.VALIDATE_MISSING_FINDINGS))))
                    .structuredOutput(true)
                    .build();

            return generateStructured(request, ValidationAssessment.class)
                    .map(assessment -> {
                        ThreadGraphValidationResult result = ThreadGraphValidationResult.fromValue(assessment.getValidationResult());
                        int attempts = state.getAttemptCounter() + 1;
                        log.info("Thread {} validation: validationResult={}, attempt={}, critique={}",
                                state.getThreadId(), result, attempts, assessment.getCritique());
                        String critique = prompts.render(ResearchPromptKeys.VALIDATE_MESSAGE, Map.of(
                                "critique", Objects.toString(assessment.getCritique(), ""),
                                "suggestions", Objects.toString(assessment.getSuggestions(), "")));
                        return ThreadGraphStageResult.proceed(ThreadStateUpdate.builder()
                                .appendMessage(ThreadGraphChatMessage.assistant(critique))
                                .validationResult(result)
                                .attemptCounter(attempts)
                                .build());
                    });
        });
    }
}
