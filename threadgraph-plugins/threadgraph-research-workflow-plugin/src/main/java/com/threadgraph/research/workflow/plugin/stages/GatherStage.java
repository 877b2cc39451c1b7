package com.threadgraph.research.workflow.plugin.stages;

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
import com.threadgraph.research.workflow.plugin.reasoning.model.ConfidenceAssessment;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Gathers findings with a search-grounded call, then scores them with a second call.
 * The history is not sent with the research call; the subject and the query are.
 */
@Slf4j
public class GatherStage extends AbstractReasoningStage {

    public GatherStage(IReasoningClient reasoningClient, ResearchPromptSource prompts,
                       StructuredOutputParser outputParser, ResearchWorkflowConfig config) {
        super(reasoningClient, prompts, outputParser, config);
    }

    @Override
    public Mono<ThreadGraphStageResult> execute(ThreadState state) {
        return Mono.defer(() -> {
            String query = Objects.toString(state.getCurrentQuery(), "");
            ReasoningRequest research = ReasoningRequest.builder()
                    .purpose(ReasoningPurpose.RESEARCH)
                    .model(config.getGroundedModel())
                    .prompt(buildResearchPrompt(query, state.getSubjectEntity()))
                    .groundedSearch(true)
                    .build();

            return generateText(research, "research findings")
                    .flatMap(findings -> assessConfidence(query, findings)
                            .map(assessment -> {
                                log.info("Thread {} research confidence: score={}, reasoning={}",
                                        state.getThreadId(), assessment.getConfidenceScore(), assessment.getReasoning());
                                return ThreadGraphStageResult.proceed(ThreadStateUpdate.builder()
                                        .appendMessage(ThreadGraphChatMessage.assistant(findings))
                                        .researchFindings(findings)
                                        .confidenceScore(assessment.getConfidenceScore())
                                        .build());
                            }));
        });
    }

    private Mono<ConfidenceAssessment> assessConfidence(String query, String findings) {
        ReasoningRequest request = ReasoningRequest.builder()
                .purpose(ReasoningPurpose.CONFIDENCE)
                .model(config.getFastModel())
                .temperature(config.getConfidenceTemperature())
                .systemInstruction(systemInstruction(ResearchPromptKeys.CONFIDENCE_SYSTEM, ResearchPromptKeys.CONFIDENCE_FORMAT))
                .prompt(prompts.render(ResearchPromptKeys.CONFIDENCE_USER, Map.of("query", query, "findings", findings)))
                .structuredOutput(true)
                .build();
        return generateStructured(request, ConfidenceAssessment.class);
    }

    String buildResearchPrompt(String query, String subject) {
        List<String> parts = new ArrayList<>();
        if (subject != null && !subject.isBlank()) {
            parts.add(prompts.render(ResearchPromptKeys.GATHER_SUBJECT, Map.of("subject", subject)));
        }
        if (!query.isBlank()) {
            parts.add(prompts.render(ResearchPromptKeys.GATHER_QUERY, Map.of("query", query)));
        }
        parts.add(prompts.get(ResearchPromptKeys.GATHER_INSTRUCTION));
        return String.join("\n\n", parts);
    }
}
