package com.threadgraph.research.workflow.plugin.stages;

import com.threadgraph.integration.enumerations.ThreadGraphClarityStatus;
import com.threadgraph.integration.models.execution.ThreadGraphStageResult;
import com.threadgraph.integration.models.state.ThreadState;
import com.threadgraph.integration.models.state.ThreadStateField;
import com.threadgraph.integration.models.state.ThreadStateUpdate;
import com.threadgraph.research.workflow.plugin.config.ResearchWorkflowConfig;
import com.threadgraph.research.workflow.plugin.prompt.ResearchPromptKeys;
import com.threadgraph.research.workflow.plugin.prompt.ResearchPromptSource;
import com.threadgraph.research.workflow.plugin.reasoning.IReasoningClient;
import com.threadgraph.research.workflow.plugin.reasoning.ReasoningPurpose;
import com.threadgraph.research.workflow.plugin.reasoning.ReasoningRequest;
import com.threadgraph.research.workflow.plugin.reasoning.StructuredOutputParser;
import com.threadgraph.research.workflow.plugin.reasoning.model.ClarityAssessment;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Objects;

/**
 * Decides whether the latest query names a subject clearly enough to research it.
 *
 * <p>The whole history is sent along with the query. The subject resolved on an earlier turn is offered
 * as context so that pronouns and "the company" can be resolved against it. A clear answer with a subject
 * becomes the new last resolved subject.
 */
@Slf4j
public class ResolveStage extends AbstractReasoningStage {

    public ResolveStage(IReasoningClient reasoningClient, ResearchPromptSource prompts,
                        StructuredOutputParser outputParser, ResearchWorkflowConfig config) {
        super(reasoningClient, prompts, outputParser, config);
    }

    @Override
    public Mono<ThreadGraphStageResult> execute(ThreadState state) {
        return Mono.defer(() -> {
            String query = Objects.toString(state.getCurrentQuery(), "");
            ReasoningRequest request = ReasoningRequest.builder()
                    .purpose(ReasoningPurpose.CLARITY)
                    .model(config.getFastModel())
                    .temperature(config.getClarityTemperature())
                    .systemInstruction(buildSystemInstruction(state))
                    .history(state.getMessageHistory())
                    .prompt(prompts.render(ResearchPromptKeys.CLARITY_USER, Map.of("query", query)))
                    .structuredOutput(true)
                    .build();

            return generateStructured(request, ClarityAssessment.class)
                    .map(assessment -> {
                        ThreadGraphClarityStatus status = ThreadGraphClarityStatus.fromValue(assessment.getClarityStatus());
                        String subject = blankToNull(assessment.getCompanyName());
                        log.info("Thread {} clarity assessed: clarityStatus={}, subjectEntity={}",
                                state.getThreadId(), status, subject);
                        return ThreadGraphStageResult.proceed(toUpdate(query, status, subject, assessment));
                    });
        });
    }

    private String buildSystemInstruction(ThreadState state) {
        StringBuilder instruction = new StringBuilder(prompts.get(ResearchPromptKeys.CLARITY_SYSTEM));
        String lastSubject = state.getLastResolvedSubject();
        if (lastSubject != null) {
            instruction.append('\n')
                    .append(prompts.render(ResearchPromptKeys.CLARITY_LAST_RESOLVED_SUBJECT, Map.of("subject", lastSubject)));
        }
        return instruction.append("\n\n").append(prompts.get(ResearchPromptKeys.CLARITY_FORMAT)).toString();
    }

    private static ThreadStateUpdate toUpdate(String query, ThreadGraphClarityStatus status, String subject,
                                              ClarityAssessment assessment) {
        ThreadStateUpdate.Builder update = ThreadStateUpdate.builder()
                .currentQuery(query)
                .clarityStatus(status)
                .subjectEntity(subject);
        if (status == ThreadGraphClarityStatus.NEEDS_CLARIFICATION) {
            update.clarificationQuestion(blankToNull(assessment.getClarificationQuestion()));
        } else {
            update.clear(ThreadStateField.CLARIFICATION_QUESTION);
            if (subject != null) {
                update.lastResolvedSubject(subject);
            }
        }
        return update.build();
    }
}
