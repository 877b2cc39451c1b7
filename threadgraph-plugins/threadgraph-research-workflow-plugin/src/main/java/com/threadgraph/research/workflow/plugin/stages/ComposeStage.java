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
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Objects;

@Slf4j
public class ComposeStage extends AbstractReasoningStage {

    public ComposeStage(IReasoningClient reasoningClient, ResearchPromptSource prompts,
                        StructuredOutputParser outputParser, ResearchWorkflowConfig config) {
        super(reasoningClient, prompts, outputParser, config);
    }

    @Override
    public Mono<ThreadGraphStageResult> execute(ThreadState state) {
        return Mono.defer(() -> {
            ReasoningRequest request = ReasoningRequest.builder()
                    .purpose(ReasoningPurpose.SYNTHESIS)
                    .model(config.getFastModel())
                    .temperature(config.getSynthesisTemperature())
                    .systemInstruction(prompts.get(ResearchPromptKeys.COMPOSE_SYSTEM))
                    .history(state.getMessageHistory())
                    .prompt(prompts.render(ResearchPromptKeys.COMPOSE_USER, Map.of(
                            "query", Objects.toString(state.getCurrentQuery(), ""),
                            "findings", Objects.toString(state.getResearchFindings(), ""))))
                    .build();

            return generateText(request, "final answer")
                    .map(answer -> {
                        log.info("Thread {} final answer composed ({} chars)", state.getThreadId(), answer.length());
                        return ThreadGraphStageResult.proceed(ThreadStateUpdate.builder()
                                .appendMessage(ThreadGraphChatMessage.assistant(answer))
                                .finalResponse(answer)
                                .build());
                    });
        });
    }
}
