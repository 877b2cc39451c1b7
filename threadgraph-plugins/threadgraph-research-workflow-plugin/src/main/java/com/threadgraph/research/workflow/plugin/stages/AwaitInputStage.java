package com.threadgraph.research.workflow.plugin.stages;

import com.threadgraph.integration.contract.IThreadGraphStage;
import com.threadgraph.integration.models.execution.ThreadGraphStageResult;
import com.threadgraph.integration.models.state.ThreadState;
import com.threadgraph.research.workflow.plugin.ResearchWorkflowStages;
import com.threadgraph.research.workflow.plugin.prompt.ResearchPromptKeys;
import com.threadgraph.research.workflow.plugin.prompt.ResearchPromptSource;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Always suspends with the clarification question. The user's answer re-enters {@code resolve}.
 */
@Slf4j
public class AwaitInputStage implements IThreadGraphStage {

    private final ResearchPromptSource prompts;

    public AwaitInputStage(ResearchPromptSource prompts) {
        this.prompts = prompts;
    }

    @Override
    public Mono<ThreadGraphStageResult> execute(ThreadState state) {
        return Mono.fromCallable(() -> {
            String question = state.getClarificationQuestion();
            if (question == null || question.isBlank()) {
                question = prompts.get(ResearchPromptKeys.AWAIT_INPUT_DEFAULT_QUESTION);
            }
            log.info("Pausing thread {} for clarification: {}", state.getThreadId(), question);
            return ThreadGraphStageResult.suspend(question, ResearchWorkflowStages.RESOLVE);
        });
    }
}
