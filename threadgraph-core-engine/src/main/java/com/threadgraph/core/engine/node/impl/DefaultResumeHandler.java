package com.threadgraph.core.engine.node.impl;

import com.threadgraph.integration.contract.IThreadGraphResumeHandler;
import com.threadgraph.integration.models.message.ThreadGraphChatMessage;
import com.threadgraph.integration.models.state.ThreadGraphPendingResume;
import com.threadgraph.integration.models.state.ThreadState;
import com.threadgraph.integration.models.state.ThreadStateUpdate;

import java.util.Objects;

/**
 * Treats the resume value as the user's answer: it is appended to the history as a user message,
 * becomes the current query, and the stage that suspended is recorded in the trace.
 */
public class DefaultResumeHandler implements IThreadGraphResumeHandler {

    @Override
    public ThreadStateUpdate toResumeUpdate(ThreadState suspendedState, ThreadGraphPendingResume pendingResume, Object resumeValue) {
        String answer = Objects.toString(resumeValue, "");
        return ThreadStateUpdate.builder()
                .appendMessage(ThreadGraphChatMessage.user(answer))
                .currentQuery(answer)
                .appendTrace(pendingResume.getSuspendedStage())
                .build();
    }
}
