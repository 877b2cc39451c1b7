package com.threadgraph.integration.contract;

import com.threadgraph.integration.models.state.ThreadGraphPendingResume;
import com.threadgraph.integration.models.state.ThreadState;
import com.threadgraph.integration.models.state.ThreadStateUpdate;

/**
 * Turns the value supplied by the caller on resume into a state update merged before the resume target runs.
 */
@FunctionalInterface
public interface IThreadGraphResumeHandler {
    ThreadStateUpdate toResumeUpdate(ThreadState suspendedState, ThreadGraphPendingResume pendingResume, Object resumeValue);
}
