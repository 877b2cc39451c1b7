package com.threadgraph.core.engine.node;

import com.threadgraph.integration.models.execution.ThreadGraphInvocationResult;
import com.threadgraph.integration.models.state.ThreadState;
import com.threadgraph.integration.models.state.ThreadStateUpdate;
import reactor.core.publisher.Mono;

/**
 * Runs a stage graph against checkpointed threads.
 */
public interface IThreadGraphExecutor {

    /**
     * Starts a new turn: merges the input into the latest snapshot (or an empty one) and runs from the entry stage
     * until the graph ends or a stage suspends. Fails with an invalid thread state error when the thread is suspended.
     */
    Mono<ThreadGraphInvocationResult> invoke(String threadId, ThreadStateUpdate input);

    /**
     * Continues a suspended thread: the resume value is turned into an update, the pending marker is cleared
     * and execution continues at the recorded resume target.
     */
    Mono<ThreadGraphInvocationResult> resume(String threadId, Object resumeValue);

    /**
     * @return the latest checkpoint of the thread; fails with {@code ThreadNotFoundException} when there is none
     */
    Mono<ThreadState> getState(String threadId);

    /**
     * Stops the lock service and the checkpoint store the executor was built with. The executor cannot be used afterwards.
     */
    Mono<Void> shutdown();
}
