package com.threadgraph.integration.contract;

import com.threadgraph.integration.models.execution.ThreadGraphStageResult;
import com.threadgraph.integration.models.state.ThreadState;
import reactor.core.publisher.Mono;

/**
 * A unit of work in a stage graph. A stage reads the current snapshot and returns either a partial
 * state update or a suspension request. Stages never mutate the snapshot they receive.
 *
 * <p>A failed {@code Mono} aborts the invocation; the executor persists nothing for the failed step.
 */
@FunctionalInterface
public interface IThreadGraphStage {
    Mono<ThreadGraphStageResult> execute(ThreadState state);
}
