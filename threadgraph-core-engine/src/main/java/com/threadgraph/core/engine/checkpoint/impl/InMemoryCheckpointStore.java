package com.threadgraph.core.engine.checkpoint.impl;

import com.threadgraph.core.engine.checkpoint.IThreadGraphCheckpointStore;
import com.threadgraph.integration.enumerations.ThreadGraphExecutionState;
import com.threadgraph.integration.models.state.ThreadState;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checkpoints kept in process memory. Lost on restart.
 */
@Slf4j
public class InMemoryCheckpointStore implements IThreadGraphCheckpointStore {

    private final Map<String, ThreadState> checkpoints = new ConcurrentHashMap<>();

    @Override
    public Mono<ThreadState> load(String threadId) {
        return Mono.fromCallable(() -> checkpoints.get(threadId));
    }

    @Override
    public Mono<ThreadState> save(ThreadState state) {
        return Mono.fromCallable(() -> {
            checkpoints.compute(state.getThreadId(), (threadId, stored) -> {
                IThreadGraphCheckpointStore.assertNextVersion(stored, state);
                return state;
            });
            log.debug("Saved checkpoint: threadId={}, version={}, state={}",
                    state.getThreadId(), state.getVersion(), state.getExecutionState());
            return state;
        });
    }

    @Override
    public Mono<Boolean> delete(String threadId) {
        return Mono.fromCallable(() -> checkpoints.remove(threadId) != null);
    }

    @Override
    public Mono<Boolean> exists(String threadId) {
        return Mono.fromCallable(() -> checkpoints.containsKey(threadId));
    }

    @Override
    public Flux<ThreadState> findByExecutionState(ThreadGraphExecutionState executionState) {
        return Flux.defer(() -> Flux.fromIterable(checkpoints.values()))
                .filter(state -> state.getExecutionState() == executionState);
    }

    public int size() {
        return checkpoints.size();
    }
}
