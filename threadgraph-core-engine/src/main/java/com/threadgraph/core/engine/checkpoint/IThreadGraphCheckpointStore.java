package com.threadgraph.core.engine.checkpoint;

import com.threadgraph.core.exception.ThreadGraphCheckpointStoreException;
import com.threadgraph.integration.enumerations.ThreadGraphExecutionState;
import com.threadgraph.integration.models.state.ThreadState;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable mapping from thread id to the latest snapshot of that thread.
 *
 * <p>Saves are versioned: a snapshot is accepted only when its version is exactly one above the stored one
 * (or 1 for a thread without checkpoint). A mismatch fails with a version conflict and stores nothing.
 */
public interface IThreadGraphCheckpointStore {

    /**
     * @return the latest snapshot, or empty when the thread has never been checkpointed
     */
    Mono<ThreadState> load(String threadId);

    Mono<ThreadState> save(ThreadState state);

    Mono<Boolean> delete(String threadId);

    Mono<Boolean> exists(String threadId);

    Flux<ThreadState> findByExecutionState(ThreadGraphExecutionState executionState);

    default Flux<ThreadState> findSuspended() {
        return findByExecutionState(ThreadGraphExecutionState.WAITING);
    }

    default Mono<Void> initialize() {
        return Mono.empty();
    }

    default Mono<Void> shutdown() {
        return Mono.empty();
    }

    default Mono<Boolean> healthCheck() {
        return Mono.just(true);
    }

    static void assertNextVersion(ThreadState stored, ThreadState incoming) {
        long storedVersion = stored == null ? 0 : stored.getVersion();
        if (incoming.getVersion() != storedVersion + 1) {
            throw ThreadGraphCheckpointStoreException.versionConflict(
                    incoming.getThreadId(), storedVersion, incoming.getVersion() - 1);
        }
    }
}
