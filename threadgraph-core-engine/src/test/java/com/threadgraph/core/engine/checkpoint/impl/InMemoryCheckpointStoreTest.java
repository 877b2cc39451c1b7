package com.threadgraph.core.engine.checkpoint.impl;

import com.threadgraph.core.exception.ThreadGraphCheckpointStoreException;
import com.threadgraph.integration.enumerations.ThreadGraphExecutionState;
import com.threadgraph.integration.models.state.ThreadGraphPendingResume;
import com.threadgraph.integration.models.state.ThreadState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCheckpointStoreTest {

    private InMemoryCheckpointStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryCheckpointStore();
    }

    private static ThreadState version(ThreadState state, long version) {
        return state.toBuilder().version(version).build();
    }

    @Test
    @DisplayName("should return empty for a thread without checkpoint")
    void shouldReturnEmptyForUnknownThread() {
        StepVerifier.create(store.load("missing")).verifyComplete();
        assertFalse(store.exists("missing").block());
    }

    @Test
    @DisplayName("should store and load consecutive versions")
    void shouldStoreConsecutiveVersions() {
        ThreadState initial = ThreadState.initial("t-1");

        store.save(version(initial, 1)).block();
        store.save(version(initial, 2)).block();

        assertEquals(2, store.load("t-1").block().getVersion());
        assertTrue(store.exists("t-1").block());
    }

    @Test
    @DisplayName("should reject a save that skips or repeats a version")
    void shouldRejectVersionConflict() {
        ThreadState initial = ThreadState.initial("t-1");
        store.save(version(initial, 1)).block();

        StepVerifier.create(store.save(version(initial, 1)))
                .expectErrorSatisfies(error -> assertTrue(
                        assertInstanceOf(ThreadGraphCheckpointStoreException.class, error).isVersionConflict()))
                .verify();
        assertEquals(1, store.load("t-1").block().getVersion());
    }

    @Test
    @DisplayName("should list suspended threads")
    void shouldFindSuspended() {
        ThreadState waiting = ThreadState.initial("waiting").toBuilder()
                .version(1)
                .executionState(ThreadGraphExecutionState.WAITING)
                .pendingResume(ThreadGraphPendingResume.builder()
                        .suspendedStage("await-input").resumeTarget("resolve").payload("?").suspendedAt(Instant.now())
                        .build())
                .build();
        store.save(waiting).block();
        store.save(version(ThreadState.initial("done"), 1)).block();

        StepVerifier.create(store.findSuspended())
                .expectNextMatches(state -> state.getThreadId().equals("waiting"))
                .verifyComplete();
    }

    @Test
    @DisplayName("should delete a checkpoint")
    void shouldDelete() {
        store.save(version(ThreadState.initial("t-1"), 1)).block();

        assertTrue(store.delete("t-1").block());
        assertFalse(store.delete("t-1").block());
        StepVerifier.create(store.load("t-1")).verifyComplete();
    }
}
