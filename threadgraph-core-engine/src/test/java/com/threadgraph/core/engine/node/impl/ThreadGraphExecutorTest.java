package com.threadgraph.core.engine.node.impl;

import com.threadgraph.core.engine.checkpoint.impl.InMemoryCheckpointStore;
import com.threadgraph.core.engine.config.ThreadGraphEngineConfig;
import com.threadgraph.core.engine.graph.ThreadGraphDefinition;
import com.threadgraph.core.engine.lock.ThreadLockedException;
import com.threadgraph.core.engine.lock.impl.InMemoryThreadLockService;
import com.threadgraph.core.exception.ThreadGraphInvalidRequestException;
import com.threadgraph.core.exception.ThreadGraphInvalidUpdateException;
import com.threadgraph.core.exception.ThreadGraphRuntimeException;
import com.threadgraph.core.exception.codes.ThreadGraphInternalErrorCodes;
import com.threadgraph.core.exception.stage.ThreadGraphStageExecutionException;
import com.threadgraph.core.exception.thread.ThreadGraphInvalidThreadStateException;
import com.threadgraph.core.exception.thread.ThreadNotFoundException;
import com.threadgraph.integration.constant.ThreadGraphConstants;
import com.threadgraph.integration.contract.IThreadGraphStage;
import com.threadgraph.integration.enumerations.ThreadGraphClarityStatus;
import com.threadgraph.integration.enumerations.ThreadGraphExecutionState;
import com.threadgraph.integration.enumerations.ThreadGraphInvocationStatus;
import com.threadgraph.integration.models.execution.ThreadGraphInvocationResult;
import com.threadgraph.integration.models.execution.ThreadGraphStageResult;
import com.threadgraph.integration.models.message.ThreadGraphChatMessage;
import com.threadgraph.integration.models.state.ThreadState;
import com.threadgraph.integration.models.state.ThreadStateField;
import com.threadgraph.integration.models.state.ThreadStateUpdate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ThreadGraphExecutorTest {

    private RecordingCheckpointStore store;
    private InMemoryThreadLockService lockService;

    @BeforeEach
    void setUp() {
        store = new RecordingCheckpointStore();
        lockService = new InMemoryThreadLockService(Duration.ofMinutes(5), Duration.ofMillis(20));
    }

    @AfterEach
    void tearDown() {
        lockService.shutdown();
    }

    private ThreadGraphExecutor executor(ThreadGraphDefinition definition) {
        return executor(definition, ThreadGraphEngineConfig.defaults());
    }

    private ThreadGraphExecutor executor(ThreadGraphDefinition definition, ThreadGraphEngineConfig config) {
        return ThreadGraphExecutor.builder()
                .definition(definition)
                .checkpointStore(store)
                .lockService(lockService)
                .config(config)
                .build();
    }

    private static IThreadGraphStage proceedWith(ThreadStateUpdate update) {
        return state -> Mono.just(ThreadGraphStageResult.proceed(update));
    }

    /**
     * start -> (needs clarification ? ask : work) ; ask suspends back to start ; work -> finish.
     */
    private static ThreadGraphDefinition clarifyingGraph() {
        IThreadGraphStage start = state -> {
            boolean ambiguous = "ambiguous".equals(state.getCurrentQuery());
            return Mono.just(ThreadGraphStageResult.proceed(ThreadStateUpdate.builder()
                    .clarityStatus(ambiguous ? ThreadGraphClarityStatus.NEEDS_CLARIFICATION : ThreadGraphClarityStatus.CLEAR)
                    .clarificationQuestion(ambiguous ? "Which one?" : null)
                    .build()));
        };
        return ThreadGraphDefinition.builder("clarifying")
                .stage("start", start,
                        state -> state.getClarityStatus() == ThreadGraphClarityStatus.NEEDS_CLARIFICATION ? "ask" : "work",
                        "ask", "work")
                .stage("ask", state -> Mono.just(ThreadGraphStageResult.suspend(state.getClarificationQuestion(), "start")),
                        state -> "start", "start")
                .stage("work", proceedWith(ThreadStateUpdate.builder().researchFindings("findings").attemptCounter(2).build()),
                        state -> "finish", "finish")
                .terminalStage("finish", state -> Mono.just(ThreadGraphStageResult.proceed(ThreadStateUpdate.builder()
                        .appendMessage(ThreadGraphChatMessage.assistant("done: " + state.getCurrentQuery()))
                        .finalResponse("done: " + state.getCurrentQuery())
                        .build())))
                .entry("start")
                .build();
    }

    @Nested
    @DisplayName("Invoke")
    class InvokeTests {

        @Test
        @DisplayName("should run from the entry stage to the end and checkpoint every step")
        void shouldRunToCompletion() {
            // Given
            ThreadGraphExecutor executor = executor(clarifyingGraph());

            // When
            ThreadGraphInvocationResult result = executor.invoke("t-1", ThreadStateUpdate.userTurn("clear question")).block();

            // Then
            assertNotNull(result);
            assertEquals(ThreadGraphInvocationStatus.COMPLETED, result.getStatus());
            ThreadState state = result.getState();
            assertEquals(List.of("start", "work", "finish"), state.getVisitedTrace());
            assertEquals("done: clear question", state.getFinalResponse());
            assertEquals(ThreadGraphExecutionState.COMPLETED, state.getExecutionState());
            assertNull(state.getCurrentStage());
            assertEquals(3, state.getVersion());
            assertEquals(List.of("start", "work", "finish"), store.savedStages());
            assertEquals(state, executor.getState("t-1").block());
        }

        @Test
        @DisplayName("should keep history across turns and reset per-turn fields")
        void shouldResetPerTurnFieldsOnNewTurn() {
            // Given
            ThreadGraphExecutor executor = executor(clarifyingGraph());
            executor.invoke("t-1", ThreadStateUpdate.userTurn("first")).block();
            List<ThreadState> observedAtEntry = new ArrayList<>();
            ThreadGraphDefinition observing = ThreadGraphDefinition.builder("observing")
                    .terminalStage("start", state -> {
                        observedAtEntry.add(state);
                        return Mono.just(ThreadGraphStageResult.proceed(ThreadStateUpdate.empty()));
                    })
                    .entry("start")
                    .build();

            // When
            ThreadState second = executor(observing).invoke("t-1", ThreadStateUpdate.userTurn("second")).block().getState();

            // Then
            assertEquals("findings", observedAtEntry.get(0).getResearchFindings(), "entry stage still sees the previous turn");
            assertNull(second.getResearchFindings());
            assertNull(second.getFinalResponse());
            assertEquals(0, second.getAttemptCounter());
            assertEquals(3, second.getMessageHistory().size());
            assertEquals(List.of("start", "work", "finish", "start"), second.getVisitedTrace());
        }

        @Test
        @DisplayName("should reject a blank thread id")
        void shouldRejectBlankThreadId() {
            StepVerifier.create(executor(clarifyingGraph()).invoke(" ", ThreadStateUpdate.userTurn("q")))
                    .expectError(ThreadGraphInvalidRequestException.class)
                    .verify();
        }

        @Test
        @DisplayName("should reject an input that violates the field types without touching the store")
        void shouldRejectInvalidInput() {
            ThreadStateUpdate input = ThreadStateUpdate.builder().set(ThreadStateField.ATTEMPT_COUNTER, "one").build();

            StepVerifier.create(executor(clarifyingGraph()).invoke("t-1", input))
                    .expectError(ThreadGraphInvalidUpdateException.class)
                    .verify();
            assertEquals(0, store.size());
        }
    }

    @Nested
    @DisplayName("Suspend and resume")
    class SuspendResumeTests {

        @Test
        @DisplayName("should suspend with the payload and persist the pending resume marker")
        void shouldSuspend() {
            // When
            ThreadGraphInvocationResult result = executor(clarifyingGraph())
                    .invoke("t-1", ThreadStateUpdate.userTurn("ambiguous")).block();

            // Then
            assertTrue(result.isSuspended());
            assertEquals("Which one?", result.getSuspensionPayload());
            ThreadState stored = store.load("t-1").block();
            assertTrue(stored.isSuspended());
            assertEquals(ThreadGraphExecutionState.WAITING, stored.getExecutionState());
            assertEquals("ask", stored.getPendingResume().getSuspendedStage());
            assertEquals("start", stored.getPendingResume().getResumeTarget());
            assertEquals(List.of("start"), stored.getVisitedTrace());
        }

        @Test
        @DisplayName("should resume at the recorded target with the answer merged in")
        void shouldResume() {
            // Given
            ThreadGraphExecutor executor = executor(clarifyingGraph());
            executor.invoke("t-1", ThreadStateUpdate.userTurn("ambiguous")).block();

            // When
            ThreadGraphInvocationResult result = executor.resume("t-1", "the clear one").block();

            // Then
            assertEquals(ThreadGraphInvocationStatus.COMPLETED, result.getStatus());
            ThreadState state = result.getState();
            assertFalse(state.isSuspended());
            assertEquals("the clear one", state.getCurrentQuery());
            assertEquals(List.of("start", "ask", "start", "work", "finish"), state.getVisitedTrace());
            assertEquals(List.of(
                    ThreadGraphChatMessage.user("ambiguous"),
                    ThreadGraphChatMessage.user("the clear one"),
                    ThreadGraphChatMessage.assistant("done: the clear one")), state.getMessageHistory());
            assertNull(state.getClarificationQuestion());
        }

        @Test
        @DisplayName("should reject invoke on a suspended thread and leave it unchanged")
        void shouldRejectInvokeWhileSuspended() {
            // Given
            ThreadGraphExecutor executor = executor(clarifyingGraph());
            executor.invoke("t-1", ThreadStateUpdate.userTurn("ambiguous")).block();
            ThreadState before = store.load("t-1").block();

            // When / Then
            StepVerifier.create(executor.invoke("t-1", ThreadStateUpdate.userTurn("something else")))
                    .expectError(ThreadGraphInvalidThreadStateException.class)
                    .verify();
            assertEquals(before, store.load("t-1").block());
        }

        @Test
        @DisplayName("should reject resume on a thread that is not suspended")
        void shouldRejectResumeWhenNotSuspended() {
            ThreadGraphExecutor executor = executor(clarifyingGraph());
            executor.invoke("t-1", ThreadStateUpdate.userTurn("clear")).block();
            ThreadState before = store.load("t-1").block();

            StepVerifier.create(executor.resume("t-1", "answer"))
                    .expectError(ThreadGraphInvalidThreadStateException.class)
                    .verify();
            assertEquals(before, store.load("t-1").block());
        }

        @Test
        @DisplayName("should report an unknown thread on resume and getState")
        void shouldReportUnknownThread() {
            ThreadGraphExecutor executor = executor(clarifyingGraph());

            StepVerifier.create(executor.resume("missing", "answer"))
                    .expectError(ThreadNotFoundException.class)
                    .verify();
            StepVerifier.create(executor.getState("missing"))
                    .expectError(ThreadNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("should fail when a stage suspends towards an undeclared stage")
        void shouldFailOnUnknownResumeTarget() {
            ThreadGraphDefinition graph = ThreadGraphDefinition.builder("bad-suspend")
                    .terminalStage("start", state -> Mono.just(ThreadGraphStageResult.suspend("?", "nowhere")))
                    .entry("start")
                    .build();

            StepVerifier.create(executor(graph).invoke("t-1", ThreadStateUpdate.userTurn("q")))
                    .expectError(ThreadGraphStageExecutionException.class)
                    .verify();
            assertEquals(0, store.size());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("should persist nothing when the first stage fails")
        void shouldPersistNothingOnFirstStageFailure() {
            ThreadGraphDefinition graph = ThreadGraphDefinition.builder("failing")
                    .terminalStage("start", state -> Mono.error(new IllegalStateException("boom")))
                    .entry("start")
                    .build();

            StepVerifier.create(executor(graph).invoke("t-1", ThreadStateUpdate.userTurn("q")))
                    .expectErrorSatisfies(error -> {
                        ThreadGraphStageExecutionException stageError =
                                assertInstanceOf(ThreadGraphStageExecutionException.class, error);
                        assertEquals("start", stageError.getStageName());
                        assertEquals("t-1", stageError.getThreadId());
                        assertInstanceOf(IllegalStateException.class, stageError.getCause());
                    })
                    .verify();
            assertEquals(0, store.size());
        }

        @Test
        @DisplayName("should keep the checkpoint of the last completed step when a later stage fails")
        void shouldKeepLastCompletedStep() {
            // Given
            ThreadGraphDefinition graph = ThreadGraphDefinition.builder("failing-later")
                    .stage("start", proceedWith(ThreadStateUpdate.builder().researchFindings("kept").build()),
                            state -> "explode", "explode")
                    .terminalStage("explode", state -> {
                        throw new IllegalStateException("thrown synchronously");
                    })
                    .entry("start")
                    .build();

            // When
            StepVerifier.create(executor(graph).invoke("t-1", ThreadStateUpdate.userTurn("q")))
                    .expectError(ThreadGraphStageExecutionException.class)
                    .verify();

            // Then
            ThreadState stored = store.load("t-1").block();
            assertEquals(1, stored.getVersion());
            assertEquals("kept", stored.getResearchFindings());
            assertEquals("explode", stored.getCurrentStage());
            assertEquals(List.of("start"), stored.getVisitedTrace());
        }

        @Test
        @DisplayName("should fail when a stage completes without a result")
        void shouldFailOnEmptyStageResult() {
            ThreadGraphDefinition graph = ThreadGraphDefinition.builder("empty")
                    .terminalStage("start", state -> Mono.empty())
                    .entry("start")
                    .build();

            StepVerifier.create(executor(graph).invoke("t-1", ThreadStateUpdate.userTurn("q")))
                    .expectErrorSatisfies(error -> assertEquals(ThreadGraphInternalErrorCodes.STAGE_RETURNED_NO_RESULT,
                            ((ThreadGraphRuntimeException) error).getErrorInfo()))
                    .verify();
        }

        @Test
        @DisplayName("should fail without persisting when a stage update violates a field constraint")
        void shouldFailOnInvalidStageUpdate() {
            ThreadGraphDefinition graph = ThreadGraphDefinition.builder("invalid-update")
                    .terminalStage("start", proceedWith(ThreadStateUpdate.builder().confidenceScore(11.0).build()))
                    .entry("start")
                    .build();

            StepVerifier.create(executor(graph).invoke("t-1", ThreadStateUpdate.userTurn("q")))
                    .expectErrorSatisfies(error -> assertInstanceOf(ThreadGraphInvalidUpdateException.class, error.getCause()))
                    .verify();
            assertEquals(0, store.size());
        }

        @Test
        @DisplayName("should fail when a router returns an undeclared target")
        void shouldFailOnUndeclaredRoute() {
            ThreadGraphDefinition graph = ThreadGraphDefinition.builder("bad-route")
                    .stage("start", proceedWith(ThreadStateUpdate.empty()), state -> "elsewhere", ThreadGraphConstants.END)
                    .entry("start")
                    .build();

            StepVerifier.create(executor(graph).invoke("t-1", ThreadStateUpdate.userTurn("q")))
                    .expectError(ThreadGraphStageExecutionException.class)
                    .verify();
            assertEquals(0, store.size());
        }

        @Test
        @DisplayName("should stop a cycle that exceeds the step limit")
        void shouldEnforceStepLimit() {
            // Given
            AtomicInteger executions = new AtomicInteger();
            ThreadGraphDefinition graph = ThreadGraphDefinition.builder("cycle")
                    .stage("loop", state -> {
                        executions.incrementAndGet();
                        return Mono.just(ThreadGraphStageResult.proceed(ThreadStateUpdate.empty()));
                    }, state -> "loop", "loop")
                    .entry("loop")
                    .build();
            ThreadGraphEngineConfig config = ThreadGraphEngineConfig.builder().maxStepsPerInvocation(5).build();

            // When / Then
            StepVerifier.create(executor(graph, config).invoke("t-1", ThreadStateUpdate.userTurn("q")))
                    .expectErrorSatisfies(error -> assertEquals(ThreadGraphInternalErrorCodes.STEP_LIMIT_EXCEEDED,
                            ((ThreadGraphRuntimeException) error).getErrorInfo()))
                    .verify();
            assertEquals(5, executions.get());
            assertEquals(5, store.load("t-1").block().getVersion());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        private ThreadGraphDefinition gatedGraph(Sinks.Empty<Void> gate) {
            return ThreadGraphDefinition.builder("gated")
                    .terminalStage("start", state -> gate.asMono()
                            .then(Mono.just(ThreadGraphStageResult.proceed(ThreadStateUpdate.empty()))))
                    .entry("start")
                    .build();
        }

        @Test
        @DisplayName("should reject a second call on a thread that is executing")
        void shouldRejectConcurrentCall() throws Exception {
            // Given
            Sinks.Empty<Void> gate = Sinks.empty();
            ThreadGraphExecutor executor = executor(gatedGraph(gate));
            CompletableFuture<ThreadGraphInvocationResult> first =
                    executor.invoke("t-1", ThreadStateUpdate.userTurn("first")).toFuture();

            // When / Then
            StepVerifier.create(executor.invoke("t-1", ThreadStateUpdate.userTurn("second")))
                    .expectError(ThreadLockedException.class)
                    .verify();

            gate.tryEmitEmpty();
            ThreadGraphInvocationResult completed = first.get(5, TimeUnit.SECONDS);
            assertEquals("first", completed.getState().getCurrentQuery());
            assertEquals(1, completed.getState().getVersion());
        }

        @Test
        @DisplayName("should not block calls on other threads")
        void shouldNotBlockOtherThreads() throws Exception {
            Sinks.Empty<Void> gate = Sinks.empty();
            ThreadGraphExecutor gated = executor(gatedGraph(gate));
            CompletableFuture<ThreadGraphInvocationResult> blocked =
                    gated.invoke("t-1", ThreadStateUpdate.userTurn("first")).toFuture();

            ThreadGraphInvocationResult other = executor(clarifyingGraph())
                    .invoke("t-2", ThreadStateUpdate.userTurn("clear")).block();

            assertEquals(ThreadGraphInvocationStatus.COMPLETED, other.getStatus());
            assertFalse(blocked.isDone());
            gate.tryEmitEmpty();
            blocked.get(5, TimeUnit.SECONDS);
        }

        @Test
        @DisplayName("should serialize calls when a wait timeout is configured")
        void shouldWaitForLockWhenConfigured() throws Exception {
            // Given
            Sinks.Empty<Void> gate = Sinks.empty();
            ThreadGraphEngineConfig config = ThreadGraphEngineConfig.builder()
                    .lockWaitTimeout(Duration.ofSeconds(5))
                    .build();
            ThreadGraphExecutor executor = executor(gatedGraph(gate), config);
            CompletableFuture<ThreadGraphInvocationResult> first =
                    executor.invoke("t-1", ThreadStateUpdate.userTurn("first")).toFuture();
            CompletableFuture<ThreadGraphInvocationResult> second =
                    executor.invoke("t-1", ThreadStateUpdate.userTurn("second")).toFuture();

            // When
            Thread.sleep(100);
            gate.tryEmitEmpty();

            // Then
            assertEquals(1, first.get(5, TimeUnit.SECONDS).getState().getVersion());
            ThreadState last = second.get(5, TimeUnit.SECONDS).getState();
            assertEquals(2, last.getVersion());
            assertEquals("second", last.getCurrentQuery());
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should stop the lock service and the checkpoint store on shutdown")
        void shouldReleaseResourcesOnShutdown() {
            // Given
            ThreadGraphExecutor executor = executor(clarifyingGraph());

            // When
            StepVerifier.create(executor.shutdown()).verifyComplete();

            // Then
            assertTrue(lockService.isShutdown());
            assertTrue(store.shutDown);
        }
    }

    private static class RecordingCheckpointStore extends InMemoryCheckpointStore {

        private final List<ThreadState> saved = new ArrayList<>();
        private boolean shutDown;

        @Override
        public Mono<Void> shutdown() {
            return Mono.fromRunnable(() -> shutDown = true);
        }

        @Override
        public Mono<ThreadState> save(ThreadState state) {
            return super.save(state).doOnNext(saved::add);
        }

        List<String> savedStages() {
            List<String> stages = new ArrayList<>();
            for (ThreadState state : saved) {
                List<String> trace = state.getVisitedTrace();
                stages.add(trace.get(trace.size() - 1));
            }
            return stages;
        }
    }
}
