package com.threadgraph.core.engine.node.impl;

import com.threadgraph.core.engine.checkpoint.IThreadGraphCheckpointStore;
import com.threadgraph.core.engine.config.ThreadGraphEngineConfig;
import com.threadgraph.core.engine.graph.ThreadGraphDefinition;
import com.threadgraph.core.engine.graph.ThreadGraphStageDefinition;
import com.threadgraph.core.engine.lock.IThreadGraphLockService;
import com.threadgraph.core.engine.node.IThreadGraphExecutor;
import com.threadgraph.core.engine.state.ThreadStateReducer;
import com.threadgraph.core.exception.ThreadGraphInvalidRequestException;
import com.threadgraph.core.exception.ThreadGraphRuntimeException;
import com.threadgraph.core.exception.codes.ThreadGraphInternalErrorCodes;
import com.threadgraph.core.exception.stage.ThreadGraphStageExecutionException;
import com.threadgraph.core.exception.thread.ThreadGraphInvalidThreadStateException;
import com.threadgraph.core.exception.thread.ThreadNotFoundException;
import com.threadgraph.integration.constant.ThreadGraphConstants;
import com.threadgraph.integration.contract.IThreadGraphResumeHandler;
import com.threadgraph.integration.enumerations.ThreadGraphExecutionState;
import com.threadgraph.integration.models.execution.ThreadGraphInvocationResult;
import com.threadgraph.integration.models.execution.ThreadGraphStageResult;
import com.threadgraph.integration.models.state.ThreadGraphPendingResume;
import com.threadgraph.integration.models.state.ThreadState;
import com.threadgraph.integration.models.state.ThreadStateUpdate;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Drives a thread through the stage graph one step at a time.
 *
 * <p>A step executes a stage against the current snapshot, merges its update (plus the trace entry),
 * evaluates the router and persists the result as the new checkpoint. A failing step persists nothing, so
 * the stored checkpoint always reflects the last fully completed step. Calls on the same thread are
 * serialized through the lock service.
 */
@Slf4j
public class ThreadGraphExecutor implements IThreadGraphExecutor {

    private final ThreadGraphDefinition definition;
    private final IThreadGraphCheckpointStore checkpointStore;
    private final IThreadGraphLockService lockService;
    private final IThreadGraphResumeHandler resumeHandler;
    private final ThreadStateReducer reducer;
    private final ThreadGraphEngineConfig config;

    @Builder
    public ThreadGraphExecutor(ThreadGraphDefinition definition,
                               IThreadGraphCheckpointStore checkpointStore,
                               IThreadGraphLockService lockService,
                               IThreadGraphResumeHandler resumeHandler,
                               ThreadStateReducer reducer,
                               ThreadGraphEngineConfig config) {
        if (definition == null || checkpointStore == null || lockService == null) {
            throw new IllegalArgumentException("definition, checkpointStore and lockService are required");
        }
        this.definition = definition;
        this.checkpointStore = checkpointStore;
        this.lockService = lockService;
        this.resumeHandler = resumeHandler != null ? resumeHandler : new DefaultResumeHandler();
        this.reducer = reducer != null ? reducer : new ThreadStateReducer();
        this.config = config != null ? config : ThreadGraphEngineConfig.defaults();
    }

    @Override
    public Mono<ThreadGraphInvocationResult> invoke(String threadId, ThreadStateUpdate input) {
        return Mono.defer(() -> {
            if (threadId == null || threadId.isBlank()) {
                return Mono.error(new ThreadGraphInvalidRequestException("thread id cannot be blank"));
            }
            if (input == null) {
                return Mono.error(new ThreadGraphInvalidRequestException("invoke input cannot be absent"));
            }
            return withThreadLock(threadId, "invoke", Mono.defer(() -> doInvoke(threadId, input)));
        });
    }

    @Override
    public Mono<ThreadGraphInvocationResult> resume(String threadId, Object resumeValue) {
        return Mono.defer(() -> {
            if (threadId == null || threadId.isBlank()) {
                return Mono.error(new ThreadGraphInvalidRequestException("thread id cannot be blank"));
            }
            return withThreadLock(threadId, "resume", Mono.defer(() -> doResume(threadId, resumeValue)));
        });
    }

    @Override
    public Mono<ThreadState> getState(String threadId) {
        return checkpointStore.load(threadId)
                .switchIfEmpty(Mono.error(() -> new ThreadNotFoundException(threadId)));
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(lockService::shutdown)
                .then(Mono.defer(checkpointStore::shutdown))
                .doOnSuccess(ignored -> log.info("Executor for graph {} shut down", definition.getName()));
    }

    private <T> Mono<T> withThreadLock(String threadId, String operation, Mono<T> action) {
        String ownerId = operation + "-" + UUID.randomUUID();
        return lockService.executeWithLock(threadId, ownerId, operation,
                config.getLockDuration(), config.getLockWaitTimeout(), action);
    }

    private Mono<ThreadGraphInvocationResult> doInvoke(String threadId, ThreadStateUpdate input) {
        return checkpointStore.load(threadId)
                .defaultIfEmpty(ThreadState.initial(threadId))
                .flatMap(current -> {
                    if (current.isSuspended()) {
                        log.warn("Rejecting invoke on suspended thread {} (waiting at {})",
                                threadId, current.getPendingResume().getSuspendedStage());
                        return Mono.error(ThreadGraphInvalidThreadStateException.suspendedOnInvoke(threadId));
                    }
                    log.info("Invoking thread {} (version {}) at entry stage {}",
                            threadId, current.getVersion(), definition.getEntryStage());
                    ThreadState merged = reducer.merge(current, input);
                    return executeStage(merged, definition.getEntryStage(), 1);
                });
    }

    private Mono<ThreadGraphInvocationResult> doResume(String threadId, Object resumeValue) {
        return checkpointStore.load(threadId)
                .switchIfEmpty(Mono.error(() -> new ThreadNotFoundException(threadId)))
                .flatMap(current -> {
                    if (!current.isSuspended()) {
                        return Mono.error(ThreadGraphInvalidThreadStateException
                                .notSuspendedOnResume(threadId, current.getExecutionState()));
                    }
                    ThreadGraphPendingResume pending = current.getPendingResume();
                    log.info("Resuming thread {} suspended at {}, continuing at {}",
                            threadId, pending.getSuspendedStage(), pending.getResumeTarget());
                    ThreadStateUpdate resumeUpdate = resumeHandler.toResumeUpdate(current, pending, resumeValue);
                    ThreadState cleared = current.toBuilder()
                            .pendingResume(null)
                            .executionState(ThreadGraphExecutionState.RUNNING)
                            .build();
                    return executeStage(reducer.merge(cleared, resumeUpdate), pending.getResumeTarget(), 1);
                });
    }

    // recursive method
    private Mono<ThreadGraphInvocationResult> executeStage(ThreadState state, String stageName, int step) {
        String threadId = state.getThreadId();
        if (step > config.getMaxStepsPerInvocation()) {
            log.error("Thread {} exceeded {} steps, aborting before stage {}",
                    threadId, config.getMaxStepsPerInvocation(), stageName);
            return Mono.error(new ThreadGraphRuntimeException(ThreadGraphInternalErrorCodes.STEP_LIMIT_EXCEEDED,
                    Map.of("threadId", threadId, "limit", String.valueOf(config.getMaxStepsPerInvocation()))));
        }
        ThreadGraphStageDefinition stageDefinition = definition.getStages().get(stageName);
        if (stageDefinition == null) {
            return Mono.error(new ThreadGraphStageExecutionException(threadId, stageName,
                    unknownTarget(stageName, stageName)));
        }

        ThreadState running = state.toBuilder()
                .currentStage(stageName)
                .executionState(ThreadGraphExecutionState.RUNNING)
                .build();
        log.debug("Executing stage {} on thread {} (step {})", stageName, threadId, step);

        return Mono.defer(() -> stageDefinition.getStage().execute(running))
                .switchIfEmpty(Mono.error(() -> new ThreadGraphStageExecutionException(
                        ThreadGraphInternalErrorCodes.STAGE_RETURNED_NO_RESULT, threadId, stageName, null)))
                .onErrorMap(e -> !(e instanceof ThreadGraphStageExecutionException),
                        e -> new ThreadGraphStageExecutionException(threadId, stageName, e))
                .doOnError(e -> log.error("Stage {} failed on thread {}: {}", stageName, threadId, e.getMessage()))
                .flatMap(result -> {
                    if (result instanceof ThreadGraphStageResult.Suspend suspend) {
                        return suspend(running, stageName, suspend);
                    }
                    return proceed(running, stageDefinition, ((ThreadGraphStageResult.Proceed) result).update(), step);
                });
    }

    private Mono<ThreadGraphInvocationResult> proceed(ThreadState state, ThreadGraphStageDefinition stageDefinition,
                                                      ThreadStateUpdate update, int step) {
        String threadId = state.getThreadId();
        String stageName = stageDefinition.getName();

        ThreadState merged;
        String next;
        try {
            ThreadStateUpdate effective = definition.isTurnEntry(stageName)
                    ? ThreadStateUpdate.turnReset().andThen(update)
                    : update;
            effective = effective.andThen(ThreadStateUpdate.builder().appendTrace(stageName).build());
            merged = reducer.merge(state, effective);
            next = stageDefinition.getRouter().route(merged);
        } catch (RuntimeException e) {
            log.error("Stage {} produced an unusable result on thread {}: {}", stageName, threadId, e.getMessage());
            return Mono.error(new ThreadGraphStageExecutionException(threadId, stageName, e));
        }
        if (next == null || !stageDefinition.canRouteTo(next)) {
            return Mono.error(new ThreadGraphStageExecutionException(threadId, stageName, unknownTarget(stageName, next)));
        }

        boolean terminal = ThreadGraphConstants.END.equals(next);
        ThreadState checkpoint = terminal
                ? merged.toBuilder().executionState(ThreadGraphExecutionState.COMPLETED).currentStage(null).build()
                : merged.toBuilder().currentStage(next).build();

        return persist(checkpoint).flatMap(saved -> {
            if (terminal) {
                log.info("Thread {} completed after stage {} (version {})", threadId, stageName, saved.getVersion());
                return Mono.just(ThreadGraphInvocationResult.completed(saved));
            }
            log.debug("Thread {} routed from {} to {}", threadId, stageName, next);
            return executeStage(saved, next, step + 1);
        });
    }

    private Mono<ThreadGraphInvocationResult> suspend(ThreadState state, String stageName,
                                                      ThreadGraphStageResult.Suspend suspend) {
        String threadId = state.getThreadId();
        if (!definition.hasStage(suspend.resumeTarget())) {
            return Mono.error(new ThreadGraphStageExecutionException(threadId, stageName,
                    unknownTarget(stageName, suspend.resumeTarget())));
        }
        ThreadState suspended = state.toBuilder()
                .pendingResume(ThreadGraphPendingResume.builder()
                        .suspendedStage(stageName)
                        .resumeTarget(suspend.resumeTarget())
                        .payload(suspend.payload())
                        .suspendedAt(Instant.now())
                        .build())
                .executionState(ThreadGraphExecutionState.WAITING)
                .build();
        return persist(suspended)
                .doOnNext(saved -> log.info("Thread {} suspended at {}, resumes at {}",
                        threadId, stageName, suspend.resumeTarget()))
                .map(saved -> ThreadGraphInvocationResult.suspended(saved, suspend.payload()));
    }

    private Mono<ThreadState> persist(ThreadState state) {
        return checkpointStore.save(state.toBuilder()
                .version(state.getVersion() + 1)
                .updatedAt(Instant.now())
                .build());
    }

    private static ThreadGraphRuntimeException unknownTarget(String stageName, String target) {
        return new ThreadGraphRuntimeException(ThreadGraphInternalErrorCodes.ROUTE_TARGET_UNKNOWN,
                Map.of("stage", stageName, "target", String.valueOf(target)));
    }
}
