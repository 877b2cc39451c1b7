package com.threadgraph.core.engine.error;

import com.threadgraph.integration.contract.IThreadGraphRetryPolicy;
import com.threadgraph.integration.contract.IThreadGraphStage;
import com.threadgraph.integration.exception.IThreadGraphException;
import com.threadgraph.integration.models.execution.ThreadGraphStageResult;
import com.threadgraph.integration.models.state.ThreadState;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Re-runs a stage with exponential backoff when it fails with a retryable error.
 * Retrying is safe because stages do not mutate the snapshot and nothing is persisted for a failed step.
 */
@Slf4j
public class RetryingStage implements IThreadGraphStage {

    /**
     * Errors that declare themselves retryable through {@link IThreadGraphException#isRetryable()}.
     */
    public static final Predicate<Throwable> RETRYABLE_ERRORS =
            error -> error instanceof IThreadGraphException threadGraphError && threadGraphError.isRetryable();

    private final String stageName;
    private final IThreadGraphStage delegate;
    private final IThreadGraphRetryPolicy retryPolicy;
    private final Predicate<Throwable> retryable;

    public RetryingStage(String stageName, IThreadGraphStage delegate, IThreadGraphRetryPolicy retryPolicy) {
        this(stageName, delegate, retryPolicy, RETRYABLE_ERRORS);
    }

    public RetryingStage(String stageName, IThreadGraphStage delegate,
                         IThreadGraphRetryPolicy retryPolicy, Predicate<Throwable> retryable) {
        this.stageName = stageName;
        this.delegate = delegate;
        this.retryPolicy = retryPolicy;
        this.retryable = retryable;
    }

    @Override
    public Mono<ThreadGraphStageResult> execute(ThreadState state) {
        Mono<ThreadGraphStageResult> attempt = Mono.defer(() -> delegate.execute(state));
        if (retryPolicy == null || !retryPolicy.isEnabled()) {
            return attempt;
        }
        return attempt
                .doOnError(retryable, e -> log.warn("Stage {} failed on thread {}, retrying: {}",
                        stageName, state.getThreadId(), e.getMessage()))
                .retryWhen(backoff());
    }

    private Retry backoff() {
        return Retry.backoff(retryPolicy.getMaxAttempts(), Duration.ofMillis(retryPolicy.getInitialIntervalMs()))
                .maxBackoff(Duration.ofMillis(retryPolicy.getMaxIntervalMs()))
                .multiplier(retryPolicy.getMultiplier())
                .jitter(0.2)
                .filter(retryable)
                .onRetryExhaustedThrow((spec, signal) -> {
                    log.warn("Stage {} gave up after {} retries", stageName, signal.totalRetries());
                    return signal.failure();
                });
    }
}
