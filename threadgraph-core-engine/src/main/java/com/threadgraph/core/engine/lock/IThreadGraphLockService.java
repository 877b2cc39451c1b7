package com.threadgraph.core.engine.lock;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-thread mutual exclusion. At most one invoke or resume executes against a thread at a time;
 * different threads never block each other.
 *
 * <pre>
 * tryAcquire() ─→ HELD ─→ release() / expiry ─→ FREE
 * </pre>
 */
public interface IThreadGraphLockService {

    /**
     * @return true if acquired, false if another owner holds a lock that has not expired
     */
    Mono<Boolean> tryAcquire(String threadId, String ownerId, String operation, Duration duration);

    /**
     * Retries {@link #tryAcquire} until it succeeds or the wait timeout elapses.
     */
    Mono<Boolean> acquireWithWait(String threadId, String ownerId, String operation,
                                  Duration duration, Duration waitTimeout);

    /**
     * @return true if released, false if the lock is not held by this owner
     */
    Mono<Boolean> release(String threadId, String ownerId);

    /**
     * Removes the lock whoever holds it. Meant for operators recovering a thread whose holder died.
     *
     * @return true if a lock was removed
     */
    Mono<Boolean> forceRelease(String threadId, String reason);

    Mono<Boolean> extend(String threadId, String ownerId, Duration extensionDuration);

    Mono<Boolean> isLocked(String threadId);

    Mono<Optional<ThreadLock>> getLockInfo(String threadId);

    Mono<Long> cleanupExpiredLocks();

    /**
     * Stops background work such as expired-lock sweeping. Locks still held are left as they are.
     */
    void shutdown();

    /**
     * Runs the action while holding the thread's lock. The lock is released before the action's
     * result or error is propagated, so a caller observing the outcome can immediately call again.
     *
     * @param waitTimeout zero rejects at once when the thread is busy
     * @throws ThreadLockedException through the returned {@code Mono} when the lock cannot be acquired
     */
    default <T> Mono<T> executeWithLock(String threadId, String ownerId, String operation,
                                        Duration duration, Duration waitTimeout, Mono<T> action) {
        Mono<Boolean> acquisition = waitTimeout == null || waitTimeout.isZero() || waitTimeout.isNegative()
                ? tryAcquire(threadId, ownerId, operation, duration)
                : acquireWithWait(threadId, ownerId, operation, duration, waitTimeout);
        return acquisition.flatMap(acquired -> {
            if (!acquired) {
                return getLockInfo(threadId).flatMap(info -> Mono.<T>error(info
                        .map(ThreadLockedException::withLockInfo)
                        .orElseGet(() -> ThreadLockedException.lockedBy(threadId, null))));
            }
            return action
                    .flatMap(result -> release(threadId, ownerId).thenReturn(result))
                    .switchIfEmpty(Mono.defer(() -> release(threadId, ownerId).then(Mono.<T>empty())))
                    .onErrorResume(error -> release(threadId, ownerId).then(Mono.error(error)))
                    .doOnCancel(() -> release(threadId, ownerId).subscribe());
        });
    }
}
