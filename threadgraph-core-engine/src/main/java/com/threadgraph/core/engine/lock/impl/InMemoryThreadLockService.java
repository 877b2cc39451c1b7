package com.threadgraph.core.engine.lock.impl;

import com.threadgraph.core.engine.lock.IThreadGraphLockService;
import com.threadgraph.core.engine.lock.ThreadLock;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Lock service for executors running in one process. Locks expire so that a crashed invocation
 * cannot block its thread forever; expired locks are taken over on the next acquisition and swept periodically.
 */
@Slf4j
public class InMemoryThreadLockService implements IThreadGraphLockService {

    private final Map<String, ThreadLock> locks = new ConcurrentHashMap<>();
    private final ScheduledExecutorService sweeper;
    private final Duration pollInterval;

    public InMemoryThreadLockService() {
        this(Duration.ofSeconds(30), Duration.ofMillis(50));
    }

    /**
     * @param sweepInterval how often expired locks are removed
     * @param pollInterval  pause between attempts while {@link #acquireWithWait} waits for a busy thread
     */
    public InMemoryThreadLockService(Duration sweepInterval, Duration pollInterval) {
        this.pollInterval = pollInterval;
        this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "threadgraph-lock-sweeper");
            t.setDaemon(true);
            return t;
        });
        this.sweeper.scheduleAtFixedRate(this::removeExpired,
                sweepInterval.toMillis(), sweepInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("InMemoryThreadLockService started, sweeping expired locks every {}", sweepInterval);
    }

    @Override
    public Mono<Boolean> tryAcquire(String threadId, String ownerId, String operation, Duration duration) {
        return Mono.fromCallable(() -> acquireNow(threadId, ownerId, operation, duration));
    }

    private boolean acquireNow(String threadId, String ownerId, String operation, Duration duration) {
        if (threadId == null || ownerId == null) {
            throw new IllegalArgumentException("threadId and ownerId cannot be null");
        }
        ThreadLock holder = locks.compute(threadId, (key, current) -> {
            if (current == null) {
                return ThreadLock.create(threadId, ownerId, duration, operation);
            }
            if (current.isHeldBy(ownerId)) {
                return current.extend(duration);
            }
            if (current.isExpired()) {
                log.warn("Thread {} lock of {} expired, handing it to {}", threadId, current.getOwnerId(), ownerId);
                return ThreadLock.create(threadId, ownerId, duration, operation);
            }
            return current;
        });
        boolean acquired = holder.isHeldBy(ownerId);
        log.debug("Lock on thread {} for {} ({}): {}", threadId, ownerId, operation,
                acquired ? "acquired" : "busy, held by " + holder.getOwnerId());
        return acquired;
    }

    /**
     * Polls without blocking a worker thread: each failed attempt is followed by a delay of the poll interval
     * until the wait timeout is used up.
     */
    @Override
    public Mono<Boolean> acquireWithWait(String threadId, String ownerId, String operation,
                                         Duration duration, Duration waitTimeout) {
        return Mono.defer(() -> {
            long deadline = System.nanoTime() + waitTimeout.toNanos();
            return Mono.fromCallable(() -> acquireNow(threadId, ownerId, operation, duration))
                    .filter(Boolean::booleanValue)
                    .repeatWhenEmpty(attempts -> attempts
                            .takeWhile(attempt -> System.nanoTime() < deadline)
                            .delayElements(pollInterval))
                    .defaultIfEmpty(false);
        });
    }

    @Override
    public Mono<Boolean> release(String threadId, String ownerId) {
        return Mono.fromCallable(() -> {
            if (threadId == null || ownerId == null) {
                return false;
            }
            ThreadLock current = locks.get(threadId);
            if (current == null) {
                return false;
            }
            if (!current.isHeldBy(ownerId)) {
                log.warn("{} tried to release thread {} held by {}", ownerId, threadId, current.getOwnerId());
                return false;
            }
            return locks.remove(threadId, current);
        });
    }

    @Override
    public Mono<Boolean> forceRelease(String threadId, String reason) {
        return Mono.fromCallable(() -> {
            ThreadLock removed = locks.remove(threadId);
            if (removed != null) {
                log.warn("Force released lock: threadId={}, holder={}, reason={}", threadId, removed.getOwnerId(), reason);
            }
            return removed != null;
        });
    }

    @Override
    public Mono<Boolean> extend(String threadId, String ownerId, Duration extensionDuration) {
        return Mono.fromCallable(() -> {
            ThreadLock current = locks.get(threadId);
            if (current == null || !current.isHeldBy(ownerId) || current.isExpired()) {
                return false;
            }
            return locks.replace(threadId, current, current.extend(extensionDuration));
        });
    }

    @Override
    public Mono<Boolean> isLocked(String threadId) {
        return getLockInfo(threadId).map(Optional::isPresent);
    }

    @Override
    public Mono<Optional<ThreadLock>> getLockInfo(String threadId) {
        return Mono.fromCallable(() -> Optional.ofNullable(locks.get(threadId)).filter(lock -> !lock.isExpired()));
    }

    @Override
    public Mono<Long> cleanupExpiredLocks() {
        return Mono.fromCallable(this::removeExpired);
    }

    private long removeExpired() {
        long removed = 0;
        for (Map.Entry<String, ThreadLock> entry : locks.entrySet()) {
            if (entry.getValue().isExpired() && locks.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Removed {} expired thread locks", removed);
        }
        return removed;
    }

    @Override
    public void shutdown() {
        sweeper.shutdown();
        try {
            if (!sweeper.awaitTermination(5, TimeUnit.SECONDS)) {
                sweeper.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweeper.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("InMemoryThreadLockService shut down");
    }

    public boolean isShutdown() {
        return sweeper.isShutdown();
    }
}
