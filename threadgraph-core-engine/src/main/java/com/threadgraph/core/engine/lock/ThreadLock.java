package com.threadgraph.core.engine.lock;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

/**
 * Exclusive execution right on one thread, held for the length of an invoke or resume.
 */
@Data
@Builder(toBuilder = true)
public class ThreadLock {

    private final String threadId;
    private final String ownerId;
    private final Instant acquiredAt;
    private final Instant expiresAt;
    /**
     * invoke or resume, for diagnostics.
     */
    private final String operation;
    @Builder.Default
    private final int extensionCount = 0;
    private final String holderThreadName;

    public boolean isExpired() {
        return expiresAt != null && Instant.now().isAfter(expiresAt);
    }

    public boolean isHeldBy(String candidateOwner) {
        return ownerId.equals(candidateOwner);
    }

    public Duration getRemainingTime() {
        if (expiresAt == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(Instant.now(), expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public ThreadLock extend(Duration extensionDuration) {
        return toBuilder()
                .expiresAt(Instant.now().plus(extensionDuration))
                .extensionCount(extensionCount + 1)
                .build();
    }

    public static ThreadLock create(String threadId, String ownerId, Duration duration, String operation) {
        Instant now = Instant.now();
        return ThreadLock.builder()
                .threadId(threadId)
                .ownerId(ownerId)
                .acquiredAt(now)
                .expiresAt(now.plus(duration))
                .operation(operation)
                .holderThreadName(Thread.currentThread().getName())
                .build();
    }
}
