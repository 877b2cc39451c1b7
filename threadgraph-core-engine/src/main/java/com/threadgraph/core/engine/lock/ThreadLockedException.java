package com.threadgraph.core.engine.lock;

import com.threadgraph.core.exception.ThreadGraphRuntimeException;
import com.threadgraph.core.exception.codes.ThreadGraphInternalErrorCodes;
import lombok.Getter;

import java.util.Map;

/**
 * Raised when an invoke or resume targets a thread that another call is currently executing.
 * The rejected call has no effect on the thread.
 */
@Getter
public class ThreadLockedException extends ThreadGraphRuntimeException {

    private final String threadId;
    private final String currentOwner;
    private final ThreadLock lockInfo;

    private ThreadLockedException(String threadId, String currentOwner, ThreadLock lockInfo) {
        super(ThreadGraphInternalErrorCodes.THREAD_LOCKED,
                Map.of("threadId", threadId, "owner", currentOwner == null ? "another caller" : currentOwner));
        this.threadId = threadId;
        this.currentOwner = currentOwner;
        this.lockInfo = lockInfo;
    }

    public static ThreadLockedException lockedBy(String threadId, String currentOwner) {
        return new ThreadLockedException(threadId, currentOwner, null);
    }

    public static ThreadLockedException withLockInfo(ThreadLock lockInfo) {
        return new ThreadLockedException(lockInfo.getThreadId(), lockInfo.getOwnerId(), lockInfo);
    }
}
