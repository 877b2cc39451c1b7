package com.threadgraph.core.exception;

import com.threadgraph.core.exception.codes.ThreadGraphInternalErrorCodes;
import lombok.Getter;

import java.util.Map;

@Getter
public class ThreadGraphCheckpointStoreException extends ThreadGraphRuntimeException {

    private final String threadId;

    public ThreadGraphCheckpointStoreException(String operation, String threadId, Throwable cause) {
        super(ThreadGraphInternalErrorCodes.CHECKPOINT_STORE_FAILED,
                Map.of("operation", operation, "threadId", String.valueOf(threadId)), cause);
        this.threadId = threadId;
    }

    private ThreadGraphCheckpointStoreException(String threadId, long storedVersion, long expectedVersion) {
        super(ThreadGraphInternalErrorCodes.CHECKPOINT_VERSION_CONFLICT,
                Map.of("threadId", threadId,
                        "storedVersion", String.valueOf(storedVersion),
                        "expectedVersion", String.valueOf(expectedVersion)));
        this.threadId = threadId;
    }

    public static ThreadGraphCheckpointStoreException versionConflict(String threadId, long storedVersion, long expectedVersion) {
        return new ThreadGraphCheckpointStoreException(threadId, storedVersion, expectedVersion);
    }

    public boolean isVersionConflict() {
        return getErrorInfo() == ThreadGraphInternalErrorCodes.CHECKPOINT_VERSION_CONFLICT;
    }
}
