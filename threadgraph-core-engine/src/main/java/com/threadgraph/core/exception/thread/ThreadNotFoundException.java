package com.threadgraph.core.exception.thread;

import com.threadgraph.core.exception.ThreadGraphRuntimeException;
import com.threadgraph.core.exception.codes.ThreadGraphInternalErrorCodes;
import lombok.Getter;

import java.util.Map;

@Getter
public class ThreadNotFoundException extends ThreadGraphRuntimeException {

    private final String threadId;

    public ThreadNotFoundException(String threadId) {
        super(ThreadGraphInternalErrorCodes.THREAD_NOT_FOUND, Map.of("threadId", threadId));
        this.threadId = threadId;
    }
}
