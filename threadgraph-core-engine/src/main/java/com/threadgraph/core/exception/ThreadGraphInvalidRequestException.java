package com.threadgraph.core.exception;

import com.threadgraph.core.exception.codes.ThreadGraphInternalErrorCodes;

import java.util.Map;

public class ThreadGraphInvalidRequestException extends ThreadGraphRuntimeException {

    public ThreadGraphInvalidRequestException(String reason) {
        super(ThreadGraphInternalErrorCodes.INVALID_REQUEST, Map.of("reason", reason));
    }
}
