package com.threadgraph.core.exception;

import com.threadgraph.core.exception.codes.ThreadGraphInternalErrorCodes;

import java.util.Map;

public class ThreadGraphDefinitionException extends ThreadGraphRuntimeException {

    public ThreadGraphDefinitionException(String reason) {
        super(ThreadGraphInternalErrorCodes.GRAPH_DEFINITION_INVALID, Map.of("reason", reason));
    }
}
