package com.threadgraph.core.exception;

import com.threadgraph.core.exception.codes.ThreadGraphInternalErrorCodes;

import java.util.Map;

public class ThreadGraphConfigurationException extends ThreadGraphRuntimeException {

    public ThreadGraphConfigurationException(String key, String reason) {
        super(ThreadGraphInternalErrorCodes.CONFIGURATION_INVALID, Map.of("key", key, "reason", reason));
    }

    public ThreadGraphConfigurationException(String key, String reason, Throwable cause) {
        super(ThreadGraphInternalErrorCodes.CONFIGURATION_INVALID, Map.of("key", key, "reason", reason), cause);
    }
}
