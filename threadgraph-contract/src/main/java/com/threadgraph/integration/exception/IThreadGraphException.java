package com.threadgraph.integration.exception;

import com.threadgraph.integration.contract.IThreadGraphErrorInfo;

import java.util.Map;

public interface IThreadGraphException {
    IThreadGraphErrorInfo getErrorInfo();
    Map<String, String> getTemplateVariables();
    Throwable getRootCause();
    Object getAdditionalInfo();

    /**
     * Whether running the failed work again may succeed, e.g. after a timeout or an overloaded remote service.
     */
    default boolean isRetryable() {
        return false;
    }
}
