package com.threadgraph.core.exception;

import com.threadgraph.integration.contract.IThreadGraphErrorInfo;
import com.threadgraph.integration.exception.IThreadGraphException;
import com.threadgraph.integration.exception.ThreadGraphStageRuntimeException;
import lombok.Getter;

import java.util.Map;

/**
 * Root of every failure the engine reports to callers.
 */
@Getter
public class ThreadGraphRuntimeException extends RuntimeException implements IThreadGraphException {

    private final IThreadGraphErrorInfo errorInfo;
    private final Map<String, String> templateVariables;
    private final Object additionalInfo;

    public ThreadGraphRuntimeException(IThreadGraphErrorInfo errorInfo, Map<String, String> templateVariables) {
        this(errorInfo, templateVariables, null);
    }

    public ThreadGraphRuntimeException(IThreadGraphErrorInfo errorInfo, Map<String, String> templateVariables, Throwable cause) {
        this(errorInfo, templateVariables, cause, null);
    }

    public ThreadGraphRuntimeException(IThreadGraphErrorInfo errorInfo, Map<String, String> templateVariables,
                                       Throwable cause, Object additionalInfo) {
        super(errorInfo.getErrorCode() + ": "
                + ThreadGraphStageRuntimeException.renderTemplate(errorInfo.getErrorTemplate(), templateVariables), cause);
        this.errorInfo = errorInfo;
        this.templateVariables = templateVariables;
        this.additionalInfo = additionalInfo;
    }

    @Override
    public Throwable getRootCause() {
        return getCause();
    }

    public String getErrorCode() {
        return errorInfo.getErrorCode();
    }
}
