package com.threadgraph.integration.exception;

import com.threadgraph.integration.contract.IThreadGraphErrorInfo;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Raised by stage implementations. The executor wraps it into a stage execution failure
 * that names the thread and the stage.
 */
@Getter
@ToString
public class ThreadGraphStageRuntimeException extends RuntimeException implements IThreadGraphException {
    protected final IThreadGraphErrorInfo errorInfo;
    protected final Map<String, String> templateVariables;
    protected final Throwable rootCause;
    protected final Object additionalInfo;

    public ThreadGraphStageRuntimeException(IThreadGraphErrorInfo errorInfo, Map<String, String> templateVariables,
                                           Throwable rootCause, Object additionalInfo) {
        super(renderTemplate(errorInfo.getErrorTemplate(), templateVariables), rootCause);
        this.errorInfo = errorInfo;
        this.templateVariables = templateVariables;
        this.rootCause = rootCause;
        this.additionalInfo = additionalInfo;
    }

    public ThreadGraphStageRuntimeException(IThreadGraphErrorInfo errorInfo) {
        this(errorInfo, Map.of(), null, null);
    }

    public ThreadGraphStageRuntimeException(IThreadGraphErrorInfo errorInfo, Map<String, String> templateVariables) {
        this(errorInfo, templateVariables, null, null);
    }

    public ThreadGraphStageRuntimeException(IThreadGraphErrorInfo errorInfo, Map<String, String> templateVariables, Throwable rootCause) {
        this(errorInfo, templateVariables, rootCause, null);
    }

    /**
     * Substitutes {@code {name}} placeholders. Unknown placeholders are left as they are.
     */
    public static String renderTemplate(String template, Map<String, String> variables) {
        if (template == null || variables == null || variables.isEmpty()) {
            return template;
        }
        String rendered = template;
        for (Map.Entry<String, String> entry : variables.entrySet()) {
            rendered = rendered.replace("{" + entry.getKey() + "}", String.valueOf(entry.getValue()));
        }
        return rendered;
    }
}
