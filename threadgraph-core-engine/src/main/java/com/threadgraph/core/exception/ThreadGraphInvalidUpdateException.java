package com.threadgraph.core.exception;

import com.threadgraph.core.exception.codes.ThreadGraphInternalErrorCodes;
import com.threadgraph.integration.models.state.ThreadStateField;
import lombok.Getter;

import java.util.Map;

@Getter
public class ThreadGraphInvalidUpdateException extends ThreadGraphRuntimeException {

    private final ThreadStateField field;

    public ThreadGraphInvalidUpdateException(ThreadStateField field, String reason) {
        super(ThreadGraphInternalErrorCodes.INVALID_STATE_UPDATE, Map.of("field", field.getKey(), "reason", reason));
        this.field = field;
    }
}
