package com.threadgraph.integration.enumerations;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Status classes attached to error codes so that hosts exposing the engine over HTTP can map failures.
 */
@Getter
@AllArgsConstructor
public enum ThreadGraphHttpStatus {
    BAD_REQUEST(400),
    NOT_FOUND(404),
    CONFLICT(409),
    UNPROCESSABLE_ENTITY(422),
    INTERNAL_SERVER_ERROR(500),
    BAD_GATEWAY(502),
    GATEWAY_TIMEOUT(504);

    private final int code;
}
