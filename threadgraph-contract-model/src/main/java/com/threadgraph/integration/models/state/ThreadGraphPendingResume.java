package com.threadgraph.integration.models.state;

import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.time.Instant;

/**
 * Marker recorded on a suspended thread: where it stopped, what the caller was shown and where it continues.
 */
@Data
@Builder
public class ThreadGraphPendingResume implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String suspendedStage;
    private final String resumeTarget;
    private final Object payload;
    private final Instant suspendedAt;
}
