package com.threadgraph.research.workflow.plugin.reasoning;

/**
 * Why a stage calls the reasoning service. Used for logging and to tell calls of the same stage apart.
 */
public enum ReasoningPurpose {
    CLARITY,
    RESEARCH,
    CONFIDENCE,
    VALIDATION,
    SYNTHESIS
}
