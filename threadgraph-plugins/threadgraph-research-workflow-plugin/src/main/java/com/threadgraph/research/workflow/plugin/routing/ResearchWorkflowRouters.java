package com.threadgraph.research.workflow.plugin.routing;

import com.threadgraph.integration.contract.IThreadGraphRouter;
import com.threadgraph.integration.enumerations.ThreadGraphClarityStatus;
import com.threadgraph.integration.enumerations.ThreadGraphValidationResult;
import com.threadgraph.integration.models.state.ThreadState;
import com.threadgraph.integration.models.state.ThreadStatePolicy;
import com.threadgraph.research.workflow.plugin.ResearchWorkflowStages;
import lombok.extern.slf4j.Slf4j;

/**
 * Routing functions of the research workflow. Pure functions of the merged state.
 */
@Slf4j
public final class ResearchWorkflowRouters {

    private ResearchWorkflowRouters() {
    }

    public static final IThreadGraphRouter AFTER_RESOLVE = ResearchWorkflowRouters::afterResolve;
    public static final IThreadGraphRouter AFTER_GATHER = ResearchWorkflowRouters::afterGather;
    public static final IThreadGraphRouter AFTER_VALIDATE = ResearchWorkflowRouters::afterValidate;
    public static final IThreadGraphRouter AFTER_AWAIT_INPUT = state -> ResearchWorkflowStages.RESOLVE;

    public static String afterResolve(ThreadState state) {
        ThreadGraphClarityStatus status = state.getClarityStatus();
        log.info("Routing after resolve with clarityStatus={}", status);
        return status == ThreadGraphClarityStatus.NEEDS_CLARIFICATION
                ? ResearchWorkflowStages.AWAIT_INPUT
                : ResearchWorkflowStages.GATHER;
    }

    /**
     * Findings scored strictly below the threshold, or not scored at all, go through validation.
     */
    public static String afterGather(ThreadState state) {
        Double confidence = state.getConfidenceScore();
        log.info("Routing after gather with confidenceScore={}", confidence);
        if (confidence == null || confidence < ThreadStatePolicy.CONFIDENCE_THRESHOLD) {
            return ResearchWorkflowStages.VALIDATE;
        }
        return ResearchWorkflowStages.COMPOSE;
    }

    /**
     * Loops back to gather only while the findings are graded insufficient and the attempt cap is not reached.
     */
    public static String afterValidate(ThreadState state) {
        ThreadGraphValidationResult result = state.getValidationResult();
        int attempts = state.getAttemptCounter();
        log.info("Routing after validate with validationResult={}, attemptCounter={}", result, attempts);
        if (result == ThreadGraphValidationResult.INSUFFICIENT && attempts < ThreadStatePolicy.ATTEMPT_CAP) {
            return ResearchWorkflowStages.GATHER;
        }
        return ResearchWorkflowStages.COMPOSE;
    }
}
