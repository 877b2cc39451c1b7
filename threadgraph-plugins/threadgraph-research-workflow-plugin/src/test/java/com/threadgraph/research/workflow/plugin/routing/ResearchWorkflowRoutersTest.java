package com.threadgraph.research.workflow.plugin.routing;

import com.threadgraph.core.engine.state.ThreadStateReducer;
import com.threadgraph.integration.enumerations.ThreadGraphClarityStatus;
import com.threadgraph.integration.enumerations.ThreadGraphValidationResult;
import com.threadgraph.integration.models.state.ThreadState;
import com.threadgraph.integration.models.state.ThreadStateUpdate;
import com.threadgraph.research.workflow.plugin.ResearchWorkflowStages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ResearchWorkflowRoutersTest {

    private final ThreadStateReducer reducer = new ThreadStateReducer();

    private ThreadState stateWith(ThreadStateUpdate update) {
        return reducer.merge(ThreadState.initial("t-routing"), update);
    }

    @Nested
    @DisplayName("After resolve")
    class AfterResolveTests {

        @Test
        @DisplayName("should ask the user when clarification is needed")
        void shouldAwaitInputWhenUnclear() {
            ThreadState state = stateWith(ThreadStateUpdate.builder()
                    .clarityStatus(ThreadGraphClarityStatus.NEEDS_CLARIFICATION).build());

            assertEquals(ResearchWorkflowStages.AWAIT_INPUT, ResearchWorkflowRouters.afterResolve(state));
        }

        @Test
        @DisplayName("should gather when the query is clear")
        void shouldGatherWhenClear() {
            ThreadState state = stateWith(ThreadStateUpdate.builder()
                    .clarityStatus(ThreadGraphClarityStatus.CLEAR).build());

            assertEquals(ResearchWorkflowStages.GATHER, ResearchWorkflowRouters.afterResolve(state));
        }

        @Test
        @DisplayName("should gather when no clarity status was recorded")
        void shouldGatherWhenStatusAbsent() {
            assertEquals(ResearchWorkflowStages.GATHER, ResearchWorkflowRouters.afterResolve(ThreadState.initial("t")));
        }
    }

    @Nested
    @DisplayName("After gather")
    class AfterGatherTests {

        @ParameterizedTest(name = "confidence {0} routes to validate")
        @ValueSource(doubles = {0.0, 3.5, 5.9, 5.999})
        void shouldValidateBelowThreshold(double confidence) {
            ThreadState state = stateWith(ThreadStateUpdate.builder().confidenceScore(confidence).build());

            assertEquals(ResearchWorkflowStages.VALIDATE, ResearchWorkflowRouters.afterGather(state));
        }

        @ParameterizedTest(name = "confidence {0} routes to compose")
        @ValueSource(doubles = {6.0, 6.1, 10.0})
        void shouldComposeAtOrAboveThreshold(double confidence) {
            ThreadState state = stateWith(ThreadStateUpdate.builder().confidenceScore(confidence).build());

            assertEquals(ResearchWorkflowStages.COMPOSE, ResearchWorkflowRouters.afterGather(state));
        }

        @Test
        @DisplayName("should validate when no confidence was recorded")
        void shouldValidateWhenConfidenceAbsent() {
            assertEquals(ResearchWorkflowStages.VALIDATE, ResearchWorkflowRouters.afterGather(ThreadState.initial("t")));
        }
    }

    @Nested
    @DisplayName("After validate")
    class AfterValidateTests {

        @ParameterizedTest(name = "{0} after {1} attempts routes to {2}")
        @CsvSource({
                "INSUFFICIENT, 1, gather",
                "INSUFFICIENT, 2, gather",
                "INSUFFICIENT, 3, compose",
                "SUFFICIENT, 1, compose",
                "SUFFICIENT, 3, compose"
        })
        void shouldLoopOnlyWhileInsufficientAndBelowCap(ThreadGraphValidationResult result, int attempts, String expected) {
            ThreadState state = stateWith(ThreadStateUpdate.builder()
                    .validationResult(result)
                    .attemptCounter(attempts)
                    .build());

            assertEquals(expected, ResearchWorkflowRouters.afterValidate(state));
        }

        @Test
        @DisplayName("should compose when no grade was recorded")
        void shouldComposeWhenResultAbsent() {
            ThreadState state = stateWith(ThreadStateUpdate.builder().attemptCounter(1).build());

            assertEquals(ResearchWorkflowStages.COMPOSE, ResearchWorkflowRouters.afterValidate(state));
        }
    }
}
