package com.threadgraph.core.engine.state;

import com.threadgraph.core.exception.ThreadGraphInvalidUpdateException;
import com.threadgraph.integration.enumerations.ThreadGraphClarityStatus;
import com.threadgraph.integration.enumerations.ThreadGraphValidationResult;
import com.threadgraph.integration.models.message.ThreadGraphChatMessage;
import com.threadgraph.integration.models.state.ThreadState;
import com.threadgraph.integration.models.state.ThreadStateField;
import com.threadgraph.integration.models.state.ThreadStateUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ThreadStateReducerTest {

    private ThreadStateReducer reducer;
    private ThreadState base;

    @BeforeEach
    void setUp() {
        reducer = new ThreadStateReducer();
        base = ThreadState.initial("thread-1");
    }

    @Nested
    @DisplayName("Append-only fields")
    class AppendTests {

        @Test
        @DisplayName("should concatenate messages after the existing history")
        void shouldConcatenateMessages() {
            // Given
            ThreadState first = reducer.merge(base, ThreadStateUpdate.builder()
                    .appendMessage(ThreadGraphChatMessage.user("hello"))
                    .build());

            // When
            ThreadState second = reducer.merge(first, ThreadStateUpdate.builder()
                    .appendMessage(ThreadGraphChatMessage.assistant("hi"))
                    .appendMessage(ThreadGraphChatMessage.user("again"))
                    .build());

            // Then
            assertEquals(List.of(
                    ThreadGraphChatMessage.user("hello"),
                    ThreadGraphChatMessage.assistant("hi"),
                    ThreadGraphChatMessage.user("again")), second.getMessageHistory());
            assertEquals(1, first.getMessageHistory().size(), "previous snapshot must not change");
        }

        @Test
        @DisplayName("should keep the trace when an update does not mention it")
        void shouldKeepTraceWhenNotMentioned() {
            // Given
            ThreadState traced = reducer.merge(base, ThreadStateUpdate.builder().appendTrace("resolve").build());

            // When
            ThreadState merged = reducer.merge(traced, ThreadStateUpdate.builder().currentQuery("q").build());

            // Then
            assertEquals(List.of("resolve"), merged.getVisitedTrace());
        }

        @Test
        @DisplayName("should reject elements of the wrong type")
        void shouldRejectWrongElementType() {
            ThreadStateUpdate update = ThreadStateUpdate.builder()
                    .append(ThreadStateField.MESSAGE_HISTORY, "not a message")
                    .build();

            ThreadGraphInvalidUpdateException error = assertThrows(ThreadGraphInvalidUpdateException.class,
                    () -> reducer.merge(base, update));
            assertEquals(ThreadStateField.MESSAGE_HISTORY, error.getField());
        }
    }

    @Nested
    @DisplayName("Overwrite fields")
    class OverwriteTests {

        @Test
        @DisplayName("should replace the value and leave unmentioned fields unchanged")
        void shouldReplaceValue() {
            // Given
            ThreadState withQuery = reducer.merge(base, ThreadStateUpdate.builder()
                    .currentQuery("first")
                    .subjectEntity("Acme")
                    .build());

            // When
            ThreadState merged = reducer.merge(withQuery, ThreadStateUpdate.builder().currentQuery("second").build());

            // Then
            assertEquals("second", merged.getCurrentQuery());
            assertEquals("Acme", merged.getSubjectEntity());
        }

        @Test
        @DisplayName("should clear a field set explicitly to absent")
        void shouldClearExplicitAbsent() {
            ThreadState withQuestion = reducer.merge(base, ThreadStateUpdate.builder()
                    .clarificationQuestion("Which company?")
                    .clarityStatus(ThreadGraphClarityStatus.NEEDS_CLARIFICATION)
                    .build());

            ThreadState merged = reducer.merge(withQuestion, ThreadStateUpdate.builder()
                    .clear(ThreadStateField.CLARIFICATION_QUESTION)
                    .clarityStatus(ThreadGraphClarityStatus.CLEAR)
                    .build());

            assertNull(merged.getClarificationQuestion());
            assertFalse(merged.has(ThreadStateField.CLARIFICATION_QUESTION));
            assertEquals(ThreadGraphClarityStatus.CLEAR, merged.getClarityStatus());
        }

        @Test
        @DisplayName("should reject a confidence score outside [0, 10]")
        void shouldRejectConfidenceOutOfRange() {
            ThreadStateUpdate update = ThreadStateUpdate.builder().confidenceScore(10.5).build();

            assertThrows(ThreadGraphInvalidUpdateException.class, () -> reducer.merge(base, update));
        }

        @Test
        @DisplayName("should reject an attempt counter above the cap")
        void shouldRejectAttemptsAboveCap() {
            ThreadStateUpdate update = ThreadStateUpdate.builder().attemptCounter(4).build();

            assertThrows(ThreadGraphInvalidUpdateException.class, () -> reducer.merge(base, update));
        }

        @Test
        @DisplayName("should reject a value of the wrong type")
        void shouldRejectWrongType() {
            ThreadStateUpdate update = ThreadStateUpdate.builder()
                    .set(ThreadStateField.CONFIDENCE_SCORE, "high")
                    .build();

            assertThrows(ThreadGraphInvalidUpdateException.class, () -> reducer.merge(base, update));
        }

        @Test
        @DisplayName("should apply nothing when any field of the update is invalid")
        void shouldBeAtomic() {
            ThreadStateUpdate update = ThreadStateUpdate.builder()
                    .currentQuery("valid")
                    .appendTrace("gather")
                    .confidenceScore(-1.0)
                    .build();

            assertThrows(ThreadGraphInvalidUpdateException.class, () -> reducer.merge(base, update));
            assertNull(base.getCurrentQuery());
            assertTrue(base.getVisitedTrace().isEmpty());
        }
    }

    @Nested
    @DisplayName("Turn reset")
    class TurnResetTests {

        @Test
        @DisplayName("should clear per-turn fields and keep conversation fields")
        void shouldResetPerTurnFields() {
            // Given
            ThreadState previousTurn = reducer.merge(base, ThreadStateUpdate.builder()
                    .appendMessage(ThreadGraphChatMessage.user("q"))
                    .appendTrace("compose")
                    .lastResolvedSubject("Acme")
                    .researchFindings("findings")
                    .confidenceScore(4.0)
                    .validationResult(ThreadGraphValidationResult.INSUFFICIENT)
                    .attemptCounter(3)
                    .finalResponse("answer")
                    .build());

            // When
            ThreadState reset = reducer.merge(previousTurn, ThreadStateUpdate.turnReset());

            // Then
            assertNull(reset.getResearchFindings());
            assertNull(reset.getConfidenceScore());
            assertNull(reset.getValidationResult());
            assertNull(reset.getFinalResponse());
            assertEquals(0, reset.getAttemptCounter());
            assertEquals("Acme", reset.getLastResolvedSubject());
            assertEquals(1, reset.getMessageHistory().size());
            assertEquals(List.of("compose"), reset.getVisitedTrace());
        }
    }
}
