package com.threadgraph.core.engine.graph;

import com.threadgraph.core.exception.ThreadGraphDefinitionException;
import com.threadgraph.integration.constant.ThreadGraphConstants;
import com.threadgraph.integration.contract.IThreadGraphStage;
import com.threadgraph.integration.models.execution.ThreadGraphStageResult;
import com.threadgraph.integration.models.state.ThreadStateUpdate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import static org.junit.jupiter.api.Assertions.*;

class ThreadGraphDefinitionTest {

    private static final IThreadGraphStage NOOP = state -> Mono.just(ThreadGraphStageResult.proceed(ThreadStateUpdate.empty()));

    @Test
    @DisplayName("should build a graph whose routes all point at declared stages")
    void shouldBuildValidGraph() {
        ThreadGraphDefinition graph = ThreadGraphDefinition.builder("valid")
                .stage("a", NOOP, state -> "b", "b")
                .terminalStage("b", NOOP)
                .entry("a")
                .build();

        assertEquals("a", graph.getEntryStage());
        assertTrue(graph.isTurnEntry("a"));
        assertFalse(graph.isTurnEntry("b"));
        assertTrue(graph.findStage("b").orElseThrow().canRouteTo(ThreadGraphConstants.END));
    }

    @Test
    @DisplayName("should reject a route to an undeclared stage")
    void shouldRejectUndeclaredTarget() {
        ThreadGraphDefinition.Builder builder = ThreadGraphDefinition.builder("invalid")
                .stage("a", NOOP, state -> "missing", "missing")
                .entry("a");

        assertThrows(ThreadGraphDefinitionException.class, builder::build);
    }

    @Test
    @DisplayName("should reject a missing entry stage")
    void shouldRejectMissingEntry() {
        ThreadGraphDefinition.Builder builder = ThreadGraphDefinition.builder("no-entry")
                .terminalStage("a", NOOP);

        assertThrows(ThreadGraphDefinitionException.class, builder::build);
    }

    @Test
    @DisplayName("should reject duplicate and reserved stage names")
    void shouldRejectBadNames() {
        ThreadGraphDefinition.Builder builder = ThreadGraphDefinition.builder("dupes").terminalStage("a", NOOP);

        assertThrows(ThreadGraphDefinitionException.class, () -> builder.terminalStage("a", NOOP));
        assertThrows(ThreadGraphDefinitionException.class, () -> builder.terminalStage(ThreadGraphConstants.END, NOOP));
        assertThrows(ThreadGraphDefinitionException.class, () -> builder.stage("c", NOOP, state -> "a"));
    }
}
