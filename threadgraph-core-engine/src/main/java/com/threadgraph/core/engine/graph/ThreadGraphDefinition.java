package com.threadgraph.core.engine.graph;

import com.threadgraph.core.exception.ThreadGraphDefinitionException;
import com.threadgraph.integration.constant.ThreadGraphConstants;
import com.threadgraph.integration.contract.IThreadGraphRouter;
import com.threadgraph.integration.contract.IThreadGraphStage;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable set of named stages with their routers, plus the stage every invoke starts at.
 *
 * <p>The entry stage is also the turn-entry stage: before its output is merged, the fields flagged
 * as reset-on-turn-start are restored to their reset values.
 */
@Getter
public final class ThreadGraphDefinition {

    private final String name;
    private final String entryStage;
    private final Map<String, ThreadGraphStageDefinition> stages;

    private ThreadGraphDefinition(String name, String entryStage, Map<String, ThreadGraphStageDefinition> stages) {
        this.name = name;
        this.entryStage = entryStage;
        this.stages = Collections.unmodifiableMap(stages);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Optional<ThreadGraphStageDefinition> findStage(String stageName) {
        return Optional.ofNullable(stages.get(stageName));
    }

    public boolean hasStage(String stageName) {
        return stages.containsKey(stageName);
    }

    public boolean isTurnEntry(String stageName) {
        return entryStage.equals(stageName);
    }

    public static final class Builder {

        private final String name;
        private final Map<String, ThreadGraphStageDefinition> stages = new LinkedHashMap<>();
        private String entryStage;

        private Builder(String name) {
            this.name = name;
        }

        public Builder stage(String stageName, IThreadGraphStage stage, IThreadGraphRouter router, String... targets) {
            if (stageName == null || stageName.isBlank()) {
                throw new ThreadGraphDefinitionException("stage name cannot be blank");
            }
            if (ThreadGraphConstants.END.equals(stageName)) {
                throw new ThreadGraphDefinitionException("stage name " + stageName + " is reserved");
            }
            if (stages.containsKey(stageName)) {
                throw new ThreadGraphDefinitionException("stage " + stageName + " declared twice");
            }
            if (stage == null || router == null) {
                throw new ThreadGraphDefinitionException("stage " + stageName + " needs an implementation and a router");
            }
            if (targets.length == 0) {
                throw new ThreadGraphDefinitionException("stage " + stageName + " declares no routing target");
            }
            stages.put(stageName, ThreadGraphStageDefinition.builder()
                    .name(stageName)
                    .stage(stage)
                    .router(router)
                    .targets(Set.of(targets))
                    .build());
            return this;
        }

        /**
         * A stage whose completion always ends the invocation.
         */
        public Builder terminalStage(String stageName, IThreadGraphStage stage) {
            return stage(stageName, stage, state -> ThreadGraphConstants.END, ThreadGraphConstants.END);
        }

        public Builder entry(String stageName) {
            this.entryStage = stageName;
            return this;
        }

        public ThreadGraphDefinition build() {
            if (stages.isEmpty()) {
                throw new ThreadGraphDefinitionException("graph " + name + " has no stages");
            }
            if (entryStage == null || !stages.containsKey(entryStage)) {
                throw new ThreadGraphDefinitionException("entry stage " + entryStage + " is not declared");
            }
            stages.values().forEach(definition -> definition.getTargets().forEach(target -> {
                if (!ThreadGraphConstants.END.equals(target) && !stages.containsKey(target)) {
                    throw new ThreadGraphDefinitionException(
                            "stage " + definition.getName() + " routes to undeclared stage " + target);
                }
            }));
            return new ThreadGraphDefinition(name, entryStage, new LinkedHashMap<>(stages));
        }
    }
}
