package com.threadgraph.core.engine.graph;

import com.threadgraph.integration.contract.IThreadGraphRouter;
import com.threadgraph.integration.contract.IThreadGraphStage;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Set;

@Getter
@Builder
@ToString(exclude = {"stage", "router"})
public class ThreadGraphStageDefinition {
    private final String name;
    private final IThreadGraphStage stage;
    private final IThreadGraphRouter router;
    /**
     * Every stage name (or the end marker) the router may return.
     */
    private final Set<String> targets;

    public boolean canRouteTo(String target) {
        return targets.contains(target);
    }
}
