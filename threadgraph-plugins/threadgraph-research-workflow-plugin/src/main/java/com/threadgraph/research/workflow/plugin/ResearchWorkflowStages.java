package com.threadgraph.research.workflow.plugin;

/**
 * Names of the stages of the research workflow graph.
 */
public interface ResearchWorkflowStages {
    String RESOLVE = "resolve";
    String AWAIT_INPUT = "await-input";
    String GATHER = "gather";
    String VALIDATE = "validate";
    String COMPOSE = "compose";
}
