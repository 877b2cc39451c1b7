package com.threadgraph.research.workflow.plugin.misc;

import tools.jackson.databind.ObjectMapper;

/**
 * Shared Jackson mapper for reasoning request bodies and structured answers.
 */
public final class ResearchWorkflowObjectMapper {

    private ResearchWorkflowObjectMapper() {}

    private static final class SingletonHolder {
        private static final ObjectMapper INSTANCE = new ObjectMapper();
    }

    public static ObjectMapper getInstance() {
        return SingletonHolder.INSTANCE;
    }
}
