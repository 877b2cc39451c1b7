package com.threadgraph.integration.constant;

public interface ThreadGraphConstants {

    /**
     * Routing target that ends the current invocation.
     */
    String END = "__end__";

}
