package com.threadgraph.integration.contract;

import com.threadgraph.integration.models.state.ThreadState;

/**
 * Chooses the next stage from the merged state after a stage completed.
 * Returns a stage name or {@link com.threadgraph.integration.constant.ThreadGraphConstants#END}.
 */
@FunctionalInterface
public interface IThreadGraphRouter {
    String route(ThreadState state);
}
