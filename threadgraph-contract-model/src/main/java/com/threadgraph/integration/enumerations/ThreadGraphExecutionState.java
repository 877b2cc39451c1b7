package com.threadgraph.integration.enumerations;

/**
 * Lifecycle state of a thread as recorded in its checkpoint.
 */
public enum ThreadGraphExecutionState {

    /**
     * A step is in flight or the thread is between steps of a single invocation.
     */
    RUNNING,

    /**
     * The thread is suspended and only accepts a resume.
     */
    WAITING,

    /**
     * The last invocation reached the terminal marker; the thread accepts a new invoke.
     */
    COMPLETED;

    public boolean isTerminal() {
        return this == COMPLETED;
    }
}
