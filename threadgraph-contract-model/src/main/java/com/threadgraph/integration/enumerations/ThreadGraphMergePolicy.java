package com.threadgraph.integration.enumerations;

/**
 * How an update to a single state field is combined with the value already held.
 */
public enum ThreadGraphMergePolicy {

    /**
     * New elements are concatenated after the existing sequence. Existing elements are never dropped.
     */
    APPEND,

    /**
     * The update value replaces the existing one. An explicit absent value clears the field.
     */
    OVERWRITE
}
