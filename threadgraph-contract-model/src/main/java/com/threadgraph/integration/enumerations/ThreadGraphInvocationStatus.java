package com.threadgraph.integration.enumerations;

public enum ThreadGraphInvocationStatus {
    COMPLETED,
    SUSPENDED
}
