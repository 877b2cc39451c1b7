package com.threadgraph.integration.enumerations;

public enum ThreadGraphMessageRole {
    USER,
    ASSISTANT,
    SYSTEM
}
