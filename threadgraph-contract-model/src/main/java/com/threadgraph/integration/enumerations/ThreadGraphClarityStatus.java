package com.threadgraph.integration.enumerations;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;

/**
 * Outcome of the clarity assessment performed at the start of every user turn.
 */
@Getter
@AllArgsConstructor
public enum ThreadGraphClarityStatus {
    CLEAR("clear"),
    NEEDS_CLARIFICATION("needs_clarification");

    private final String value;

    public static ThreadGraphClarityStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown clarity status: " + value));
    }
}
