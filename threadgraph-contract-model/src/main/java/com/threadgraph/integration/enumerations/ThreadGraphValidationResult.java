package com.threadgraph.integration.enumerations;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;

@Getter
@AllArgsConstructor
public enum ThreadGraphValidationResult {
    SUFFICIENT("sufficient"),
    INSUFFICIENT("insufficient");

    private final String value;

    public static ThreadGraphValidationResult fromValue(String value) {
        return Arrays.stream(values())
                .filter(result -> result.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown validation result: " + value));
    }
}
