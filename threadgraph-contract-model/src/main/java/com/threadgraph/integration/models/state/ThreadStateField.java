package com.threadgraph.integration.models.state;

import com.threadgraph.integration.enumerations.ThreadGraphClarityStatus;
import com.threadgraph.integration.enumerations.ThreadGraphMergePolicy;
import com.threadgraph.integration.enumerations.ThreadGraphValidationResult;
import com.threadgraph.integration.models.message.ThreadGraphChatMessage;
import lombok.Getter;

import java.util.function.Predicate;

/**
 * The per-thread state schema. Every field declares its merge policy, the type of its values,
 * whether it is reset when a new user turn starts and the range its values must stay within.
 *
 * <p>For {@link ThreadGraphMergePolicy#APPEND} fields the value type is the element type of the sequence.
 */
@Getter
public enum ThreadStateField {

    MESSAGE_HISTORY("messageHistory", ThreadGraphMergePolicy.APPEND, ThreadGraphChatMessage.class),
    CURRENT_QUERY("currentQuery", ThreadGraphMergePolicy.OVERWRITE, String.class),
    SUBJECT_ENTITY("subjectEntity", ThreadGraphMergePolicy.OVERWRITE, String.class),
    LAST_RESOLVED_SUBJECT("lastResolvedSubject", ThreadGraphMergePolicy.OVERWRITE, String.class),
    CLARITY_STATUS("clarityStatus", ThreadGraphMergePolicy.OVERWRITE, ThreadGraphClarityStatus.class),
    CLARIFICATION_QUESTION("clarificationQuestion", ThreadGraphMergePolicy.OVERWRITE, String.class),
    RESEARCH_FINDINGS("researchFindings", ThreadGraphMergePolicy.OVERWRITE, String.class, true, null),
    CONFIDENCE_SCORE("confidenceScore", ThreadGraphMergePolicy.OVERWRITE, Double.class, true, null,
            value -> {
                double score = (Double) value;
                return score >= ThreadStatePolicy.CONFIDENCE_MIN && score <= ThreadStatePolicy.CONFIDENCE_MAX;
            },
            "must be within [" + ThreadStatePolicy.CONFIDENCE_MIN + ", " + ThreadStatePolicy.CONFIDENCE_MAX + "]"),
    VALIDATION_RESULT("validationResult", ThreadGraphMergePolicy.OVERWRITE, ThreadGraphValidationResult.class, true, null),
    ATTEMPT_COUNTER("attemptCounter", ThreadGraphMergePolicy.OVERWRITE, Integer.class, true, 0,
            value -> {
                int attempts = (Integer) value;
                return attempts >= 0 && attempts <= ThreadStatePolicy.ATTEMPT_CAP;
            },
            "must be within [0, " + ThreadStatePolicy.ATTEMPT_CAP + "]"),
    FINAL_RESPONSE("finalResponse", ThreadGraphMergePolicy.OVERWRITE, String.class, true, null),
    VISITED_TRACE("visitedTrace", ThreadGraphMergePolicy.APPEND, String.class);

    private final String key;
    private final ThreadGraphMergePolicy mergePolicy;
    private final Class<?> valueType;
    private final boolean resetOnTurnStart;
    private final Object turnResetValue;
    @Getter(lombok.AccessLevel.NONE)
    private final Predicate<Object> constraint;
    private final String constraintDescription;

    ThreadStateField(String key, ThreadGraphMergePolicy mergePolicy, Class<?> valueType) {
        this(key, mergePolicy, valueType, false, null);
    }

    ThreadStateField(String key, ThreadGraphMergePolicy mergePolicy, Class<?> valueType,
                     boolean resetOnTurnStart, Object turnResetValue) {
        this(key, mergePolicy, valueType, resetOnTurnStart, turnResetValue, value -> true, null);
    }

    ThreadStateField(String key, ThreadGraphMergePolicy mergePolicy, Class<?> valueType,
                     boolean resetOnTurnStart, Object turnResetValue,
                     Predicate<Object> constraint, String constraintDescription) {
        this.key = key;
        this.mergePolicy = mergePolicy;
        this.valueType = valueType;
        this.resetOnTurnStart = resetOnTurnStart;
        this.turnResetValue = turnResetValue;
        this.constraint = constraint;
        this.constraintDescription = constraintDescription;
    }

    public boolean isAppendOnly() {
        return mergePolicy == ThreadGraphMergePolicy.APPEND;
    }

    /**
     * Checks a single non-null value (an element, for append fields) against the declared type and range.
     */
    public boolean accepts(Object value) {
        return valueType.isInstance(value) && constraint.test(value);
    }
}
