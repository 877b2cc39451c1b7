package com.threadgraph.integration.models.state;

import com.threadgraph.integration.enumerations.ThreadGraphClarityStatus;
import com.threadgraph.integration.enumerations.ThreadGraphValidationResult;
import com.threadgraph.integration.models.message.ThreadGraphChatMessage;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A partial state produced by a stage, a resume or an invoke input.
 *
 * <p>Fields not mentioned are left untouched by the merge. A field mentioned with a {@code null}
 * value is an explicit "set to absent". For append-only fields the value is the list of elements
 * to concatenate.
 */
public final class ThreadStateUpdate implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final ThreadStateUpdate EMPTY = new ThreadStateUpdate(new EnumMap<>(ThreadStateField.class));

    private final EnumMap<ThreadStateField, Object> entries;

    private ThreadStateUpdate(EnumMap<ThreadStateField, Object> entries) {
        this.entries = entries;
    }

    public static ThreadStateUpdate empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The input of a new user turn: the query is recorded as the current query and appended to the history.
     */
    public static ThreadStateUpdate userTurn(String query) {
        return builder()
                .appendMessage(ThreadGraphChatMessage.user(query))
                .currentQuery(query)
                .build();
    }

    /**
     * Restores every field flagged as reset-on-turn-start to its reset value.
     */
    public static ThreadStateUpdate turnReset() {
        Builder builder = builder();
        for (ThreadStateField field : ThreadStateField.values()) {
            if (field.isResetOnTurnStart()) {
                builder.set(field, field.getTurnResetValue());
            }
        }
        return builder.build();
    }

    public boolean contains(ThreadStateField field) {
        return entries.containsKey(field);
    }

    public Object get(ThreadStateField field) {
        return entries.get(field);
    }

    public Set<ThreadStateField> fields() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Map<ThreadStateField, Object> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Combines this update with a later one. Append fields concatenate, overwrite fields take the later value.
     */
    public ThreadStateUpdate andThen(ThreadStateUpdate next) {
        Builder builder = toBuilder();
        next.entries.forEach((field, value) -> {
            if (field.isAppendOnly()) {
                builder.appendAll(field, (List<?>) value);
            } else {
                builder.set(field, value);
            }
        });
        return builder.build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        entries.forEach((field, value) -> builder.entries.put(field,
                field.isAppendOnly() ? new ArrayList<>((List<?>) value) : value));
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ThreadStateUpdate)) {
            return false;
        }
        return entries.equals(((ThreadStateUpdate) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "ThreadStateUpdate" + entries;
    }

    public static final class Builder {

        private final EnumMap<ThreadStateField, Object> entries = new EnumMap<>(ThreadStateField.class);

        private Builder() {
        }

        /**
         * Sets an overwrite field. A {@code null} value clears the field.
         */
        public Builder set(ThreadStateField field, Object value) {
            if (field.isAppendOnly()) {
                throw new IllegalArgumentException("Field " + field.getKey() + " is append-only, use append");
            }
            entries.put(field, value);
            return this;
        }

        public Builder clear(ThreadStateField field) {
            return set(field, null);
        }

        public Builder append(ThreadStateField field, Object... elements) {
            return appendAll(field, Arrays.asList(elements));
        }

        @SuppressWarnings("unchecked")
        public Builder appendAll(ThreadStateField field, List<?> elements) {
            if (!field.isAppendOnly()) {
                throw new IllegalArgumentException("Field " + field.getKey() + " is not append-only, use set");
            }
            List<Object> pending = (List<Object>) entries.computeIfAbsent(field, f -> new ArrayList<>());
            pending.addAll(elements);
            return this;
        }

        public Builder appendMessage(ThreadGraphChatMessage message) {
            return append(ThreadStateField.MESSAGE_HISTORY, message);
        }

        public Builder appendTrace(String stageName) {
            return append(ThreadStateField.VISITED_TRACE, stageName);
        }

        public Builder currentQuery(String query) {
            return set(ThreadStateField.CURRENT_QUERY, query);
        }

        public Builder subjectEntity(String subject) {
            return set(ThreadStateField.SUBJECT_ENTITY, subject);
        }

        public Builder lastResolvedSubject(String subject) {
            return set(ThreadStateField.LAST_RESOLVED_SUBJECT, subject);
        }

        public Builder clarityStatus(ThreadGraphClarityStatus status) {
            return set(ThreadStateField.CLARITY_STATUS, status);
        }

        public Builder clarificationQuestion(String question) {
            return set(ThreadStateField.CLARIFICATION_QUESTION, question);
        }

        public Builder researchFindings(String findings) {
            return set(ThreadStateField.RESEARCH_FINDINGS, findings);
        }

        public Builder confidenceScore(Double score) {
            return set(ThreadStateField.CONFIDENCE_SCORE, score);
        }

        public Builder validationResult(ThreadGraphValidationResult result) {
            return set(ThreadStateField.VALIDATION_RESULT, result);
        }

        public Builder attemptCounter(Integer attempts) {
            return set(ThreadStateField.ATTEMPT_COUNTER, attempts);
        }

        public Builder finalResponse(String response) {
            return set(ThreadStateField.FINAL_RESPONSE, response);
        }

        public ThreadStateUpdate build() {
            EnumMap<ThreadStateField, Object> copy = new EnumMap<>(ThreadStateField.class);
            entries.forEach((field, value) -> copy.put(field,
                    field.isAppendOnly() ? Collections.unmodifiableList(new ArrayList<>((List<?>) value)) : value));
            return new ThreadStateUpdate(copy);
        }
    }
}
