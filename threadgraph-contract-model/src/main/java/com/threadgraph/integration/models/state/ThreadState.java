package com.threadgraph.integration.models.state;

import com.threadgraph.integration.enumerations.ThreadGraphClarityStatus;
import com.threadgraph.integration.enumerations.ThreadGraphExecutionState;
import com.threadgraph.integration.enumerations.ThreadGraphValidationResult;
import com.threadgraph.integration.models.message.ThreadGraphChatMessage;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a conversation thread: the field values declared by {@link ThreadStateField}
 * plus the bookkeeping the engine needs to checkpoint and resume the thread.
 *
 * <p>Snapshots are only ever produced by merging updates into a previous snapshot; nothing mutates
 * an instance after construction.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ThreadState implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String threadId;
    @Getter(lombok.AccessLevel.NONE)
    private final EnumMap<ThreadStateField, Object> values;
    private final ThreadGraphPendingResume pendingResume;
    private final ThreadGraphExecutionState executionState;
    /**
     * Stage about to run, or the stage that suspended. Absent once the thread completed.
     */
    private final String currentStage;
    /**
     * Incremented by every persisted step. Used for optimistic concurrency checks by the checkpoint stores.
     */
    private final long version;
    private final Instant createdAt;
    private final Instant updatedAt;

    @Builder(toBuilder = true)
    private ThreadState(String threadId,
                        Map<ThreadStateField, Object> values,
                        ThreadGraphPendingResume pendingResume,
                        ThreadGraphExecutionState executionState,
                        String currentStage,
                        long version,
                        Instant createdAt,
                        Instant updatedAt) {
        this.threadId = threadId;
        this.values = new EnumMap<>(ThreadStateField.class);
        if (values != null) {
            values.forEach((field, value) -> {
                if (value != null) {
                    this.values.put(field, field.isAppendOnly() ? List.copyOf((List<?>) value) : value);
                }
            });
        }
        this.pendingResume = pendingResume;
        this.executionState = executionState;
        this.currentStage = currentStage;
        this.version = version;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    /**
     * State of a thread that has never been invoked: every sequence empty, the attempt counter at zero.
     */
    public static ThreadState initial(String threadId) {
        Instant now = Instant.now();
        Map<ThreadStateField, Object> values = new EnumMap<>(ThreadStateField.class);
        values.put(ThreadStateField.ATTEMPT_COUNTER, 0);
        return ThreadState.builder()
                .threadId(threadId)
                .values(values)
                .executionState(ThreadGraphExecutionState.COMPLETED)
                .version(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public Map<ThreadStateField, Object> getValues() {
        return Collections.unmodifiableMap(values);
    }

    public Object get(ThreadStateField field) {
        return values.get(field);
    }

    public boolean has(ThreadStateField field) {
        return values.containsKey(field);
    }

    public boolean isSuspended() {
        return pendingResume != null;
    }

    public boolean isNew() {
        return version == 0;
    }

    @SuppressWarnings("unchecked")
    public List<ThreadGraphChatMessage> getMessageHistory() {
        return (List<ThreadGraphChatMessage>) values.getOrDefault(ThreadStateField.MESSAGE_HISTORY, List.of());
    }

    @SuppressWarnings("unchecked")
    public List<String> getVisitedTrace() {
        return (List<String>) values.getOrDefault(ThreadStateField.VISITED_TRACE, List.of());
    }

    public String getCurrentQuery() {
        return (String) values.get(ThreadStateField.CURRENT_QUERY);
    }

    public String getSubjectEntity() {
        return (String) values.get(ThreadStateField.SUBJECT_ENTITY);
    }

    public String getLastResolvedSubject() {
        return (String) values.get(ThreadStateField.LAST_RESOLVED_SUBJECT);
    }

    public ThreadGraphClarityStatus getClarityStatus() {
        return (ThreadGraphClarityStatus) values.get(ThreadStateField.CLARITY_STATUS);
    }

    public String getClarificationQuestion() {
        return (String) values.get(ThreadStateField.CLARIFICATION_QUESTION);
    }

    public String getResearchFindings() {
        return (String) values.get(ThreadStateField.RESEARCH_FINDINGS);
    }

    public Double getConfidenceScore() {
        return (Double) values.get(ThreadStateField.CONFIDENCE_SCORE);
    }

    public ThreadGraphValidationResult getValidationResult() {
        return (ThreadGraphValidationResult) values.get(ThreadStateField.VALIDATION_RESULT);
    }

    public int getAttemptCounter() {
        return (Integer) values.getOrDefault(ThreadStateField.ATTEMPT_COUNTER, 0);
    }

    public String getFinalResponse() {
        return (String) values.get(ThreadStateField.FINAL_RESPONSE);
    }
}
