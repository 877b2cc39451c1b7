package com.threadgraph.core.exception.codes;

import com.threadgraph.integration.contract.IThreadGraphErrorInfo;
import com.threadgraph.integration.enumerations.ThreadGraphHttpStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum ThreadGraphInternalErrorCodes implements IThreadGraphErrorInfo {

    THREAD_NOT_FOUND(
            "THREADGRAPH_ERR_0001",
            ThreadGraphHttpStatus.NOT_FOUND,
            "Thread {threadId} has no checkpoint",
            "Invoke the thread before resuming or reading it"
    ),

    INVALID_THREAD_STATE(
            "THREADGRAPH_ERR_0002",
            ThreadGraphHttpStatus.CONFLICT,
            "Thread {threadId} cannot {operation}: {reason}",
            "Resume a suspended thread, invoke a thread that is not suspended"
    ),

    THREAD_LOCKED(
            "THREADGRAPH_ERR_0003",
            ThreadGraphHttpStatus.CONFLICT,
            "Thread {threadId} is being executed by {owner}",
            "Retry once the running invocation finished"
    ),

    STAGE_EXECUTION_FAILED(
            "THREADGRAPH_ERR_0004",
            ThreadGraphHttpStatus.INTERNAL_SERVER_ERROR,
            "Stage {stage} failed on thread {threadId}: {reason}",
            "The thread keeps its last checkpoint and can be invoked or resumed again"
    ),

    STAGE_RETURNED_NO_RESULT(
            "THREADGRAPH_ERR_0005",
            ThreadGraphHttpStatus.INTERNAL_SERVER_ERROR,
            "Stage {stage} completed without a result",
            "Stages must emit exactly one proceed or suspend result"
    ),

    INVALID_STATE_UPDATE(
            "THREADGRAPH_ERR_0006",
            ThreadGraphHttpStatus.UNPROCESSABLE_ENTITY,
            "Update of field {field} rejected: {reason}",
            "Send values of the declared type within the declared range"
    ),

    ROUTE_TARGET_UNKNOWN(
            "THREADGRAPH_ERR_0007",
            ThreadGraphHttpStatus.INTERNAL_SERVER_ERROR,
            "Stage {stage} routed to {target} which is not a declared target",
            "Declare every routing target when building the graph"
    ),

    STEP_LIMIT_EXCEEDED(
            "THREADGRAPH_ERR_0008",
            ThreadGraphHttpStatus.INTERNAL_SERVER_ERROR,
            "Thread {threadId} exceeded {limit} steps in one invocation",
            "Check the routers for an unbounded cycle or raise threadgraph.max-steps-per-invocation"
    ),

    CHECKPOINT_STORE_FAILED(
            "THREADGRAPH_ERR_0009",
            ThreadGraphHttpStatus.INTERNAL_SERVER_ERROR,
            "Checkpoint store failed to {operation} thread {threadId}",
            "Check the checkpoint store location and its permissions"
    ),

    CHECKPOINT_VERSION_CONFLICT(
            "THREADGRAPH_ERR_0010",
            ThreadGraphHttpStatus.CONFLICT,
            "Checkpoint of thread {threadId} is at version {storedVersion}, expected {expectedVersion}",
            "Another executor advanced the thread, reload and retry"
    ),

    GRAPH_DEFINITION_INVALID(
            "THREADGRAPH_ERR_0011",
            ThreadGraphHttpStatus.INTERNAL_SERVER_ERROR,
            "Graph definition is invalid: {reason}",
            "Fix the graph builder calls"
    ),

    CONFIGURATION_INVALID(
            "THREADGRAPH_ERR_0012",
            ThreadGraphHttpStatus.INTERNAL_SERVER_ERROR,
            "Configuration {key} is invalid: {reason}",
            "Correct the system property or environment variable"
    ),

    INVALID_REQUEST(
            "THREADGRAPH_ERR_0013",
            ThreadGraphHttpStatus.BAD_REQUEST,
            "Invalid request: {reason}",
            "Provide a non-blank thread id and an update"
    )

    ;

    private final String errorCode;
    private final ThreadGraphHttpStatus httpStatus;
    private final String errorTemplate;
    private final String resolutionTemplate;
}
