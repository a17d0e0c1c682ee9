package com.prfactory.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Orchestrator-owned record of one ticket's run through the graphs.
 * <p>
 * Instances are immutable; every transition produces a new copy through one of
 * the {@code with*} methods and is written back to the state store.
 *
 * @param workflowId   opaque handle assigned at start
 * @param ticketId     ticket driving the workflow
 * @param currentGraph graph presently owning execution
 * @param currentState latest checkpoint name reported by that graph
 * @param status       lifecycle status
 * @param startedAt    when the workflow was started
 * @param completedAt  when the workflow reached a terminal status, or {@code null}
 * @param errorMessage failure description, or {@code null}
 */
public record WorkflowState(
        String workflowId,
        String ticketId,
        String currentGraph,
        String currentState,
        WorkflowStatus status,
        Instant startedAt,
        Instant completedAt,
        String errorMessage
) {

    public WorkflowState {
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(ticketId, "ticketId");
        Objects.requireNonNull(status, "status");
    }

    public static WorkflowState started(String workflowId, String ticketId, String graph, Instant now) {
        return new WorkflowState(workflowId, ticketId, graph, "started",
                WorkflowStatus.RUNNING, now, null, null);
    }

    public WorkflowState withGraph(String graph) {
        return new WorkflowState(workflowId, ticketId, graph, "started",
                WorkflowStatus.RUNNING, startedAt, completedAt, errorMessage);
    }

    public WorkflowState withStatus(WorkflowStatus newStatus, String state) {
        return new WorkflowState(workflowId, ticketId, currentGraph, state,
                newStatus, startedAt, completedAt, errorMessage);
    }

    public WorkflowState completed(String state, Instant now) {
        return new WorkflowState(workflowId, ticketId, currentGraph, state,
                WorkflowStatus.COMPLETED, startedAt, now, null);
    }

    public WorkflowState failed(String state, String error, Instant now) {
        return new WorkflowState(workflowId, ticketId, currentGraph, state,
                WorkflowStatus.FAILED, startedAt, now, error);
    }

    public WorkflowState cancelled(Instant now) {
        return new WorkflowState(workflowId, ticketId, currentGraph, currentState,
                WorkflowStatus.CANCELLED, startedAt, now, errorMessage);
    }

    public Duration elapsed(Instant now) {
        return Duration.between(startedAt, completedAt != null ? completedAt : now);
    }
}
