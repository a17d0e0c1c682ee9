package com.prfactory.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.prfactory.core.model.WorkflowState;

/**
 * JSON response for workflow endpoints.
 */
public record WorkflowResponse(
    @JsonProperty("workflow_id") String workflowId,
    @JsonProperty("ticket_id") String ticketId,
    @JsonProperty("current_graph") String currentGraph,
    @JsonProperty("current_state") String currentState,
    String status,
    @JsonProperty("started_at") String startedAt,
    @JsonProperty("completed_at") String completedAt,
    String error
) {

    public static WorkflowResponse from(WorkflowState state) {
        return new WorkflowResponse(
                state.workflowId(),
                state.ticketId(),
                state.currentGraph(),
                state.currentState(),
                state.status().name(),
                state.startedAt() != null ? state.startedAt().toString() : null,
                state.completedAt() != null ? state.completedAt().toString() : null,
                state.errorMessage());
    }
}
