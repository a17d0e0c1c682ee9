package com.prfactory.core.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.prfactory.core.state.GraphState;

/**
 * Point-in-time view of a graph's progress for one ticket, derived from its checkpoint.
 */
public record GraphStatus(
        @JsonProperty("graph_id") String graphId,
        @JsonProperty("current_state") String currentState,
        @JsonProperty("current_agent") String currentAgent,
        @JsonProperty("is_running") boolean running,
        @JsonProperty("is_suspended") boolean suspended,
        @JsonProperty("is_completed") boolean completed,
        @JsonProperty("is_failed") boolean failed,
        @JsonProperty("waiting_for") String waitingFor,
        @JsonProperty("retry_count") int retryCount,
        @JsonProperty("last_checkpoint") String lastCheckpoint
) {

    public static GraphStatus notStarted(String graphId) {
        return new GraphStatus(graphId, GraphState.NOT_STARTED, null,
                false, false, false, false, null, 0, null);
    }

    public static GraphStatus of(String graphId, GraphState state) {
        return new GraphStatus(
                graphId,
                state.currentState(),
                state.currentAgent().orElse(null),
                state.isRunning(),
                state.isSuspended(),
                state.isCompleted(),
                state.isFailed(),
                state.waitingFor().orElse(null),
                state.retryCount(),
                state.lastCheckpoint().orElse(null));
    }
}
