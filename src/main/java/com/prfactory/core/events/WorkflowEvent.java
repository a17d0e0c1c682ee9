package com.prfactory.core.events;

import java.time.Duration;
import java.time.Instant;

/**
 * Lifecycle events published by the orchestrator and the graphs.
 */
public sealed interface WorkflowEvent {

    String ticketId();

    Instant timestamp();

    /** Dotted event name used in logs and the audit trail. */
    String eventType();

    /** Graph the event relates to, or {@code null} for workflow-wide events. */
    default String graphId() {
        return null;
    }

    /** Short human-readable description. */
    String describe();

    /**
     * Events after which the workflow publishes nothing more. A later workflow for
     * the same ticket starts over with {@link WorkflowStarted}.
     */
    sealed interface Terminal extends WorkflowEvent {
    }

    record WorkflowStarted(String ticketId, String workflowId, String graphId, Instant timestamp)
            implements WorkflowEvent {
        @Override
        public String eventType() {
            return "workflow.started";
        }

        @Override
        public String describe() {
            return "Workflow " + workflowId + " started in " + graphId;
        }
    }

    record GraphTransitioned(String ticketId, String workflowId, String fromGraph, String graphId,
                             Instant timestamp) implements WorkflowEvent {
        @Override
        public String eventType() {
            return "workflow.graph_transitioned";
        }

        @Override
        public String describe() {
            return fromGraph + " -> " + graphId;
        }
    }

    record CheckpointSaved(String ticketId, String graphId, String checkpointId, Instant timestamp)
            implements WorkflowEvent {
        @Override
        public String eventType() {
            return "checkpoint.saved";
        }

        @Override
        public String describe() {
            return "Checkpoint " + checkpointId;
        }
    }

    record WorkflowSuspended(String ticketId, String graphId, String state, Instant timestamp)
            implements WorkflowEvent {
        @Override
        public String eventType() {
            return "workflow.suspended";
        }

        @Override
        public String describe() {
            return "Suspended at " + state;
        }
    }

    record WorkflowFailed(String ticketId, String graphId, String error, Instant timestamp)
            implements Terminal {
        @Override
        public String eventType() {
            return "workflow.failed";
        }

        @Override
        public String describe() {
            return "Failed: " + error;
        }
    }

    record WorkflowCompleted(String ticketId, String workflowId, Duration duration, Instant timestamp)
            implements Terminal {
        @Override
        public String eventType() {
            return "workflow.completed";
        }

        @Override
        public String describe() {
            return "Completed in " + duration.toMillis() + "ms";
        }
    }

    record WorkflowCancelled(String ticketId, String workflowId, Instant timestamp)
            implements Terminal {
        @Override
        public String eventType() {
            return "workflow.cancelled";
        }

        @Override
        public String describe() {
            return "Workflow " + workflowId + " cancelled";
        }
    }
}
