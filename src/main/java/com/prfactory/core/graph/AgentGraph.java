package com.prfactory.core.graph;

import com.prfactory.core.messages.AgentMessage;

/**
 * A named, bounded sub-workflow of agent steps with optional suspension points.
 */
public interface AgentGraph {

    /** Unique id, also the checkpoint-store partition key. */
    String graphId();

    /**
     * Run the graph's entry sequence from the beginning.
     */
    GraphExecutionResult execute(AgentMessage initialMessage);

    /**
     * Continue from the graph's latest checkpoint with an external decision.
     * Returns a {@code resume_failed} failure when there is no checkpoint, the
     * checkpoint is not resumable, or the message is not what it expects.
     */
    GraphExecutionResult resume(String ticketId, AgentMessage decisionMessage);

    GraphStatus getStatus(String ticketId);
}
