package com.prfactory.core.engine;

import com.prfactory.core.model.WorkflowStatus;

/**
 * The workflow exists but its status does not allow the requested operation,
 * such as a decision for a workflow that is not suspended.
 */
public class InvalidWorkflowStateException extends RuntimeException {

    private final String ticketId;
    private final WorkflowStatus status;

    public InvalidWorkflowStateException(String ticketId, WorkflowStatus status, String message) {
        super(message);
        this.ticketId = ticketId;
        this.status = status;
    }

    public String getTicketId() {
        return ticketId;
    }

    public WorkflowStatus getStatus() {
        return status;
    }
}
