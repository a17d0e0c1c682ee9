package com.prfactory.core.persistence;

/**
 * Thrown when a workflow is started for a ticket that already has a non-terminal one.
 */
public class WorkflowConflictException extends RuntimeException {

    private final String ticketId;

    public WorkflowConflictException(String ticketId) {
        super("A workflow is already active for ticket " + ticketId);
        this.ticketId = ticketId;
    }

    public String getTicketId() {
        return ticketId;
    }
}
