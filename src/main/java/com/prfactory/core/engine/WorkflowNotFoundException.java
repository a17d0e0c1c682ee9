package com.prfactory.core.engine;

/**
 * No workflow exists for the requested ticket.
 */
public class WorkflowNotFoundException extends RuntimeException {

    private final String ticketId;

    public WorkflowNotFoundException(String ticketId) {
        super("No workflow found for ticket " + ticketId);
        this.ticketId = ticketId;
    }

    public String getTicketId() {
        return ticketId;
    }
}
