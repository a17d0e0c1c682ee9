package com.prfactory.core.persistence;

/**
 * A write targeted a workflow record that is already terminal, typically because
 * the workflow was cancelled while a graph was running.
 */
public class WorkflowTerminatedException extends IllegalStateException {

    private final String workflowId;

    public WorkflowTerminatedException(String workflowId, String message) {
        super(message);
        this.workflowId = workflowId;
    }

    public String getWorkflowId() {
        return workflowId;
    }
}
