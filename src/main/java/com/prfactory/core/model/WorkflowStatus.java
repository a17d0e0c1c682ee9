package com.prfactory.core.model;

/**
 * Lifecycle status of a ticket's orchestration run.
 */
public enum WorkflowStatus {
    RUNNING,
    SUSPENDED,
    COMPLETED,
    FAILED,
    CANCELLED,
    NOT_FOUND;

    /**
     * Terminal workflows are never mutated again.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
