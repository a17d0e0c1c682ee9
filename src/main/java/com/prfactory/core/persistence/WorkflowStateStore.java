package com.prfactory.core.persistence;

import com.prfactory.core.model.WorkflowState;
import com.prfactory.core.model.WorkflowStatus;

import java.util.Optional;

/**
 * Storage for orchestrator-owned {@link WorkflowState} records.
 * <p>
 * At most one non-terminal workflow exists per ticket, and terminal records
 * are never modified.
 */
public interface WorkflowStateStore {

    /**
     * Store a new workflow.
     *
     * @throws WorkflowConflictException if the ticket already has a non-terminal workflow
     */
    void create(WorkflowState state);

    /**
     * Replace an existing, non-terminal workflow record.
     *
     * @throws WorkflowTerminatedException if the workflow is already terminal
     */
    void save(WorkflowState state);

    /** Most recent workflow for the ticket, terminal or not. */
    Optional<WorkflowState> findByTicketId(String ticketId);

    /**
     * @throws WorkflowTerminatedException if the workflow is already terminal
     */
    void updateStatus(String workflowId, WorkflowStatus status, String errorMessage);

    /**
     * Atomically move a workflow from {@code expected} to {@code next}.
     *
     * @return {@code false} if the workflow was not in {@code expected}
     */
    boolean compareAndSetStatus(String workflowId, WorkflowStatus expected, WorkflowStatus next);
}
