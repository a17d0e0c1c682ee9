package com.prfactory.core.persistence;

import com.prfactory.core.model.WorkflowState;
import com.prfactory.core.model.WorkflowStatus;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local {@link WorkflowStateStore}. Keeps only the latest workflow per ticket.
 */
public class InMemoryWorkflowStateStore implements WorkflowStateStore {

    private final Map<String, WorkflowState> byTicket = new HashMap<>();
    private final Map<String, String> ticketByWorkflow = new HashMap<>();

    @Override
    public synchronized void create(WorkflowState state) {
        WorkflowState existing = byTicket.get(state.ticketId());
        if (existing != null && !existing.status().isTerminal()) {
            throw new WorkflowConflictException(state.ticketId());
        }
        byTicket.put(state.ticketId(), state);
        ticketByWorkflow.put(state.workflowId(), state.ticketId());
    }

    @Override
    public synchronized void save(WorkflowState state) {
        WorkflowState current = requireMutable(state.workflowId());
        if (!current.ticketId().equals(state.ticketId())) {
            throw new IllegalStateException("Workflow " + state.workflowId() + " belongs to another ticket");
        }
        byTicket.put(state.ticketId(), state);
    }

    @Override
    public synchronized Optional<WorkflowState> findByTicketId(String ticketId) {
        return Optional.ofNullable(byTicket.get(ticketId));
    }

    @Override
    public synchronized void updateStatus(String workflowId, WorkflowStatus status, String errorMessage) {
        WorkflowState current = requireMutable(workflowId);
        Instant completedAt = status.isTerminal() ? Instant.now() : current.completedAt();
        byTicket.put(current.ticketId(), new WorkflowState(current.workflowId(), current.ticketId(),
                current.currentGraph(), current.currentState(), status, current.startedAt(),
                completedAt, errorMessage != null ? errorMessage : current.errorMessage()));
    }

    @Override
    public synchronized boolean compareAndSetStatus(String workflowId, WorkflowStatus expected, WorkflowStatus next) {
        String ticketId = ticketByWorkflow.get(workflowId);
        WorkflowState current = ticketId == null ? null : byTicket.get(ticketId);
        if (current == null || !current.workflowId().equals(workflowId) || current.status() != expected) {
            return false;
        }
        byTicket.put(ticketId, current.withStatus(next, current.currentState()));
        return true;
    }

    private WorkflowState requireMutable(String workflowId) {
        String ticketId = ticketByWorkflow.get(workflowId);
        WorkflowState current = ticketId == null ? null : byTicket.get(ticketId);
        if (current == null || !current.workflowId().equals(workflowId)) {
            throw new IllegalStateException("Unknown workflow " + workflowId);
        }
        if (current.status().isTerminal()) {
            throw new WorkflowTerminatedException(workflowId, "Workflow " + workflowId + " is already " + current.status());
        }
        return current;
    }
}
