package com.prfactory.core.engine;

import com.prfactory.core.events.EventPublisher;
import com.prfactory.core.events.WorkflowEvent;
import com.prfactory.core.graph.AgentGraph;
import com.prfactory.core.graph.GraphExecutionResult;
import com.prfactory.core.graph.GraphStatus;
import com.prfactory.core.graph.ImplementationGraph;
import com.prfactory.core.graph.PlanningGraph;
import com.prfactory.core.graph.RefinementGraph;
import com.prfactory.core.logging.MdcContext;
import com.prfactory.core.messages.AgentMessage;
import com.prfactory.core.messages.AgentMessage.CompletionEvent;
import com.prfactory.core.messages.AgentMessage.TriggerTicket;
import com.prfactory.core.metrics.WorkflowMetrics;
import com.prfactory.core.model.WorkflowState;
import com.prfactory.core.model.WorkflowStatus;
import com.prfactory.core.persistence.WorkflowStateStore;
import com.prfactory.core.persistence.WorkflowTerminatedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Top-level coordinator that drives a ticket through the refinement, planning and
 * implementation graphs.
 * <p>
 * After every graph call the result is applied uniformly: a failure marks the workflow
 * Failed, a suspension parks it, and a success hands the completion event to the next
 * graph in the same call. Chaining runs as a loop over (current graph, current result),
 * so one {@link #startWorkflow} or {@link #resumeWorkflow} call may cross several graphs
 * and only returns at a suspension, a failure or final completion.
 * <p>
 * Exceptions escaping a graph mark the workflow Failed before they are rethrown.
 */
@Service
public class WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    private final RefinementGraph refinementGraph;
    private final PlanningGraph planningGraph;
    private final ImplementationGraph implementationGraph;
    private final WorkflowStateStore stateStore;
    private final EventPublisher events;
    private final WorkflowMetrics metrics;

    public WorkflowOrchestrator(RefinementGraph refinementGraph,
                                PlanningGraph planningGraph,
                                ImplementationGraph implementationGraph,
                                WorkflowStateStore stateStore,
                                EventPublisher events,
                                WorkflowMetrics metrics) {
        this.refinementGraph = refinementGraph;
        this.planningGraph = planningGraph;
        this.implementationGraph = implementationGraph;
        this.stateStore = stateStore;
        this.events = events;
        this.metrics = metrics;
    }

    /**
     * Start a workflow for the ticket named by {@code trigger}.
     *
     * @return the new workflow id
     * @throws com.prfactory.core.persistence.WorkflowConflictException if the ticket
     *         already has a running or suspended workflow
     */
    public String startWorkflow(TriggerTicket trigger) {
        String ticketId = trigger.ticketId();
        MdcContext.setTicket(ticketId);
        try {
            var state = WorkflowState.started(UUID.randomUUID().toString(), ticketId,
                    RefinementGraph.GRAPH_ID, Instant.now());
            stateStore.create(state);

            log.info("Starting workflow {} for ticket {} ({})", state.workflowId(), ticketId, trigger.ticketKey());
            metrics.recordWorkflow("started");
            events.publish(new WorkflowEvent.WorkflowStarted(ticketId, state.workflowId(),
                    RefinementGraph.GRAPH_ID, Instant.now()));

            try {
                drive(state, refinementGraph.execute(trigger));
            } catch (RuntimeException e) {
                markFailed(ticketId, e);
                throw e;
            }
            return state.workflowId();
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Deliver a human decision to the ticket's suspended graph.
     *
     * @return the workflow state after the decision has been processed
     * @throws WorkflowNotFoundException if the ticket has no workflow
     * @throws InvalidWorkflowStateException if the workflow is not suspended
     */
    public WorkflowState resumeWorkflow(String ticketId, AgentMessage decision) {
        MdcContext.setTicket(ticketId);
        try {
            WorkflowState state = stateStore.findByTicketId(ticketId)
                    .orElseThrow(() -> new WorkflowNotFoundException(ticketId));
            if (state.status() != WorkflowStatus.SUSPENDED
                    || !stateStore.compareAndSetStatus(state.workflowId(), WorkflowStatus.SUSPENDED, WorkflowStatus.RUNNING)) {
                throw new InvalidWorkflowStateException(ticketId, state.status(), "Workflow " + state.workflowId()
                        + " is not in suspended state (current: " + state.status() + ")");
            }

            log.info("Resuming workflow {} in {} at '{}' with {}", state.workflowId(), state.currentGraph(),
                    state.currentState(), decision.getClass().getSimpleName());
            WorkflowState running = state.withStatus(WorkflowStatus.RUNNING, state.currentState());
            try {
                AgentGraph graph = graphNamed(state.currentGraph());
                return drive(running, graph.resume(ticketId, decision));
            } catch (RuntimeException e) {
                markFailed(ticketId, e);
                throw e;
            }
        } finally {
            MdcContext.clear();
        }
    }

    public WorkflowStatus getWorkflowStatus(String ticketId) {
        return stateStore.findByTicketId(ticketId)
                .map(WorkflowState::status)
                .orElse(WorkflowStatus.NOT_FOUND);
    }

    public Optional<WorkflowState> findWorkflow(String ticketId) {
        return stateStore.findByTicketId(ticketId);
    }

    /**
     * Mark the workflow Cancelled. An in-flight step is not interrupted, but its
     * result is discarded and later decisions are rejected.
     *
     * @throws WorkflowNotFoundException if the ticket has no workflow
     * @throws InvalidWorkflowStateException if the workflow already finished
     */
    public void cancelWorkflow(String ticketId) {
        MdcContext.setTicket(ticketId);
        try {
            WorkflowState state = stateStore.findByTicketId(ticketId)
                    .orElseThrow(() -> new WorkflowNotFoundException(ticketId));
            if (state.status().isTerminal()) {
                throw new InvalidWorkflowStateException(ticketId, state.status(),
                        "Workflow " + state.workflowId() + " is already " + state.status());
            }
            stateStore.updateStatus(state.workflowId(), WorkflowStatus.CANCELLED, null);
            log.info("Cancelled workflow {} for ticket {}", state.workflowId(), ticketId);
            metrics.recordWorkflow("cancelled");
            events.publish(new WorkflowEvent.WorkflowCancelled(ticketId, state.workflowId(), Instant.now()));
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Status of every graph for the ticket, derived from their checkpoints.
     */
    public List<GraphStatus> graphStatuses(String ticketId) {
        return List.of(
                refinementGraph.getStatus(ticketId),
                planningGraph.getStatus(ticketId),
                implementationGraph.getStatus(ticketId));
    }

    // ── Result handling ──────────────────────────────────────────────────

    /**
     * A cancel can land between the cancellation check and the next state write. The
     * store then refuses the write, and the result is discarded like any other result
     * that arrives after a cancel.
     */
    private WorkflowState drive(WorkflowState initial, GraphExecutionResult initialResult) {
        try {
            return applyResults(initial, initialResult);
        } catch (WorkflowTerminatedException e) {
            if (!isCancelled(initial)) {
                throw e;
            }
            log.info("Workflow {} was cancelled before its result could be stored; discarding it",
                    initial.workflowId());
            return stateStore.findByTicketId(initial.ticketId()).orElse(initial);
        }
    }

    private WorkflowState applyResults(WorkflowState initial, GraphExecutionResult initialResult) {
        WorkflowState state = initial;
        GraphExecutionResult result = initialResult;

        while (true) {
            metrics.recordGraphResult(state.currentGraph(), outcomeOf(result));
            if (isCancelled(state)) {
                log.info("Workflow {} was cancelled while {} ran; discarding its '{}' result",
                        state.workflowId(), state.currentGraph(), result.state());
                return stateStore.findByTicketId(state.ticketId()).orElse(state);
            }

            if (result instanceof GraphExecutionResult.Failure failure) {
                return failed(state, failure);
            }
            if (result instanceof GraphExecutionResult.Suspended suspended) {
                return suspended(state, suspended);
            }
            if (!(result instanceof GraphExecutionResult.Success success)) {
                throw new IllegalStateException("Unhandled graph result " + result);
            }
            if (!(success.outputMessage() instanceof CompletionEvent event)) {
                result = new GraphExecutionResult.Failure("unexpected_output", state.currentGraph()
                        + " completed with " + describe(success.outputMessage()) + " instead of a completion event");
                continue;
            }

            Optional<AgentGraph> next = switch (event.kind()) {
                case REFINEMENT_COMPLETE -> Optional.of(planningGraph);
                case PLAN_APPROVED -> Optional.of(implementationGraph);
                case PULL_REQUEST_CREATED, IMPLEMENTATION_SKIPPED -> Optional.empty();
            };
            if (next.isEmpty()) {
                return completed(state, success);
            }

            AgentGraph nextGraph = next.get();
            String fromGraph = state.currentGraph();
            state = state.withGraph(nextGraph.graphId());
            stateStore.save(state);
            log.info("Workflow {} moving from {} to {}", state.workflowId(), fromGraph, nextGraph.graphId());
            events.publish(new WorkflowEvent.GraphTransitioned(state.ticketId(), state.workflowId(),
                    fromGraph, nextGraph.graphId(), Instant.now()));

            result = nextGraph.execute(event);
        }
    }

    private WorkflowState failed(WorkflowState state, GraphExecutionResult.Failure failure) {
        WorkflowState failed = state.failed(failure.state(), failure.error(), Instant.now());
        stateStore.save(failed);
        log.error("Workflow {} failed in {} at '{}': {}", state.workflowId(), state.currentGraph(),
                failure.state(), failure.error());
        metrics.recordWorkflow("failed");
        events.publish(new WorkflowEvent.WorkflowFailed(state.ticketId(), state.currentGraph(),
                failure.error(), Instant.now()));
        return failed;
    }

    private WorkflowState suspended(WorkflowState state, GraphExecutionResult.Suspended suspended) {
        WorkflowState parked = state.withStatus(WorkflowStatus.SUSPENDED, suspended.state());
        stateStore.save(parked);
        log.info("Workflow {} suspended in {} at '{}'", state.workflowId(), state.currentGraph(), suspended.state());
        events.publish(new WorkflowEvent.WorkflowSuspended(state.ticketId(), state.currentGraph(),
                suspended.state(), Instant.now()));
        return parked;
    }

    private WorkflowState completed(WorkflowState state, GraphExecutionResult.Success success) {
        Instant now = Instant.now();
        WorkflowState done = state.completed(success.state(), now);
        stateStore.save(done);
        Duration duration = done.elapsed(now);
        log.info("Workflow {} completed at '{}' in {}ms", state.workflowId(), success.state(), duration.toMillis());
        metrics.recordWorkflow("completed");
        metrics.recordWorkflowDuration(duration);
        events.publish(new WorkflowEvent.WorkflowCompleted(state.ticketId(), state.workflowId(), duration, now));
        return done;
    }

    /**
     * Reflect an unexpected exception in the workflow state. Failures while doing so
     * are attached to the original exception.
     */
    private void markFailed(String ticketId, RuntimeException error) {
        try {
            Optional<WorkflowState> current = stateStore.findByTicketId(ticketId);
            if (current.isEmpty() || current.get().status().isTerminal()) {
                return;
            }
            WorkflowState state = current.get();
            String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
            stateStore.updateStatus(state.workflowId(), WorkflowStatus.FAILED, message);
            log.error("Workflow {} failed unexpectedly in {}", state.workflowId(), state.currentGraph(), error);
            metrics.recordWorkflow("failed");
            events.publish(new WorkflowEvent.WorkflowFailed(ticketId, state.currentGraph(), message, Instant.now()));
        } catch (RuntimeException suppressed) {
            error.addSuppressed(suppressed);
        }
    }

    private AgentGraph graphNamed(String graphId) {
        return switch (graphId) {
            case RefinementGraph.GRAPH_ID -> refinementGraph;
            case PlanningGraph.GRAPH_ID -> planningGraph;
            case ImplementationGraph.GRAPH_ID -> implementationGraph;
            default -> throw new IllegalStateException("Unknown graph: " + graphId);
        };
    }

    private boolean isCancelled(WorkflowState state) {
        return stateStore.findByTicketId(state.ticketId())
                .filter(current -> current.workflowId().equals(state.workflowId()))
                .map(current -> current.status() == WorkflowStatus.CANCELLED)
                .orElse(false);
    }

    private static String outcomeOf(GraphExecutionResult result) {
        if (result instanceof GraphExecutionResult.Suspended) {
            return "suspended";
        }
        return result.isSuccess() ? "success" : "failure";
    }

    private static String describe(AgentMessage message) {
        return message == null ? "no output" : message.getClass().getSimpleName();
    }
}
