package com.prfactory.core.graph;

import com.prfactory.core.agents.AgentExecutionException;
import com.prfactory.core.agents.AgentExecutor;
import com.prfactory.core.agents.AgentType;
import com.prfactory.core.events.EventPublisher;
import com.prfactory.core.events.WorkflowEvent;
import com.prfactory.core.logging.MdcContext;
import com.prfactory.core.messages.AgentMessage;
import com.prfactory.core.model.Checkpoint;
import com.prfactory.core.persistence.CheckpointStore;
import com.prfactory.core.state.GraphState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Step discipline shared by the concrete graphs.
 * <p>
 * Every step runs one agent and immediately saves a checkpoint named after the step,
 * so each step boundary is a crash-recovery point. A failing step aborts the
 * invocation with {@code <step>_failed}. Parallel fan-out waits for every branch and
 * then fails on the first failed branch in declaration order.
 * <p>
 * Expected business outcomes come back as {@link GraphExecutionResult}s. Anything
 * else, such as a checkpoint store outage, propagates to the caller.
 */
public abstract class AbstractAgentGraph implements AgentGraph {

    public static final String RESUME_FAILED = "resume_failed";
    public static final String INVALID_INPUT = "invalid_input";

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final CheckpointStore checkpointStore;
    protected final AgentExecutor agentExecutor;
    protected final EventPublisher events;
    private final ExecutorService parallelExecutor;

    protected AbstractAgentGraph(CheckpointStore checkpointStore, AgentExecutor agentExecutor,
                                 EventPublisher events, ExecutorService parallelExecutor) {
        this.checkpointStore = checkpointStore;
        this.agentExecutor = agentExecutor;
        this.events = events;
        this.parallelExecutor = parallelExecutor;
    }

    @Override
    public final GraphExecutionResult execute(AgentMessage initialMessage) {
        MdcContext.setGraph(initialMessage.ticketId(), graphId());
        Instant started = Instant.now();
        GraphContext context = GraphContext.fresh(initialMessage.ticketId(), graphId());
        log.info("Executing {} for ticket {}", graphId(), initialMessage.ticketId());
        try {
            return onExecute(initialMessage, context, started);
        } catch (StepFailedException e) {
            return fail(context, e.failedState(), e.getMessage(), e.getCause());
        } finally {
            MdcContext.clearGraph();
        }
    }

    @Override
    public final GraphExecutionResult resume(String ticketId, AgentMessage decisionMessage) {
        MdcContext.setGraph(ticketId, graphId());
        Instant started = Instant.now();
        try {
            Optional<Checkpoint> checkpoint = checkpointStore.loadLatest(ticketId, graphId());
            if (checkpoint.isEmpty()) {
                return resumeFailed("No checkpoint found for ticket " + ticketId + " in " + graphId());
            }
            if (!ticketId.equals(decisionMessage.ticketId())) {
                return resumeFailed("Message for ticket " + decisionMessage.ticketId()
                        + " cannot resume ticket " + ticketId);
            }

            GraphContext context = GraphContext.fromCheckpoint(checkpoint.get());
            String currentState = context.view(GraphState::new).currentState();
            log.info("Resuming {} for ticket {} from '{}' with {}", graphId(), ticketId,
                    currentState, decisionMessage.getClass().getSimpleName());
            try {
                return onResume(currentState, decisionMessage, context, started);
            } catch (StepFailedException e) {
                return fail(context, e.failedState(), e.getMessage(), e.getCause());
            }
        } finally {
            MdcContext.clearGraph();
        }
    }

    @Override
    public GraphStatus getStatus(String ticketId) {
        return checkpointStore.loadLatest(ticketId, graphId())
                .map(cp -> GraphStatus.of(graphId(), new GraphState(cp.state())))
                .orElseGet(() -> GraphStatus.notStarted(graphId()));
    }

    protected abstract GraphExecutionResult onExecute(AgentMessage input, GraphContext context, Instant started);

    protected abstract GraphExecutionResult onResume(String currentState, AgentMessage message,
                                                     GraphContext context, Instant started);

    // ── Steps ────────────────────────────────────────────────────────────

    /**
     * Run one agent and checkpoint the result under {@code checkpointName}.
     */
    protected AgentMessage runStep(GraphContext context, AgentType agent, AgentMessage input, String checkpointName) {
        AgentMessage output = invoke(context, agent, input);
        saveCheckpoint(context, checkpointName, agent);
        return output;
    }

    /**
     * Run one agent without checkpointing. Agent failures abort the invocation.
     */
    protected AgentMessage invoke(GraphContext context, AgentType agent, AgentMessage input) {
        try {
            return agentExecutor.execute(agent, input, context.forAgent(agent));
        } catch (AgentExecutionException e) {
            throw new StepFailedException(agent.failedState(), e.getMessage(), e);
        }
    }

    /**
     * Run the branches concurrently and wait for all of them.
     *
     * @return outputs in branch order
     */
    protected List<AgentMessage> runParallel(GraphContext context, Branch... branches) {
        List<CompletableFuture<AgentMessage>> futures = new ArrayList<>();
        for (Branch branch : branches) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                MdcContext.setGraph(context.ticketId(), graphId());
                try {
                    return agentExecutor.execute(branch.agent(), branch.input(), context.forAgent(branch.agent()));
                } finally {
                    MdcContext.clear();
                }
            }, parallelExecutor));
        }

        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                .handle((ignored, error) -> null)
                .join();

        List<AgentMessage> outputs = new ArrayList<>();
        for (int i = 0; i < branches.length; i++) {
            try {
                outputs.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof AgentExecutionException agentFailure) {
                    throw new StepFailedException(branches[i].agent().failedState(),
                            agentFailure.getMessage(), agentFailure);
                }
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("Parallel branch " + branches[i].agent() + " failed", cause);
            }
        }
        return outputs;
    }

    protected static Branch branch(AgentType agent, AgentMessage input) {
        return new Branch(agent, input);
    }

    protected record Branch(AgentType agent, AgentMessage input) {
    }

    /**
     * Abort the invocation with {@code failedState} unless {@code output} has the expected type.
     */
    protected static <T extends AgentMessage> T expect(AgentMessage output, Class<T> type, AgentType agent) {
        if (type.isInstance(output)) {
            return type.cast(output);
        }
        throw new StepFailedException(agent.failedState(), "Agent " + agent + " returned "
                + output.getClass().getSimpleName() + ", expected " + type.getSimpleName(), null);
    }

    protected static StepFailedException stepFailure(String failedState, String message, Throwable cause) {
        return new StepFailedException(failedState, message, cause);
    }

    // ── Checkpoints and results ─────────────────────────────────────────

    protected void saveCheckpoint(GraphContext context, String name, AgentType agent) {
        context.put(GraphState.IS_SUSPENDED, false);
        context.remove(GraphState.WAITING_FOR);
        store(context, name, agent);
    }

    protected GraphExecutionResult suspend(GraphContext context, String name, String waitingFor, AgentMessage output) {
        context.put(GraphState.IS_SUSPENDED, true);
        context.put(GraphState.WAITING_FOR, waitingFor);
        store(context, name, null);
        log.info("{} suspended at '{}' waiting for {}", graphId(), name, waitingFor);
        return new GraphExecutionResult.Suspended(name, output);
    }

    protected GraphExecutionResult complete(GraphContext context, String name, AgentMessage event, Instant started) {
        context.put(GraphState.IS_COMPLETED, true);
        context.put(GraphState.IS_SUSPENDED, false);
        context.remove(GraphState.WAITING_FOR);
        store(context, name, null);
        Duration duration = Duration.between(started, Instant.now());
        log.info("{} completed at '{}' in {}ms", graphId(), name, duration.toMillis());
        return new GraphExecutionResult.Success(name, event, duration);
    }

    protected GraphExecutionResult fail(GraphContext context, String failedState, String error, Throwable cause) {
        context.put(GraphState.IS_FAILED, true);
        context.put(GraphState.IS_SUSPENDED, false);
        context.remove(GraphState.WAITING_FOR);
        context.put(GraphState.ERROR, error);
        store(context, failedState, null);
        log.error("{} failed at '{}': {}", graphId(), failedState, error);
        return new GraphExecutionResult.Failure(failedState, error, cause);
    }

    /**
     * Protocol violation on resume. The stored continuation is left untouched.
     */
    protected GraphExecutionResult resumeFailed(String reason) {
        log.warn("{} cannot resume: {}", graphId(), reason);
        return new GraphExecutionResult.Failure(RESUME_FAILED, reason);
    }

    protected GraphExecutionResult unexpectedDecision(String currentState, AgentMessage message) {
        return resumeFailed("State '" + currentState + "' does not accept "
                + message.getClass().getSimpleName());
    }

    protected GraphExecutionResult invalidInput(AgentMessage input, Class<? extends AgentMessage> expected) {
        log.warn("{} cannot start from {}", graphId(), input.getClass().getSimpleName());
        return new GraphExecutionResult.Failure(INVALID_INPUT, graphId() + " expects "
                + expected.getSimpleName() + " but got " + input.getClass().getSimpleName());
    }

    private void store(GraphContext context, String name, AgentType agent) {
        context.put(GraphState.CURRENT_STATE, name);
        context.put(GraphState.CURRENT_AGENT, agent != null ? agent.name() : null);
        context.put(GraphState.LAST_CHECKPOINT, Instant.now().toString());
        checkpointStore.saveCheckpoint(context.ticketId(), graphId(), name, context.snapshot());
        events.publish(new WorkflowEvent.CheckpointSaved(context.ticketId(), graphId(), name, Instant.now()));
    }
}
