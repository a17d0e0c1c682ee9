package com.prfactory.core.graph;

import com.prfactory.core.agents.AgentExecutionException;
import com.prfactory.core.agents.AgentExecutor;
import com.prfactory.core.agents.AgentType;
import com.prfactory.core.config.WorkflowProperties;
import com.prfactory.core.events.EventPublisher;
import com.prfactory.core.messages.AgentMessage;
import com.prfactory.core.messages.AgentMessage.AnswersReceived;
import com.prfactory.core.messages.AgentMessage.QuestionsGenerated;
import com.prfactory.core.messages.AgentMessage.RefinementComplete;
import com.prfactory.core.messages.AgentMessage.TicketUpdateApproved;
import com.prfactory.core.messages.AgentMessage.TicketUpdateGenerated;
import com.prfactory.core.messages.AgentMessage.TicketUpdateRejected;
import com.prfactory.core.messages.AgentMessage.TriggerTicket;
import com.prfactory.core.metrics.WorkflowMetrics;
import com.prfactory.core.persistence.CheckpointStore;
import com.prfactory.core.state.RefinementState;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;

/**
 * Turns a raw ticket into an approved, refined ticket.
 * <p>
 * Topology:
 * <pre>
 *   trigger -> repository_clone -> analysis (retried) -> question_generation -> questions_post
 *       -> [awaiting_answers]
 *   AnswersReceived -> answer_processing -> ticket_update_generation
 *       -> [awaiting_ticket_update_approval]
 *   TicketUpdateApproved -> ticket_update_post -> refinement_complete
 *   TicketUpdateRejected -> ticket_update_generation -> [awaiting_ticket_update_approval]
 * </pre>
 */
@Component
public class RefinementGraph extends AbstractAgentGraph {

    public static final String GRAPH_ID = "RefinementGraph";

    public static final String AWAITING_ANSWERS = "awaiting_answers";
    public static final String AWAITING_TICKET_UPDATE_APPROVAL = "awaiting_ticket_update_approval";
    public static final String REFINEMENT_COMPLETE = "refinement_complete";
    public static final String ANALYSIS_FAILED = "analysis_failed";
    public static final String TICKET_UPDATE_FAILED = "ticket_update_failed";

    private final WorkflowProperties properties;
    private final WorkflowMetrics metrics;

    public RefinementGraph(CheckpointStore checkpointStore,
                           AgentExecutor agentExecutor,
                           EventPublisher events,
                           WorkflowMetrics metrics,
                           WorkflowProperties properties,
                           @Qualifier(GraphExecutorConfig.GRAPH_TASK_EXECUTOR) ExecutorService parallelExecutor) {
        super(checkpointStore, agentExecutor, events, parallelExecutor);
        this.metrics = metrics;
        this.properties = properties;
    }

    @Override
    public String graphId() {
        return GRAPH_ID;
    }

    @Override
    protected GraphExecutionResult onExecute(AgentMessage input, GraphContext context, Instant started) {
        if (!(input instanceof TriggerTicket trigger)) {
            return invalidInput(input, TriggerTicket.class);
        }
        context.put(RefinementState.TICKET_KEY, trigger.ticketKey());
        context.put(RefinementState.TENANT_ID, trigger.tenantId());
        context.put(RefinementState.REPOSITORY_ID, trigger.repositoryId());

        AgentMessage triggered = runStep(context, AgentType.TRIGGER, trigger, "trigger_complete");
        AgentMessage cloned = runStep(context, AgentType.REPOSITORY_CLONE, triggered, "clone_complete");
        AgentMessage analyzed = analyzeWithRetry(context, cloned);

        AgentMessage questions = runStep(context, AgentType.QUESTION_GENERATION, analyzed, "questions_generated");
        if (questions instanceof QuestionsGenerated generated) {
            context.put(RefinementState.QUESTION_COUNT, generated.questions().size());
        }
        runStep(context, AgentType.QUESTION_POST, questions, "questions_posted");

        return suspend(context, AWAITING_ANSWERS, "human_answers", questions);
    }

    @Override
    protected GraphExecutionResult onResume(String currentState, AgentMessage message,
                                            GraphContext context, Instant started) {
        if (AWAITING_ANSWERS.equals(currentState) && message instanceof AnswersReceived answers) {
            return processAnswers(context, answers);
        }
        if (AWAITING_TICKET_UPDATE_APPROVAL.equals(currentState)) {
            if (message instanceof TicketUpdateApproved approved) {
                return postTicketUpdate(context, approved, started);
            }
            if (message instanceof TicketUpdateRejected rejected) {
                return regenerateTicketUpdate(context, rejected);
            }
        }
        return unexpectedDecision(currentState, message);
    }

    // ── Analysis ─────────────────────────────────────────────────────────

    /**
     * Codebase analysis is the one step with an automatic retry policy. Every failed
     * attempt is checkpointed as {@code analysis_retry_<n>}.
     */
    private AgentMessage analyzeWithRetry(GraphContext context, AgentMessage cloned) {
        int maxAttempts = Math.max(1, properties.getAnalysisMaxAttempts());
        AgentExecutionException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                AgentMessage analyzed = agentExecutor.execute(AgentType.ANALYSIS, cloned,
                        context.forAgent(AgentType.ANALYSIS));
                saveCheckpoint(context, "analysis_complete", AgentType.ANALYSIS);
                return analyzed;
            } catch (AgentExecutionException e) {
                lastError = e;
                context.put(RefinementState.ANALYSIS_RETRY_COUNT, attempt);
                context.put(RefinementState.LAST_ANALYSIS_ERROR, e.getMessage());
                saveCheckpoint(context, "analysis_retry_" + attempt, AgentType.ANALYSIS);
                log.warn("Analysis attempt {}/{} failed for ticket {}: {}",
                        attempt, maxAttempts, context.ticketId(), e.getMessage());

                if (attempt < maxAttempts) {
                    backoff(context, attempt);
                }
            }
        }

        throw stepFailure(ANALYSIS_FAILED, "Codebase analysis failed after " + maxAttempts
                + " attempts: " + lastError.getMessage(), lastError);
    }

    private void backoff(GraphContext context, int attempt) {
        Duration base = properties.getAnalysisRetryBackoff();
        if (base == null || base.isZero() || base.isNegative()) {
            return;
        }
        try {
            Thread.sleep(base.toMillis() * (1L << (attempt - 1)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw stepFailure(ANALYSIS_FAILED, "Interrupted while waiting to retry analysis for ticket "
                    + context.ticketId(), e);
        }
    }

    // ── Resume paths ─────────────────────────────────────────────────────

    private GraphExecutionResult processAnswers(GraphContext context, AnswersReceived answers) {
        context.put(RefinementState.ANSWER_COUNT, answers.answers().size());
        AgentMessage processed = runStep(context, AgentType.ANSWER_PROCESSING, answers, "answers_processed");
        AgentMessage update = runStep(context, AgentType.TICKET_UPDATE_GENERATION, processed,
                "ticket_update_generated");
        recordTicketUpdate(context, update);
        context.put(RefinementState.TICKET_UPDATE_REJECTIONS, 0);
        return suspend(context, AWAITING_TICKET_UPDATE_APPROVAL, "ticket_update_approval", update);
    }

    private GraphExecutionResult postTicketUpdate(GraphContext context, TicketUpdateApproved approved,
                                                  Instant started) {
        context.put(RefinementState.APPROVED_BY, approved.approvedBy());
        runStep(context, AgentType.TICKET_UPDATE_POST, approved, "ticket_update_posted");
        return complete(context, REFINEMENT_COMPLETE,
                new RefinementComplete(context.ticketId(),
                        context.view(RefinementState::new).tenantId().orElse(null), Instant.now()), started);
    }

    private GraphExecutionResult regenerateTicketUpdate(GraphContext context, TicketUpdateRejected rejected) {
        int rejections = context.view(RefinementState::new).ticketUpdateRejections() + 1;
        int max = properties.getMaxTicketUpdateRejections();
        metrics.recordRejection(GRAPH_ID);

        context.put(RefinementState.TICKET_UPDATE_REJECTIONS, rejections);
        context.put(RefinementState.LAST_REJECTION_REASON, rejected.reason());

        if (rejections > max) {
            return fail(context, TICKET_UPDATE_FAILED, "Ticket update rejected " + rejections
                    + " times, exceeding the maximum of " + max, null);
        }

        log.info("Ticket update rejected ({}/{}) for ticket {}: {}", rejections, max,
                context.ticketId(), rejected.reason());
        AgentMessage update = runStep(context, AgentType.TICKET_UPDATE_GENERATION, rejected,
                "ticket_update_regenerated");
        recordTicketUpdate(context, update);
        return suspend(context, AWAITING_TICKET_UPDATE_APPROVAL, "ticket_update_approval", update);
    }

    private static void recordTicketUpdate(GraphContext context, AgentMessage update) {
        if (update instanceof TicketUpdateGenerated generated) {
            context.put(RefinementState.TICKET_UPDATE_ID, generated.ticketUpdateId());
            context.put(RefinementState.TICKET_UPDATE_VERSION, generated.version());
        }
    }
}
