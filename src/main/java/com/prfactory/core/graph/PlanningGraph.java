package com.prfactory.core.graph;

import com.prfactory.core.agents.AgentExecutionException;
import com.prfactory.core.agents.AgentExecutor;
import com.prfactory.core.agents.AgentType;
import com.prfactory.core.config.WorkflowProperties;
import com.prfactory.core.events.EventPublisher;
import com.prfactory.core.messages.AgentMessage;
import com.prfactory.core.messages.AgentMessage.FeedbackAnalyzed;
import com.prfactory.core.messages.AgentMessage.PlanApproved;
import com.prfactory.core.messages.AgentMessage.PlanApprovedEvent;
import com.prfactory.core.messages.AgentMessage.PlanArtifactGenerated;
import com.prfactory.core.messages.AgentMessage.PlanCommitted;
import com.prfactory.core.messages.AgentMessage.PlanRejected;
import com.prfactory.core.messages.AgentMessage.PlanStored;
import com.prfactory.core.messages.AgentMessage.RefinementComplete;
import com.prfactory.core.metrics.WorkflowMetrics;
import com.prfactory.core.model.PlanArtifact;
import com.prfactory.core.persistence.CheckpointStore;
import com.prfactory.core.state.PlanningState;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * Produces an implementation plan for a refined ticket and waits for its approval.
 * <p>
 * Topology:
 * <pre>
 *   user_stories -> api_design -> data_schema -> test_cases -> implementation_notes
 *       -> plan_storage -> (plan_commit || plan_post) -> [awaiting_approval]
 *   PlanApproved -> plan_approved
 *   PlanRejected -> feedback_analysis -> regenerate affected artifacts -> plan_storage
 *       -> (plan_commit || plan_post) -> [awaiting_re_review]
 * </pre>
 */
@Component
public class PlanningGraph extends AbstractAgentGraph {

    public static final String GRAPH_ID = "PlanningGraph";

    public static final String AWAITING_APPROVAL = "awaiting_approval";
    public static final String AWAITING_RE_REVIEW = "awaiting_re_review";
    public static final String PLAN_POSTED = "plan_posted";
    public static final String PLAN_APPROVED = "plan_approved";
    public static final String TOO_MANY_REJECTIONS = "too_many_rejections";

    private static final Set<String> REVIEWABLE_STATES = Set.of(AWAITING_APPROVAL, AWAITING_RE_REVIEW);

    private final WorkflowProperties properties;
    private final WorkflowMetrics metrics;

    public PlanningGraph(CheckpointStore checkpointStore,
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
        if (!(input instanceof RefinementComplete refined)) {
            return invalidInput(input, RefinementComplete.class);
        }
        context.put(PlanningState.TENANT_ID, refined.tenantId());

        AgentMessage generated = generateArtifacts(context, Arrays.asList(PlanArtifact.values()), input);
        AgentMessage published = storeAndPublish(context, generated);

        context.put(PlanningState.PLAN_RETRY_COUNT, 0);
        return suspend(context, AWAITING_APPROVAL, "plan_approval", published);
    }

    @Override
    protected GraphExecutionResult onResume(String currentState, AgentMessage message,
                                            GraphContext context, Instant started) {
        if (REVIEWABLE_STATES.contains(currentState)) {
            if (message instanceof PlanApproved approved) {
                return approve(context, approved, started);
            }
            if (message instanceof PlanRejected rejected) {
                return revise(context, rejected);
            }
        }
        return unexpectedDecision(currentState, message);
    }

    // ── Generation ───────────────────────────────────────────────────────

    /**
     * Generate the given artifacts in canonical order, each as its own checkpointed step.
     */
    private AgentMessage generateArtifacts(GraphContext context, List<PlanArtifact> artifacts, AgentMessage input) {
        Map<String, String> contents = context.view(PlanningState::new).planArtifacts();
        AgentMessage current = input;
        for (PlanArtifact artifact : PlanArtifact.values()) {
            if (!artifacts.contains(artifact)) {
                continue;
            }
            AgentType agent = agentFor(artifact);
            current = invoke(context, agent, current);
            if (current instanceof PlanArtifactGenerated generated && generated.content() != null) {
                contents.put(artifact.key(), generated.content());
                context.put(PlanningState.PLAN_ARTIFACTS, Map.copyOf(contents));
            }
            saveCheckpoint(context, artifact.key() + "_generated", agent);
        }
        return current;
    }

    /**
     * Store all artifacts, then commit and post the plan concurrently.
     */
    private AgentMessage storeAndPublish(GraphContext context, AgentMessage generated) {
        AgentMessage stored = runStep(context, AgentType.PLAN_STORAGE, generated, "plan_stored");
        if (stored instanceof PlanStored plan) {
            context.put(PlanningState.PLAN_ID, plan.planId());
            context.put(PlanningState.PLAN_VERSION, plan.version());
        }

        List<AgentMessage> outputs = runParallel(context,
                branch(AgentType.PLAN_COMMIT, stored),
                branch(AgentType.PLAN_POST, stored));

        AgentMessage commit = outputs.get(0);
        if (commit instanceof PlanCommitted committed) {
            context.put(PlanningState.BRANCH_NAME, committed.branchName());
            context.put(PlanningState.GIT_COMMIT_SHA, committed.commitSha());
        }
        context.put(PlanningState.ISSUE_TRACKER_POSTED, true);
        saveCheckpoint(context, PLAN_POSTED, AgentType.PLAN_POST);
        return commit;
    }

    static AgentType agentFor(PlanArtifact artifact) {
        return switch (artifact) {
            case USER_STORIES -> AgentType.USER_STORIES;
            case API_DESIGN -> AgentType.API_DESIGN;
            case DATA_SCHEMA -> AgentType.DATA_SCHEMA;
            case TEST_CASES -> AgentType.TEST_CASES;
            case IMPLEMENTATION_NOTES -> AgentType.IMPLEMENTATION_NOTES;
        };
    }

    // ── Review decisions ─────────────────────────────────────────────────

    private GraphExecutionResult approve(GraphContext context, PlanApproved approved, Instant started) {
        Instant approvedAt = approved.approvedAt() != null ? approved.approvedAt() : Instant.now();
        context.put(PlanningState.APPROVED_BY, approved.approvedBy());
        context.put(PlanningState.APPROVED_AT, approvedAt.toString());
        log.info("Plan approved by {} for ticket {}", approved.approvedBy(), context.ticketId());
        return complete(context, PLAN_APPROVED,
                new PlanApprovedEvent(context.ticketId(), context.view(PlanningState::new).tenantId().orElse(null),
                        approved.approvedBy(), approvedAt), started);
    }

    private GraphExecutionResult revise(GraphContext context, PlanRejected rejected) {
        int rejections = context.view(PlanningState::new).planRetryCount() + 1;
        int max = properties.getMaxPlanRejections();
        metrics.recordRejection(GRAPH_ID);

        context.put(PlanningState.PLAN_RETRY_COUNT, rejections);
        context.put(PlanningState.REVISION_FEEDBACK, rejected.reason());
        context.put(PlanningState.REFINEMENT_INSTRUCTIONS, rejected.refinementInstructions());
        context.put(PlanningState.REGENERATE_COMPLETELY, rejected.regenerateCompletely());

        if (rejections > max) {
            return fail(context, TOO_MANY_REJECTIONS, "Plan rejected " + rejections
                    + " times, exceeding the maximum of " + max, null);
        }

        log.info("Plan rejected ({}/{}) for ticket {}: {}", rejections, max, context.ticketId(), rejected.reason());
        saveCheckpoint(context, "plan_rejected", null);

        List<PlanArtifact> analyzed = analyzeFeedback(context, rejected);
        List<PlanArtifact> affected = rejected.regenerateCompletely()
                ? Arrays.asList(PlanArtifact.values())
                : analyzed;
        context.put(PlanningState.AFFECTED_ARTIFACTS, affected.stream().map(PlanArtifact::key).toList());

        AgentMessage regenerated = generateArtifacts(context, affected, rejected);
        AgentMessage published = storeAndPublish(context, regenerated);
        return suspend(context, AWAITING_RE_REVIEW, "plan_approval", published);
    }

    /**
     * Ask which artifacts the feedback touches. Analysis is advisory: when it fails
     * or names nothing, every artifact is regenerated.
     */
    private List<PlanArtifact> analyzeFeedback(GraphContext context, PlanRejected rejected) {
        try {
            AgentMessage output = agentExecutor.execute(AgentType.FEEDBACK_ANALYSIS, rejected,
                    context.forAgent(AgentType.FEEDBACK_ANALYSIS));
            saveCheckpoint(context, "feedback_analyzed", AgentType.FEEDBACK_ANALYSIS);
            if (output instanceof FeedbackAnalyzed analyzed && !analyzed.affectedArtifacts().isEmpty()) {
                return analyzed.affectedArtifacts();
            }
            log.info("Feedback analysis named no artifacts for ticket {}; regenerating all", context.ticketId());
        } catch (AgentExecutionException e) {
            log.warn("Feedback analysis failed for ticket {}; regenerating all artifacts: {}",
                    context.ticketId(), e.getMessage());
        }
        return Arrays.asList(PlanArtifact.values());
    }
}
