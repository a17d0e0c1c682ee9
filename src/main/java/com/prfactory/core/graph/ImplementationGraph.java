package com.prfactory.core.graph;

import com.prfactory.core.agents.AgentExecutor;
import com.prfactory.core.agents.AgentType;
import com.prfactory.core.events.EventPublisher;
import com.prfactory.core.messages.AgentMessage;
import com.prfactory.core.messages.AgentMessage.CodeCommitted;
import com.prfactory.core.messages.AgentMessage.CodeReviewed;
import com.prfactory.core.messages.AgentMessage.FixCodeIssues;
import com.prfactory.core.messages.AgentMessage.ImplementationSkipped;
import com.prfactory.core.messages.AgentMessage.PlanApprovedEvent;
import com.prfactory.core.messages.AgentMessage.PullRequestCreated;
import com.prfactory.core.messages.AgentMessage.PullRequestOpened;
import com.prfactory.core.model.ReviewOutcome;
import com.prfactory.core.model.TenantConfiguration;
import com.prfactory.core.persistence.CheckpointStore;
import com.prfactory.core.state.ImplementationState;
import com.prfactory.core.tenant.TenantConfigurationService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Implements an approved plan and opens a pull request.
 * <p>
 * Topology:
 * <pre>
 *   [tenant auto-implementation off] -> skipped
 *   implementation -> code_commit -> (pull_request || implementation_post) -> pr_created
 *       -> [auto review on] code_review
 *            clean            -> (approval_comment_post) -> completed
 *            blocking issues  -> review_comment_post -> implementation -> code_commit -> code_review ...
 *            iteration cap    -> completed_with_warnings
 * </pre>
 * The graph has no suspension points.
 */
@Component
public class ImplementationGraph extends AbstractAgentGraph {

    public static final String GRAPH_ID = "ImplementationGraph";

    public static final String SKIPPED = "skipped";
    public static final String PR_CREATED = "pr_created";
    public static final String COMPLETED = "completed";
    public static final String COMPLETED_WITH_WARNINGS = "completed_with_warnings";
    public static final String AUTO_IMPLEMENTATION_DISABLED = "auto_implementation_disabled";

    private final TenantConfigurationService tenantConfigurationService;

    public ImplementationGraph(CheckpointStore checkpointStore,
                               AgentExecutor agentExecutor,
                               EventPublisher events,
                               TenantConfigurationService tenantConfigurationService,
                               @Qualifier(GraphExecutorConfig.GRAPH_TASK_EXECUTOR) ExecutorService parallelExecutor) {
        super(checkpointStore, agentExecutor, events, parallelExecutor);
        this.tenantConfigurationService = tenantConfigurationService;
    }

    @Override
    public String graphId() {
        return GRAPH_ID;
    }

    @Override
    protected GraphExecutionResult onExecute(AgentMessage input, GraphContext context, Instant started) {
        if (!(input instanceof PlanApprovedEvent approved)) {
            return invalidInput(input, PlanApprovedEvent.class);
        }

        context.put(ImplementationState.TENANT_ID, approved.tenantId());
        TenantConfiguration tenant = tenantConfiguration(context.ticketId(), approved.tenantId());
        if (!tenant.autoImplementAfterPlanApproval()) {
            log.info("Auto-implementation disabled for ticket {}; skipping", context.ticketId());
            context.put(ImplementationState.SKIPPED, true);
            context.put(ImplementationState.SKIP_REASON, AUTO_IMPLEMENTATION_DISABLED);
            return complete(context, SKIPPED,
                    new ImplementationSkipped(context.ticketId(), AUTO_IMPLEMENTATION_DISABLED), started);
        }

        AgentMessage implemented = runStep(context, AgentType.IMPLEMENTATION, approved, "code_implemented");
        AgentMessage committed = commit(context, implemented, "code_committed");

        List<AgentMessage> outputs = runParallel(context,
                branch(AgentType.PULL_REQUEST, committed),
                branch(AgentType.IMPLEMENTATION_POST, committed));
        PullRequestOpened pullRequest = expect(outputs.get(0), PullRequestOpened.class, AgentType.PULL_REQUEST);
        context.put(ImplementationState.PR_NUMBER, pullRequest.number());
        context.put(ImplementationState.PR_URL, pullRequest.url());
        context.put(ImplementationState.ISSUE_TRACKER_POSTED, true);
        saveCheckpoint(context, PR_CREATED, AgentType.PULL_REQUEST);

        ReviewOutcome outcome = tenant.enableAutoCodeReview()
                ? reviewLoop(context, tenant, committed)
                : ReviewOutcome.NOT_REVIEWED;
        context.put(ImplementationState.REVIEW_OUTCOME, outcome.name());

        String finalState = outcome == ReviewOutcome.COMPLETED_WITH_WARNINGS ? COMPLETED_WITH_WARNINGS : COMPLETED;
        return complete(context, finalState, new PullRequestCreated(context.ticketId(),
                pullRequest.number(), pullRequest.url(), outcome), started);
    }

    @Override
    protected GraphExecutionResult onResume(String currentState, AgentMessage message,
                                            GraphContext context, Instant started) {
        return unexpectedDecision(currentState, message);
    }

    // ── Review loop ──────────────────────────────────────────────────────

    /**
     * Review the pull request and feed blocking issues back into implementation until
     * the review is clean or the tenant's iteration cap is reached. Hitting the cap
     * completes with warnings rather than failing.
     */
    private ReviewOutcome reviewLoop(GraphContext context, TenantConfiguration tenant, AgentMessage committed) {
        AgentMessage reviewInput = committed;
        while (true) {
            CodeReviewed review = expect(runStep(context, AgentType.CODE_REVIEW, reviewInput, "code_reviewed"),
                    CodeReviewed.class, AgentType.CODE_REVIEW);
            context.put(ImplementationState.BLOCKING_ISSUES, review.blockingIssues());

            if (!review.hasBlockingIssues()) {
                if (tenant.autoApproveIfNoIssues()) {
                    runStep(context, AgentType.APPROVAL_COMMENT_POST, review, "approval_posted");
                }
                return ReviewOutcome.PASSED;
            }

            runStep(context, AgentType.REVIEW_COMMENT_POST, review, "review_comments_posted");

            int fixes = context.view(ImplementationState::new).reviewFixCount();
            if (fixes >= tenant.maxCodeReviewIterations()) {
                log.warn("Review for ticket {} still has {} blocking issue(s) after {} fix iteration(s)",
                        context.ticketId(), review.blockingIssues().size(), fixes);
                return ReviewOutcome.COMPLETED_WITH_WARNINGS;
            }

            fixes++;
            context.put(ImplementationState.REVIEW_FIX_COUNT, fixes);
            log.info("Fixing {} blocking issue(s) for ticket {} (iteration {}/{})", review.blockingIssues().size(),
                    context.ticketId(), fixes, tenant.maxCodeReviewIterations());
            AgentMessage fixed = runStep(context, AgentType.IMPLEMENTATION,
                    new FixCodeIssues(context.ticketId(), review.blockingIssues(), fixes), "code_fixed");
            reviewInput = commit(context, fixed, "fix_committed");
        }
    }

    private AgentMessage commit(GraphContext context, AgentMessage implemented, String checkpointName) {
        AgentMessage committed = invoke(context, AgentType.CODE_COMMIT, implemented);
        if (committed instanceof CodeCommitted commit) {
            context.put(ImplementationState.BRANCH_NAME, commit.branchName());
            context.put(ImplementationState.COMMIT_SHA, commit.commitSha());
        }
        saveCheckpoint(context, checkpointName, AgentType.CODE_COMMIT);
        return committed;
    }

    private TenantConfiguration tenantConfiguration(String ticketId, String tenantId) {
        try {
            return tenantConfigurationService.getConfiguration(tenantId);
        } catch (RuntimeException e) {
            log.warn("Could not load configuration of tenant {} for ticket {}; using defaults: {}",
                    tenantId, ticketId, e.getMessage());
            return TenantConfiguration.defaults();
        }
    }
}
