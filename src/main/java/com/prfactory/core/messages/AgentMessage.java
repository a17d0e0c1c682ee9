package com.prfactory.core.messages;

import com.prfactory.core.model.PlanArtifact;
import com.prfactory.core.model.Question;
import com.prfactory.core.model.ReviewOutcome;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable unit of data passed between agents, graphs and the orchestrator.
 * <p>
 * The hierarchy is closed. Messages fall into four categories:
 * <ul>
 *   <li>{@link TriggerMessage} starts the first graph</li>
 *   <li>data messages hand results from one agent to the next</li>
 *   <li>{@link DecisionMessage} carries a human decision into a suspended graph</li>
 *   <li>{@link CompletionEvent} tells the orchestrator that a graph finished</li>
 * </ul>
 * Every variant carries the ticket identifier for correlation.
 */
public sealed interface AgentMessage {

    String ticketId();

    sealed interface TriggerMessage extends AgentMessage {
    }

    sealed interface DecisionMessage extends AgentMessage {
    }

    sealed interface CompletionEvent extends AgentMessage {
        CompletionKind kind();
    }

    /**
     * Discriminator for completion events. Orchestrator routing switches over this
     * with a switch expression, so a new constant must be handled there.
     */
    enum CompletionKind {
        REFINEMENT_COMPLETE,
        PLAN_APPROVED,
        PULL_REQUEST_CREATED,
        IMPLEMENTATION_SKIPPED
    }

    // ── Trigger ──────────────────────────────────────────────────────────

    record TriggerTicket(String ticketId, String ticketKey, String tenantId,
                         String repositoryId, String ticketSystem) implements TriggerMessage {
        public TriggerTicket {
            Objects.requireNonNull(ticketId, "ticketId");
        }
    }

    // ── Data ─────────────────────────────────────────────────────────────

    record TicketTriggered(String ticketId, String ticketKey, String title,
                           String description) implements AgentMessage {
    }

    record RepositoryCloned(String ticketId, String localPath, String defaultBranch) implements AgentMessage {
    }

    record CodebaseAnalyzed(String ticketId, List<String> relevantFiles,
                            String architectureSummary) implements AgentMessage {
        public CodebaseAnalyzed {
            relevantFiles = relevantFiles == null ? List.of() : List.copyOf(relevantFiles);
        }
    }

    record QuestionsGenerated(String ticketId, List<Question> questions) implements AgentMessage {
        public QuestionsGenerated {
            questions = questions == null ? List.of() : List.copyOf(questions);
        }
    }

    record MessagePosted(String ticketId, String messageType, Instant postedAt) implements AgentMessage {
    }

    record TicketUpdateGenerated(String ticketId, String ticketUpdateId, int version,
                                 String summary) implements AgentMessage {
    }

    record PlanArtifactGenerated(String ticketId, PlanArtifact artifact, String content) implements AgentMessage {
    }

    record FeedbackAnalyzed(String ticketId, List<PlanArtifact> affectedArtifacts,
                            String summary) implements AgentMessage {
        public FeedbackAnalyzed {
            affectedArtifacts = affectedArtifacts == null ? List.of() : List.copyOf(affectedArtifacts);
        }
    }

    record PlanStored(String ticketId, String planId, int version) implements AgentMessage {
    }

    record PlanCommitted(String ticketId, String branchName, String commitSha,
                         String branchUrl) implements AgentMessage {
    }

    record CodeImplemented(String ticketId, List<String> modifiedFiles, String summary) implements AgentMessage {
        public CodeImplemented {
            modifiedFiles = modifiedFiles == null ? List.of() : List.copyOf(modifiedFiles);
        }
    }

    record CodeCommitted(String ticketId, String branchName, String commitSha) implements AgentMessage {
    }

    record PullRequestOpened(String ticketId, int number, String url) implements AgentMessage {
    }

    record CodeReviewed(String ticketId, boolean hasBlockingIssues, List<String> blockingIssues,
                        List<String> suggestions) implements AgentMessage {
        public CodeReviewed {
            blockingIssues = blockingIssues == null ? List.of() : List.copyOf(blockingIssues);
            suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        }
    }

    record FixCodeIssues(String ticketId, List<String> blockingIssues, int iteration) implements AgentMessage {
        public FixCodeIssues {
            blockingIssues = blockingIssues == null ? List.of() : List.copyOf(blockingIssues);
        }
    }

    // ── Human decisions ──────────────────────────────────────────────────

    record AnswersReceived(String ticketId, Map<String, String> answers) implements DecisionMessage {
        public AnswersReceived {
            answers = answers == null ? Map.of() : Map.copyOf(answers);
        }
    }

    record TicketUpdateApproved(String ticketId, String approvedBy) implements DecisionMessage {
    }

    record TicketUpdateRejected(String ticketId, String reason) implements DecisionMessage {
    }

    record PlanApproved(String ticketId, String approvedBy, Instant approvedAt) implements DecisionMessage {
    }

    record PlanRejected(String ticketId, String reason, String refinementInstructions,
                        boolean regenerateCompletely) implements DecisionMessage {
    }

    // ── Completion events ────────────────────────────────────────────────
    // Events that start another graph carry the tenant id, since a graph never
    // reads another graph's checkpoint.

    record RefinementComplete(String ticketId, String tenantId, Instant completedAt) implements CompletionEvent {
        @Override
        public CompletionKind kind() {
            return CompletionKind.REFINEMENT_COMPLETE;
        }
    }

    record PlanApprovedEvent(String ticketId, String tenantId, String approvedBy,
                             Instant approvedAt) implements CompletionEvent {
        @Override
        public CompletionKind kind() {
            return CompletionKind.PLAN_APPROVED;
        }
    }

    record PullRequestCreated(String ticketId, int number, String url,
                              ReviewOutcome reviewOutcome) implements CompletionEvent {
        @Override
        public CompletionKind kind() {
            return CompletionKind.PULL_REQUEST_CREATED;
        }
    }

    record ImplementationSkipped(String ticketId, String reason) implements CompletionEvent {
        @Override
        public CompletionKind kind() {
            return CompletionKind.IMPLEMENTATION_SKIPPED;
        }
    }
}
