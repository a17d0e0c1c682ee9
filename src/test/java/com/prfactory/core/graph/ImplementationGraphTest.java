package com.prfactory.core.graph;

import com.prfactory.core.agents.AgentType;
import com.prfactory.core.messages.AgentMessage.CodeReviewed;
import com.prfactory.core.messages.AgentMessage.FixCodeIssues;
import com.prfactory.core.messages.AgentMessage.ImplementationSkipped;
import com.prfactory.core.messages.AgentMessage.PlanApproved;
import com.prfactory.core.messages.AgentMessage.PlanApprovedEvent;
import com.prfactory.core.messages.AgentMessage.PullRequestCreated;
import com.prfactory.core.messages.AgentMessage.RefinementComplete;
import com.prfactory.core.model.ReviewOutcome;
import com.prfactory.core.model.TenantConfiguration;
import com.prfactory.core.state.ImplementationState;
import com.prfactory.core.tenant.TenantConfigurationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ImplementationGraphTest {

    private static final String TICKET = "PROJ-303";
    private static final String TENANT = "acme";

    private RecordingCheckpointStore store;
    private ScriptedAgentExecutor agents;
    private TenantConfigurationService tenants;
    private ExecutorService pool;
    private ImplementationGraph graph;

    @BeforeEach
    void setUp() {
        store = new RecordingCheckpointStore();
        agents = new ScriptedAgentExecutor();
        tenants = mock(TenantConfigurationService.class);
        pool = Executors.newFixedThreadPool(2);
        graph = new ImplementationGraph(store, agents, event -> { }, tenants, pool);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private void tenant(boolean autoImplement, boolean review, int maxIterations, boolean autoApprove) {
        when(tenants.getConfiguration(TENANT))
                .thenReturn(new TenantConfiguration(autoImplement, review, maxIterations, autoApprove));
    }

    private static PlanApprovedEvent approvedPlan() {
        return new PlanApprovedEvent(TICKET, TENANT, "carol", Instant.now());
    }

    private ImplementationState latest() {
        return new ImplementationState(store.loadLatest(TICKET, ImplementationGraph.GRAPH_ID).orElseThrow().state());
    }

    private static CodeReviewed blocking(String issue) {
        return new CodeReviewed(TICKET, true, List.of(issue), List.of());
    }

    // -- Tenant gating -----------------------------------------------------

    @Nested
    @DisplayName("tenant gating")
    class TenantGatingTests {

        @Test
        @DisplayName("skips implementation when the tenant disabled it")
        void skipped() {
            tenant(false, false, 3, false);

            GraphExecutionResult result = graph.execute(approvedPlan());

            var success = assertInstanceOf(GraphExecutionResult.Success.class, result);
            assertEquals(ImplementationGraph.SKIPPED, success.state());
            var skipped = assertInstanceOf(ImplementationSkipped.class, success.outputMessage());
            assertEquals(ImplementationGraph.AUTO_IMPLEMENTATION_DISABLED, skipped.reason());
            assertTrue(agents.invocations().isEmpty());
            assertTrue(latest().skipped());
        }

        @Test
        @DisplayName("resolves settings from the tenant carried by the plan-approved event")
        void tenantFromEvent() {
            tenant(true, false, 3, false);

            var success = assertInstanceOf(GraphExecutionResult.Success.class, graph.execute(approvedPlan()));

            assertEquals(ImplementationGraph.COMPLETED, success.state());
            verify(tenants).getConfiguration(TENANT);
            assertEquals(TENANT, latest().tenantId().orElseThrow());
        }

        @Test
        @DisplayName("falls back to default settings when the tenant lookup fails")
        void lookupFailure() {
            when(tenants.getConfiguration(TENANT)).thenThrow(new IllegalStateException("tenant db down"));

            var success = assertInstanceOf(GraphExecutionResult.Success.class, graph.execute(approvedPlan()));

            assertEquals(ImplementationGraph.SKIPPED, success.state());
        }
    }

    // -- Pull request ------------------------------------------------------

    @Nested
    @DisplayName("pull request")
    class PullRequestTests {

        @Test
        @DisplayName("implements, commits and opens a pull request")
        void opensPullRequest() {
            tenant(true, false, 3, false);

            GraphExecutionResult result = graph.execute(approvedPlan());

            var success = assertInstanceOf(GraphExecutionResult.Success.class, result);
            assertEquals(ImplementationGraph.COMPLETED, success.state());
            var created = assertInstanceOf(PullRequestCreated.class, success.outputMessage());
            assertEquals(42, created.number());
            assertEquals("https://git.example.com/pr/42", created.url());
            assertEquals(ReviewOutcome.NOT_REVIEWED, created.reviewOutcome());

            List<AgentType> calls = agents.invocations();
            assertEquals(List.of(AgentType.IMPLEMENTATION, AgentType.CODE_COMMIT), calls.subList(0, 2));
            assertEquals(Set.of(AgentType.PULL_REQUEST, AgentType.IMPLEMENTATION_POST),
                    Set.copyOf(calls.subList(2, 4)));
            assertEquals(4, calls.size());
            assertEquals(List.of("code_implemented", "code_committed", ImplementationGraph.PR_CREATED,
                    ImplementationGraph.COMPLETED), store.saved());

            ImplementationState state = latest();
            assertEquals(42, state.pullRequestNumber());
            assertTrue(state.isCompleted());
        }

        @Test
        @DisplayName("a failed fan-out branch fails the graph")
        void fanOutFailure() {
            tenant(true, false, 3, false);
            agents.failing(AgentType.PULL_REQUEST, "branch protected");

            var failure = assertInstanceOf(GraphExecutionResult.Failure.class, graph.execute(approvedPlan()));

            assertEquals("pull_request_failed", failure.state());
            assertEquals(1, agents.count(AgentType.IMPLEMENTATION_POST));
            assertTrue(latest().isFailed());
        }

        @Test
        @DisplayName("a failing implementation step stops before committing")
        void implementationFailure() {
            tenant(true, false, 3, false);
            agents.failing(AgentType.IMPLEMENTATION, "compile errors");

            var failure = assertInstanceOf(GraphExecutionResult.Failure.class, graph.execute(approvedPlan()));

            assertEquals("implementation_failed", failure.state());
            assertEquals(0, agents.count(AgentType.CODE_COMMIT));
        }

        @Test
        @DisplayName("rejects an input that is not a plan approval")
        void rejectsWrongInput() {
            var failure = assertInstanceOf(GraphExecutionResult.Failure.class,
                    graph.execute(new RefinementComplete(TICKET, "acme", Instant.now())));

            assertEquals(AbstractAgentGraph.INVALID_INPUT, failure.state());
        }

        @Test
        @DisplayName("has no suspension points to resume")
        void resumeAlwaysFails() {
            tenant(true, false, 3, false);
            graph.execute(approvedPlan());

            var failure = assertInstanceOf(GraphExecutionResult.Failure.class,
                    graph.resume(TICKET, new PlanApproved(TICKET, "carol", Instant.now())));

            assertEquals(AbstractAgentGraph.RESUME_FAILED, failure.state());
            assertEquals(ImplementationGraph.COMPLETED, latest().currentState());
        }
    }

    // -- Review loop -------------------------------------------------------

    @Nested
    @DisplayName("review loop")
    class ReviewLoopTests {

        @Test
        @DisplayName("a clean review with auto-approval posts an approval comment")
        void cleanReviewAutoApproved() {
            tenant(true, true, 3, true);

            var success = assertInstanceOf(GraphExecutionResult.Success.class, graph.execute(approvedPlan()));

            assertEquals(ImplementationGraph.COMPLETED, success.state());
            assertEquals(ReviewOutcome.PASSED,
                    assertInstanceOf(PullRequestCreated.class, success.outputMessage()).reviewOutcome());
            assertEquals(1, agents.count(AgentType.CODE_REVIEW));
            assertEquals(1, agents.count(AgentType.APPROVAL_COMMENT_POST));
            assertTrue(store.saved().contains("approval_posted"));
        }

        @Test
        @DisplayName("a clean review without auto-approval posts nothing")
        void cleanReviewWithoutApproval() {
            tenant(true, true, 3, false);

            graph.execute(approvedPlan());

            assertEquals(0, agents.count(AgentType.APPROVAL_COMMENT_POST));
            assertEquals(0, agents.count(AgentType.REVIEW_COMMENT_POST));
        }

        @Test
        @DisplayName("blocking issues are fed back into implementation until the review is clean")
        void fixesBlockingIssues() {
            tenant(true, true, 3, false);
            var reviews = new AtomicInteger();
            agents.on(AgentType.CODE_REVIEW, input -> reviews.incrementAndGet() == 1
                    ? blocking("Null check missing")
                    : new CodeReviewed(TICKET, false, List.of(), List.of()));
            List<FixCodeIssues> fixRequests = new CopyOnWriteArrayList<>();
            agents.on(AgentType.IMPLEMENTATION, input -> {
                if (input instanceof FixCodeIssues fix) {
                    fixRequests.add(fix);
                }
                return ScriptedAgentExecutor.defaultOutputFor(AgentType.IMPLEMENTATION, input);
            });

            var success = assertInstanceOf(GraphExecutionResult.Success.class, graph.execute(approvedPlan()));

            assertEquals(ImplementationGraph.COMPLETED, success.state());
            assertEquals(2, agents.count(AgentType.CODE_REVIEW));
            assertEquals(2, agents.count(AgentType.IMPLEMENTATION));
            assertEquals(1, agents.count(AgentType.REVIEW_COMMENT_POST));
            assertEquals(1, fixRequests.size());
            assertEquals(List.of("Null check missing"), fixRequests.get(0).blockingIssues());
            assertEquals(1, fixRequests.get(0).iteration());
            assertEquals(1, latest().reviewFixCount());
        }

        @Test
        @DisplayName("completes with warnings once the iteration cap is reached")
        void iterationCap() {
            tenant(true, true, 2, true);
            agents.on(AgentType.CODE_REVIEW, input -> blocking("SQL injection"));

            var success = assertInstanceOf(GraphExecutionResult.Success.class, graph.execute(approvedPlan()));

            assertEquals(ImplementationGraph.COMPLETED_WITH_WARNINGS, success.state());
            assertEquals(ReviewOutcome.COMPLETED_WITH_WARNINGS,
                    assertInstanceOf(PullRequestCreated.class, success.outputMessage()).reviewOutcome());
            assertEquals(3, agents.count(AgentType.CODE_REVIEW));
            assertEquals(3, agents.count(AgentType.IMPLEMENTATION));
            assertEquals(0, agents.count(AgentType.APPROVAL_COMMENT_POST));
            assertEquals(2, latest().reviewFixCount());
            assertEquals(List.of("SQL injection"), latest().blockingIssues());
        }
    }
}
