package com.prfactory.core.graph;

import com.prfactory.core.agents.AgentType;
import com.prfactory.core.config.WorkflowProperties;
import com.prfactory.core.messages.AgentMessage.AnswersReceived;
import com.prfactory.core.messages.AgentMessage.PlanApproved;
import com.prfactory.core.messages.AgentMessage.PlanApprovedEvent;
import com.prfactory.core.messages.AgentMessage.PlanCommitted;
import com.prfactory.core.messages.AgentMessage.PlanRejected;
import com.prfactory.core.messages.AgentMessage.RefinementComplete;
import com.prfactory.core.messages.AgentMessage.TriggerTicket;
import com.prfactory.core.metrics.WorkflowMetrics;
import com.prfactory.core.model.PlanArtifact;
import com.prfactory.core.state.PlanningState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class PlanningGraphTest {

    private static final String TICKET = "PROJ-202";

    private static final List<AgentType> ARTIFACT_AGENTS = List.of(AgentType.USER_STORIES, AgentType.API_DESIGN,
            AgentType.DATA_SCHEMA, AgentType.TEST_CASES, AgentType.IMPLEMENTATION_NOTES);

    private RecordingCheckpointStore store;
    private ScriptedAgentExecutor agents;
    private ExecutorService pool;
    private PlanningGraph graph;

    @BeforeEach
    void setUp() {
        store = new RecordingCheckpointStore();
        agents = new ScriptedAgentExecutor();
        pool = Executors.newFixedThreadPool(2);
        graph = new PlanningGraph(store, agents, event -> { }, new WorkflowMetrics(new SimpleMeterRegistry()),
                new WorkflowProperties(), pool);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static RefinementComplete refined() {
        return new RefinementComplete(TICKET, "acme", Instant.now());
    }

    private static PlanRejected rejection(String reason) {
        return new PlanRejected(TICKET, reason, "Tighten the API", false);
    }

    private PlanningState latest() {
        return new PlanningState(store.loadLatest(TICKET, PlanningGraph.GRAPH_ID).orElseThrow().state());
    }

    private void suspendAwaitingApproval() {
        graph.execute(refined());
        agents.reset();
        store.clearHistory();
    }

    // -- Execute -----------------------------------------------------------

    @Nested
    @DisplayName("execute")
    class ExecuteTests {

        @Test
        @DisplayName("generates artifacts in canonical order, publishes, and suspends for approval")
        void generatesAndSuspends() {
            GraphExecutionResult result = graph.execute(refined());

            var suspended = assertInstanceOf(GraphExecutionResult.Suspended.class, result);
            assertEquals(PlanningGraph.AWAITING_APPROVAL, suspended.state());
            assertInstanceOf(PlanCommitted.class, suspended.outputMessage());

            List<AgentType> calls = agents.invocations();
            assertEquals(8, calls.size());
            assertEquals(ARTIFACT_AGENTS, calls.subList(0, 5));
            assertEquals(AgentType.PLAN_STORAGE, calls.get(5));
            assertEquals(Set.of(AgentType.PLAN_COMMIT, AgentType.PLAN_POST), Set.copyOf(calls.subList(6, 8)));

            assertEquals(List.of("user_stories_generated", "api_design_generated", "data_schema_generated",
                    "test_cases_generated", "implementation_notes_generated", "plan_stored",
                    PlanningGraph.PLAN_POSTED, PlanningGraph.AWAITING_APPROVAL), store.saved());
        }

        @Test
        @DisplayName("stores artifacts, plan and commit details in the checkpoint")
        void checkpointContents() {
            graph.execute(refined());

            PlanningState state = latest();
            Map<String, String> artifacts = state.planArtifacts();
            assertEquals(5, artifacts.size());
            assertEquals("api_design content", artifacts.get(PlanArtifact.API_DESIGN.key()));
            assertEquals("abc123", state.gitCommitSha().orElseThrow());
            assertTrue(state.issueTrackerPosted());
            assertEquals(0, state.planRetryCount());
            assertEquals("plan_approval", state.waitingFor().orElseThrow());
        }

        @Test
        @DisplayName("a failing artifact step stops generation")
        void failingArtifact() {
            agents.failing(AgentType.USER_STORIES, "model overloaded");

            GraphExecutionResult result = graph.execute(refined());

            var failure = assertInstanceOf(GraphExecutionResult.Failure.class, result);
            assertEquals("user_stories_failed", failure.state());
            assertEquals(List.of(AgentType.USER_STORIES), agents.invocations());
            assertTrue(latest().isFailed());
        }

        @Test
        @DisplayName("both fan-out branches run even when one fails")
        void fanOutWaitsForAllBranches() {
            agents.failing(AgentType.PLAN_POST, "tracker down");

            GraphExecutionResult result = graph.execute(refined());

            var failure = assertInstanceOf(GraphExecutionResult.Failure.class, result);
            assertEquals("plan_post_failed", failure.state());
            assertEquals(1, agents.count(AgentType.PLAN_COMMIT));
            assertEquals(1, agents.count(AgentType.PLAN_POST));
            assertFalse(store.saved().contains(PlanningGraph.PLAN_POSTED));
        }

        @Test
        @DisplayName("when both branches fail the first declared branch names the failure")
        void fanOutFailureOrder() {
            agents.failing(AgentType.PLAN_COMMIT, "push rejected");
            agents.failing(AgentType.PLAN_POST, "tracker down");

            var failure = assertInstanceOf(GraphExecutionResult.Failure.class, graph.execute(refined()));

            assertEquals("plan_commit_failed", failure.state());
            assertEquals("push rejected", failure.error());
        }

        @Test
        @DisplayName("rejects an input that is not a refinement completion")
        void rejectsWrongInput() {
            var failure = assertInstanceOf(GraphExecutionResult.Failure.class,
                    graph.execute(new TriggerTicket(TICKET, TICKET, null, null, null)));

            assertEquals(AbstractAgentGraph.INVALID_INPUT, failure.state());
            assertTrue(agents.invocations().isEmpty());
        }
    }

    // -- Approval ----------------------------------------------------------

    @Nested
    @DisplayName("approval")
    class ApprovalTests {

        @Test
        @DisplayName("approval completes the graph with a plan-approved event")
        void approve() {
            suspendAwaitingApproval();
            Instant approvedAt = Instant.parse("2026-03-01T10:15:30Z");

            GraphExecutionResult result = graph.resume(TICKET, new PlanApproved(TICKET, "carol", approvedAt));

            var success = assertInstanceOf(GraphExecutionResult.Success.class, result);
            assertEquals(PlanningGraph.PLAN_APPROVED, success.state());
            var event = assertInstanceOf(PlanApprovedEvent.class, success.outputMessage());
            assertEquals("carol", event.approvedBy());
            assertEquals(approvedAt, event.approvedAt());
            assertEquals("acme", event.tenantId());
            assertTrue(agents.invocations().isEmpty());
            assertEquals("carol", latest().approvedBy().orElseThrow());
            assertTrue(latest().isCompleted());
        }

        @Test
        @DisplayName("a revised plan can be approved from awaiting_re_review")
        void approveAfterRevision() {
            suspendAwaitingApproval();
            graph.resume(TICKET, rejection("missing error codes"));

            GraphExecutionResult result = graph.resume(TICKET, new PlanApproved(TICKET, "carol", null));

            var success = assertInstanceOf(GraphExecutionResult.Success.class, result);
            assertNotNull(assertInstanceOf(PlanApprovedEvent.class, success.outputMessage()).approvedAt());
        }

        @Test
        @DisplayName("refinement decisions are not accepted")
        void wrongDecision() {
            suspendAwaitingApproval();

            var failure = assertInstanceOf(GraphExecutionResult.Failure.class,
                    graph.resume(TICKET, new AnswersReceived(TICKET, Map.of())));

            assertEquals(AbstractAgentGraph.RESUME_FAILED, failure.state());
            assertEquals(PlanningGraph.AWAITING_APPROVAL, latest().currentState());
        }
    }

    // -- Rejection ---------------------------------------------------------

    @Nested
    @DisplayName("rejection")
    class RejectionTests {

        @Test
        @DisplayName("regenerates only the artifacts the feedback touches")
        void targetedRegeneration() {
            suspendAwaitingApproval();

            GraphExecutionResult result = graph.resume(TICKET, rejection("missing error codes"));

            var suspended = assertInstanceOf(GraphExecutionResult.Suspended.class, result);
            assertEquals(PlanningGraph.AWAITING_RE_REVIEW, suspended.state());

            List<AgentType> calls = agents.invocations();
            assertEquals(List.of(AgentType.FEEDBACK_ANALYSIS, AgentType.API_DESIGN, AgentType.PLAN_STORAGE),
                    calls.subList(0, 3));
            assertEquals(Set.of(AgentType.PLAN_COMMIT, AgentType.PLAN_POST), Set.copyOf(calls.subList(3, 5)));
            assertEquals(List.of("plan_rejected", "feedback_analyzed", "api_design_generated", "plan_stored",
                    PlanningGraph.PLAN_POSTED, PlanningGraph.AWAITING_RE_REVIEW), store.saved());

            PlanningState state = latest();
            assertEquals(1, state.planRetryCount());
            assertEquals("missing error codes", state.revisionFeedback().orElseThrow());
            assertEquals(List.of("api_design"), state.affectedArtifacts());
        }

        @Test
        @DisplayName("regenerate_completely regenerates every artifact")
        void fullRegeneration() {
            suspendAwaitingApproval();

            graph.resume(TICKET, new PlanRejected(TICKET, "start over", null, true));

            for (AgentType artifactAgent : ARTIFACT_AGENTS) {
                assertEquals(1, agents.count(artifactAgent), artifactAgent + " should run once");
            }
        }

        @Test
        @DisplayName("a failed feedback analysis falls back to regenerating everything")
        void analysisFailureFallsBack() {
            suspendAwaitingApproval();
            agents.failing(AgentType.FEEDBACK_ANALYSIS, "analysis unavailable");

            GraphExecutionResult result = graph.resume(TICKET, rejection("unclear"));

            assertInstanceOf(GraphExecutionResult.Suspended.class, result);
            for (AgentType artifactAgent : ARTIFACT_AGENTS) {
                assertEquals(1, agents.count(artifactAgent));
            }
            assertFalse(store.saved().contains("feedback_analyzed"));
        }

        @Test
        @DisplayName("exceeding the rejection limit fails without invoking any agent")
        void rejectionLimit() {
            suspendAwaitingApproval();
            for (int i = 1; i <= 5; i++) {
                assertInstanceOf(GraphExecutionResult.Suspended.class, graph.resume(TICKET, rejection("no " + i)));
            }
            assertEquals(5, latest().planRetryCount());
            agents.reset();

            GraphExecutionResult result = graph.resume(TICKET, rejection("no 6"));

            var failure = assertInstanceOf(GraphExecutionResult.Failure.class, result);
            assertEquals(PlanningGraph.TOO_MANY_REJECTIONS, failure.state());
            assertTrue(failure.error().contains("6 times"));
            assertTrue(agents.invocations().isEmpty());
            assertTrue(latest().isFailed());
        }

        @Test
        @DisplayName("a failing regeneration step fails the graph")
        void regenerationFailure() {
            suspendAwaitingApproval();
            agents.failing(AgentType.API_DESIGN, "timeout");

            var failure = assertInstanceOf(GraphExecutionResult.Failure.class,
                    graph.resume(TICKET, rejection("api is wrong")));

            assertEquals("api_design_failed", failure.state());
            assertEquals(0, agents.count(AgentType.PLAN_STORAGE));
        }
    }

    @Test
    @DisplayName("every plan artifact maps to its generator agent")
    void agentForArtifact() {
        for (PlanArtifact artifact : PlanArtifact.values()) {
            assertEquals(artifact.key(), PlanningGraph.agentFor(artifact).stepName());
        }
    }
}
