package com.prfactory.core.graph;

import com.prfactory.core.agents.AgentContext;
import com.prfactory.core.agents.AgentType;
import com.prfactory.core.model.Checkpoint;
import com.prfactory.core.state.GraphState;
import com.prfactory.core.state.PlanningState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphContextTest {

    @Test
    @DisplayName("a fresh context only knows its ticket")
    void fresh() {
        GraphContext context = GraphContext.fresh("PROJ-1", "PlanningGraph");

        assertEquals(Map.of(GraphState.TICKET_ID, "PROJ-1"), context.snapshot());
        assertEquals(GraphState.NOT_STARTED, context.view(GraphState::new).currentState());
    }

    @Test
    @DisplayName("a context restored from a checkpoint carries its state")
    void fromCheckpoint() {
        var checkpoint = new Checkpoint("PROJ-1", "PlanningGraph", "awaiting_approval",
                Map.of(GraphState.CURRENT_STATE, "awaiting_approval", PlanningState.PLAN_RETRY_COUNT, 2L),
                Instant.now());

        GraphContext context = GraphContext.fromCheckpoint(checkpoint);

        PlanningState state = context.view(PlanningState::new);
        assertEquals("awaiting_approval", state.currentState());
        assertEquals(2, state.planRetryCount());
    }

    @Test
    @DisplayName("putting null removes the key")
    void nullRemoves() {
        GraphContext context = GraphContext.fresh("PROJ-1", "PlanningGraph");
        context.put(GraphState.WAITING_FOR, "plan_approval");

        context.put(GraphState.WAITING_FOR, null);

        assertFalse(context.snapshot().containsKey(GraphState.WAITING_FOR));
    }

    @Test
    @DisplayName("agent contexts are read-only snapshots")
    void agentContextIsSnapshot() {
        GraphContext context = GraphContext.fresh("PROJ-1", "PlanningGraph");
        context.put(PlanningState.PLAN_ID, "plan-1");

        AgentContext agentContext = context.forAgent(AgentType.PLAN_COMMIT);
        context.put(PlanningState.PLAN_ID, "plan-2");

        assertEquals("plan-1", agentContext.<String>value(PlanningState.PLAN_ID).orElseThrow());
        assertEquals(AgentType.PLAN_COMMIT, agentContext.agentType());
        assertThrows(UnsupportedOperationException.class, () -> agentContext.state().put("x", 1));
    }
}
