package com.prfactory.core.graph;

import com.prfactory.core.agents.AgentContext;
import com.prfactory.core.agents.AgentType;
import com.prfactory.core.model.Checkpoint;
import com.prfactory.core.state.GraphState;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Mutable working state of one graph invocation.
 * <p>
 * Seeded empty on execute or from the stored checkpoint on resume, and written
 * back to the checkpoint store at every step boundary. Null values are not stored.
 */
public final class GraphContext {

    private final String ticketId;
    private final String graphId;
    private final Map<String, Object> state = new ConcurrentHashMap<>();

    private GraphContext(String ticketId, String graphId, Map<String, Object> initial) {
        this.ticketId = ticketId;
        this.graphId = graphId;
        initial.forEach(this::put);
        state.put(GraphState.TICKET_ID, ticketId);
    }

    public static GraphContext fresh(String ticketId, String graphId) {
        return new GraphContext(ticketId, graphId, Map.of());
    }

    public static GraphContext fromCheckpoint(Checkpoint checkpoint) {
        return new GraphContext(checkpoint.ticketId(), checkpoint.graphId(), checkpoint.state());
    }

    public String ticketId() {
        return ticketId;
    }

    public String graphId() {
        return graphId;
    }

    public void put(String key, Object value) {
        if (value == null) {
            state.remove(key);
        } else {
            state.put(key, value);
        }
    }

    public void remove(String key) {
        state.remove(key);
    }

    public Map<String, Object> snapshot() {
        return new LinkedHashMap<>(state);
    }

    /**
     * Typed view of the current state, e.g. {@code context.view(PlanningState::new)}.
     */
    public <S extends GraphState> S view(Function<Map<String, Object>, S> factory) {
        return factory.apply(snapshot());
    }

    public AgentContext forAgent(AgentType agentType) {
        return new AgentContext(ticketId, graphId, agentType, state);
    }
}
