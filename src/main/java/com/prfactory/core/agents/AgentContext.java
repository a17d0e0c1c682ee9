package com.prfactory.core.agents;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the graph state handed to an agent.
 *
 * @param ticketId  ticket being processed
 * @param graphId   graph running the agent
 * @param agentType the agent being run
 * @param state     snapshot of the graph's working state
 */
public record AgentContext(String ticketId, String graphId, AgentType agentType, Map<String, Object> state) {

    public AgentContext {
        state = Collections.unmodifiableMap(new LinkedHashMap<>(state));
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> value(String key) {
        return Optional.ofNullable((T) state.get(key));
    }
}
