package com.prfactory.core.agents;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves {@link AgentType}s to their registered {@link Agent} implementation.
 */
@Component
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<AgentType, Agent> agents = new EnumMap<>(AgentType.class);

    @Autowired
    public AgentRegistry(ObjectProvider<Agent> agents) {
        this(agents.orderedStream().toList());
    }

    public AgentRegistry(Collection<? extends Agent> agents) {
        for (Agent agent : agents) {
            Agent previous = this.agents.putIfAbsent(agent.type(), agent);
            if (previous != null) {
                throw new IllegalStateException("Duplicate agent registered for " + agent.type()
                        + ": " + previous.getClass().getName() + " and " + agent.getClass().getName());
            }
        }
        log.info("Registered {} agent(s): {}", this.agents.size(), this.agents.keySet());
    }

    public Optional<Agent> find(AgentType type) {
        return Optional.ofNullable(agents.get(type));
    }

    public Set<AgentType> registeredTypes() {
        return Set.copyOf(agents.keySet());
    }
}
