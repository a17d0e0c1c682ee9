package com.prfactory.core.agents;

import com.prfactory.core.messages.AgentMessage;

/**
 * A single-purpose step: consumes one message and produces another, or fails.
 * <p>
 * Implementations are Spring beans picked up by the {@link AgentRegistry}.
 * Throw {@link TransientAgentException} for failures worth retrying.
 */
public interface Agent {

    AgentType type();

    AgentMessage execute(AgentMessage input, AgentContext context) throws Exception;
}
