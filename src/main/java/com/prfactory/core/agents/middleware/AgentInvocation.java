package com.prfactory.core.agents.middleware;

import com.prfactory.core.agents.AgentContext;
import com.prfactory.core.agents.AgentType;
import com.prfactory.core.messages.AgentMessage;

/**
 * One pass of an agent through the middleware chain.
 */
public record AgentInvocation(AgentType agentType, AgentMessage input, AgentContext context) {

    public String ticketId() {
        return context.ticketId();
    }

    public String graphId() {
        return context.graphId();
    }
}
