package com.prfactory.core.agents.middleware;

import com.prfactory.core.messages.AgentMessage;

/**
 * Cross-cutting behaviour wrapped around every agent execution.
 */
public interface AgentMiddleware {

    AgentMessage invoke(AgentInvocation invocation, Next next);

    @FunctionalInterface
    interface Next {
        AgentMessage proceed(AgentInvocation invocation);
    }
}
