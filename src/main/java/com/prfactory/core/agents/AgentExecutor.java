package com.prfactory.core.agents;

import com.prfactory.core.messages.AgentMessage;

/**
 * Runs one registered agent against one input message.
 */
public interface AgentExecutor {

    /**
     * @throws AgentExecutionException if the agent fails after any retries
     */
    AgentMessage execute(AgentType agentType, AgentMessage input, AgentContext context);
}
