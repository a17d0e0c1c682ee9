package com.prfactory.core.agents;

/**
 * An agent step failed.
 */
public class AgentExecutionException extends RuntimeException {

    private final AgentType agentType;

    public AgentExecutionException(AgentType agentType, String message) {
        super(message);
        this.agentType = agentType;
    }

    public AgentExecutionException(AgentType agentType, String message, Throwable cause) {
        super(message, cause);
        this.agentType = agentType;
    }

    public AgentType getAgentType() {
        return agentType;
    }
}
