package com.prfactory.core.agents;

/**
 * A failure that may succeed when retried, such as a timeout or rate limit.
 */
public class TransientAgentException extends AgentExecutionException {

    public TransientAgentException(AgentType agentType, String message) {
        super(agentType, message);
    }

    public TransientAgentException(AgentType agentType, String message, Throwable cause) {
        super(agentType, message, cause);
    }
}
