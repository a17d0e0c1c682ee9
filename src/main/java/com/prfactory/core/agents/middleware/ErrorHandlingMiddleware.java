package com.prfactory.core.agents.middleware;

import com.prfactory.core.agents.AgentExecutionException;
import com.prfactory.core.messages.AgentMessage;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Normalises every agent failure to an {@link AgentExecutionException}.
 */
@Component
@Order(20)
public class ErrorHandlingMiddleware implements AgentMiddleware {

    @Override
    public AgentMessage invoke(AgentInvocation invocation, Next next) {
        try {
            return next.proceed(invocation);
        } catch (AgentExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AgentExecutionException(invocation.agentType(),
                    "Agent " + invocation.agentType() + " failed: " + e.getMessage(), e);
        }
    }
}
