package com.prfactory.core.agents;

import com.prfactory.core.agents.middleware.AgentInvocation;
import com.prfactory.core.agents.middleware.AgentMiddleware;
import com.prfactory.core.messages.AgentMessage;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * {@link AgentExecutor} that resolves agents from the {@link AgentRegistry} and runs
 * them through the middleware chain.
 * <p>
 * Middleware is applied in list order, outermost first; Spring sorts the list by
 * {@code @Order}.
 */
@Service
public class DefaultAgentExecutor implements AgentExecutor {

    private final AgentRegistry registry;
    private final List<AgentMiddleware> middleware;

    public DefaultAgentExecutor(AgentRegistry registry, List<AgentMiddleware> middleware) {
        this.registry = registry;
        this.middleware = List.copyOf(middleware);
    }

    @Override
    public AgentMessage execute(AgentType agentType, AgentMessage input, AgentContext context) {
        AgentMiddleware.Next chain = this::invokeAgent;
        for (int i = middleware.size() - 1; i >= 0; i--) {
            AgentMiddleware current = middleware.get(i);
            AgentMiddleware.Next next = chain;
            chain = invocation -> current.invoke(invocation, next);
        }
        return chain.proceed(new AgentInvocation(agentType, input, context));
    }

    private AgentMessage invokeAgent(AgentInvocation invocation) {
        AgentType type = invocation.agentType();
        Agent agent = registry.find(type)
                .orElseThrow(() -> new AgentExecutionException(type, "No agent registered for " + type));

        AgentMessage output;
        try {
            output = agent.execute(invocation.input(), invocation.context());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new AgentExecutionException(type, "Agent " + type + " failed: " + e.getMessage(), e);
        }

        if (output == null) {
            throw new AgentExecutionException(type, "Agent " + type + " returned no output");
        }
        return output;
    }
}
