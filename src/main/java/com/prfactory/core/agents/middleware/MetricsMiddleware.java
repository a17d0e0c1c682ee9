package com.prfactory.core.agents.middleware;

import com.prfactory.core.messages.AgentMessage;
import com.prfactory.core.metrics.WorkflowMetrics;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(30)
public class MetricsMiddleware implements AgentMiddleware {

    private final WorkflowMetrics metrics;

    public MetricsMiddleware(WorkflowMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public AgentMessage invoke(AgentInvocation invocation, Next next) {
        long start = System.currentTimeMillis();
        boolean success = false;
        try {
            AgentMessage output = next.proceed(invocation);
            success = true;
            return output;
        } finally {
            metrics.recordAgentExecution(invocation.agentType().name(),
                    System.currentTimeMillis() - start, success);
        }
    }
}
