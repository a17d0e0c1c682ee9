package com.prfactory.core.agents.middleware;

import com.prfactory.core.audit.AuditTrail;
import com.prfactory.core.messages.AgentMessage;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Records the outcome of every agent execution in the {@link AuditTrail}.
 */
@Component
@Order(40)
public class AuditMiddleware implements AgentMiddleware {

    private final AuditTrail auditTrail;

    public AuditMiddleware(AuditTrail auditTrail) {
        this.auditTrail = auditTrail;
    }

    @Override
    public AgentMessage invoke(AgentInvocation invocation, Next next) {
        try {
            AgentMessage output = next.proceed(invocation);
            auditTrail.record(invocation.ticketId(), invocation.graphId(), "agent",
                    invocation.agentType().name(), "completed -> " + output.getClass().getSimpleName());
            return output;
        } catch (RuntimeException e) {
            auditTrail.record(invocation.ticketId(), invocation.graphId(), "agent",
                    invocation.agentType().name(), "failed: " + e.getMessage());
            throw e;
        }
    }
}
