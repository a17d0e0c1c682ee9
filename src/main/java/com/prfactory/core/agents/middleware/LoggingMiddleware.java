package com.prfactory.core.agents.middleware;

import com.prfactory.core.logging.MdcContext;
import com.prfactory.core.messages.AgentMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(10)
public class LoggingMiddleware implements AgentMiddleware {

    private static final Logger log = LoggerFactory.getLogger(LoggingMiddleware.class);

    @Override
    public AgentMessage invoke(AgentInvocation invocation, Next next) {
        MdcContext.setAgent(invocation.ticketId(), invocation.graphId(), invocation.agentType().name());
        long start = System.currentTimeMillis();
        log.info("Executing {} with {}", invocation.agentType(), invocation.input().getClass().getSimpleName());
        try {
            AgentMessage output = next.proceed(invocation);
            log.info("{} completed in {}ms -> {}", invocation.agentType(),
                    System.currentTimeMillis() - start, output.getClass().getSimpleName());
            return output;
        } catch (RuntimeException e) {
            log.error("{} failed after {}ms: {}", invocation.agentType(),
                    System.currentTimeMillis() - start, e.getMessage());
            throw e;
        } finally {
            MdcContext.clearAgent();
        }
    }
}
