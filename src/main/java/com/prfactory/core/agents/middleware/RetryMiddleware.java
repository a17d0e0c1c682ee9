package com.prfactory.core.agents.middleware;

import com.prfactory.core.agents.TransientAgentException;
import com.prfactory.core.config.WorkflowProperties;
import com.prfactory.core.messages.AgentMessage;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Retries agents that fail with a {@link TransientAgentException}.
 * <p>
 * Any other failure propagates on the first attempt. One resilience4j {@link Retry}
 * instance is kept per agent type.
 */
@Component
@Order(50)
public class RetryMiddleware implements AgentMiddleware {

    private static final Logger log = LoggerFactory.getLogger(RetryMiddleware.class);

    private final RetryRegistry registry;

    public RetryMiddleware(WorkflowProperties properties) {
        WorkflowProperties.AgentRetry settings = properties.getAgentRetry();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, settings.getMaxAttempts()))
                .waitDuration(settings.getWaitDuration())
                .retryExceptions(TransientAgentException.class)
                .build();
        this.registry = RetryRegistry.of(config);
        this.registry.getEventPublisher().onEntryAdded(added ->
                added.getAddedEntry().getEventPublisher().onRetry(event ->
                        log.warn("Retrying {} (attempt {}): {}", event.getName(),
                                event.getNumberOfRetryAttempts() + 1,
                                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "")));
    }

    @Override
    public AgentMessage invoke(AgentInvocation invocation, Next next) {
        Retry retry = registry.retry(invocation.agentType().name());
        return retry.executeSupplier(() -> next.proceed(invocation));
    }
}
