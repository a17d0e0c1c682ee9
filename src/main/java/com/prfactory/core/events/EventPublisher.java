package com.prfactory.core.events;

/**
 * Receives workflow lifecycle events from the core.
 */
public interface EventPublisher {

    void publish(WorkflowEvent event);
}
