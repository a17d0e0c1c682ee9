package com.prfactory.core.audit;

import com.prfactory.core.events.EventBus;
import com.prfactory.core.events.WorkflowEvent;
import com.prfactory.core.persistence.AuditStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Append-only, per-ticket record of agent executions and workflow events.
 * <p>
 * Subscribes to every event on the {@link EventBus}; agent executions are
 * recorded by the executor's audit middleware. Entries go to the configured
 * {@link AuditStore}, which is told when a ticket's workflow has ended.
 */
@Service
public class AuditTrail {

    private static final Logger log = LoggerFactory.getLogger("prfactory.audit");

    private final AuditStore store;

    public AuditTrail(EventBus eventBus, AuditStore store) {
        this.store = store;
        eventBus.subscribeAll(this::onEvent);
        // registered after subscribeAll, so the terminal event itself is stored first
        eventBus.subscribe(WorkflowEvent.Terminal.class, event -> store.workflowEnded(event.ticketId()));
    }

    public void record(String ticketId, String graphId, String category, String action, String detail) {
        store.append(new AuditEntry(ticketId, graphId, category, action, detail, Instant.now()));
        log.info("[{}] {} {} {}: {}", ticketId, graphId, category, action, detail);
    }

    public List<AuditEntry> entriesFor(String ticketId) {
        return store.entriesFor(ticketId);
    }

    private void onEvent(WorkflowEvent event) {
        record(event.ticketId(), event.graphId(), "event", event.eventType(), event.describe());
    }
}
