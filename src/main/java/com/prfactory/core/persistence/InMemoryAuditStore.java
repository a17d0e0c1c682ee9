package com.prfactory.core.persistence;

import com.prfactory.core.audit.AuditEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Process-local {@link AuditStore} with bounded retention.
 * <p>
 * Entries of tickets with a running or suspended workflow are always kept. Once a
 * workflow ends its ticket joins a queue of ended tickets; when that queue exceeds
 * {@code retainedEndedWorkflows} the ticket that ended first loses its entries.
 * A ticket that receives new entries leaves the queue again.
 */
public class InMemoryAuditStore implements AuditStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAuditStore.class);

    private final int retainedEndedWorkflows;

    private final Map<String, List<AuditEntry>> entries = new HashMap<>();

    /** Tickets whose workflow has ended, oldest first. */
    private final LinkedHashSet<String> ended = new LinkedHashSet<>();

    public InMemoryAuditStore(int retainedEndedWorkflows) {
        if (retainedEndedWorkflows < 0) {
            throw new IllegalArgumentException("retainedEndedWorkflows must not be negative: " + retainedEndedWorkflows);
        }
        this.retainedEndedWorkflows = retainedEndedWorkflows;
    }

    @Override
    public synchronized void append(AuditEntry entry) {
        entries.computeIfAbsent(entry.ticketId(), k -> new ArrayList<>()).add(entry);
        ended.remove(entry.ticketId());
    }

    @Override
    public synchronized List<AuditEntry> entriesFor(String ticketId) {
        List<AuditEntry> list = entries.get(ticketId);
        return list == null ? List.of() : List.copyOf(list);
    }

    @Override
    public synchronized void workflowEnded(String ticketId) {
        if (!entries.containsKey(ticketId)) {
            return;
        }
        ended.add(ticketId);
        Iterator<String> oldest = ended.iterator();
        while (ended.size() > retainedEndedWorkflows) {
            String expired = oldest.next();
            oldest.remove();
            entries.remove(expired);
            log.debug("Expired audit entries of ticket {}", expired);
        }
    }

    public synchronized int ticketCount() {
        return entries.size();
    }
}
