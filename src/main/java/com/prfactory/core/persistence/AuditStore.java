package com.prfactory.core.persistence;

import com.prfactory.core.audit.AuditEntry;

import java.util.List;

/**
 * Append-only storage for a ticket's audit entries.
 */
public interface AuditStore {

    void append(AuditEntry entry);

    /** Entries of the ticket in the order they were appended; empty when none are kept. */
    List<AuditEntry> entriesFor(String ticketId);

    /**
     * Signals that the ticket's current workflow run has ended. Stores with bounded
     * capacity may expire the entries of ended runs from here on; durable stores keep them.
     */
    default void workflowEnded(String ticketId) {
    }
}
