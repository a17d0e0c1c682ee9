package com.prfactory.core.audit;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One reviewable transition in a ticket's history.
 *
 * @param category "agent" for agent executions, "event" for workflow events
 */
public record AuditEntry(
        @JsonProperty("ticket_id") String ticketId,
        @JsonProperty("graph_id") String graphId,
        @JsonProperty("category") String category,
        @JsonProperty("action") String action,
        @JsonProperty("detail") String detail,
        @JsonProperty("timestamp") Instant timestamp
) {
}
