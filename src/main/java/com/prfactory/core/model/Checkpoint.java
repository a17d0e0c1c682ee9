package com.prfactory.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Latest continuation for one (ticket, graph) pair.
 *
 * @param ticketId     ticket the checkpoint belongs to
 * @param graphId      graph that owns the checkpoint
 * @param checkpointId logical state name, e.g. {@code awaiting_answers}
 * @param state        schema-free state map
 * @param createdAt    when the checkpoint was written
 */
public record Checkpoint(
        String ticketId,
        String graphId,
        String checkpointId,
        Map<String, Object> state,
        Instant createdAt
) {

    public Checkpoint {
        state = Collections.unmodifiableMap(new LinkedHashMap<>(state));
    }
}
