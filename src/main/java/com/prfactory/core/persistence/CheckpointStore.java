package com.prfactory.core.persistence;

import com.prfactory.core.model.Checkpoint;

import java.util.Map;
import java.util.Optional;

/**
 * Durable store holding the single latest checkpoint per (ticket, graph) pair.
 * <p>
 * Saving replaces whatever was stored for the pair before; there is no history.
 */
public interface CheckpointStore {

    void saveCheckpoint(String ticketId, String graphId, String checkpointId, Map<String, Object> state);

    Optional<Checkpoint> loadLatest(String ticketId, String graphId);
}
