package com.prfactory.core.persistence;

import com.prfactory.core.model.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link CheckpointStore}. Not durable across restarts.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCheckpointStore.class);

    private final ConcurrentHashMap<Key, Checkpoint> checkpoints = new ConcurrentHashMap<>();

    @Override
    public void saveCheckpoint(String ticketId, String graphId, String checkpointId, Map<String, Object> state) {
        Objects.requireNonNull(checkpointId, "checkpointId");
        var checkpoint = new Checkpoint(ticketId, graphId, checkpointId, state, Instant.now());
        checkpoints.put(new Key(ticketId, graphId), checkpoint);
        log.debug("Saved checkpoint '{}' for {}/{}", checkpointId, ticketId, graphId);
    }

    @Override
    public Optional<Checkpoint> loadLatest(String ticketId, String graphId) {
        return Optional.ofNullable(checkpoints.get(new Key(ticketId, graphId)));
    }

    public int size() {
        return checkpoints.size();
    }

    private record Key(String ticketId, String graphId) {
    }
}
