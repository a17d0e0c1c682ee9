package com.prfactory.core.graph;

import com.prfactory.core.persistence.InMemoryCheckpointStore;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory checkpoint store that also remembers every checkpoint name it was asked to save.
 */
public class RecordingCheckpointStore extends InMemoryCheckpointStore {

    private final List<String> saved = new CopyOnWriteArrayList<>();

    @Override
    public void saveCheckpoint(String ticketId, String graphId, String checkpointId, Map<String, Object> state) {
        saved.add(checkpointId);
        super.saveCheckpoint(ticketId, graphId, checkpointId, state);
    }

    public List<String> saved() {
        return List.copyOf(saved);
    }

    public void clearHistory() {
        saved.clear();
    }
}
