package com.stitchwork.core.persistence;

import com.stitchwork.core.workspace.WorkspaceSnapshot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable store for tests and throwaway runs. State is lost when the JVM exits.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private record Entry(Checkpoint checkpoint, WorkspaceSnapshot snapshot) {}

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    @Override
    public void save(Checkpoint checkpoint, WorkspaceSnapshot snapshot) {
        entries.put(checkpoint.checkpointId(), new Entry(checkpoint, snapshot));
    }

    @Override
    public Optional<Checkpoint> load(String checkpointId) {
        return Optional.ofNullable(entries.get(checkpointId)).map(Entry::checkpoint);
    }

    @Override
    public Optional<WorkspaceSnapshot> loadSnapshot(String checkpointId) {
        return Optional.ofNullable(entries.get(checkpointId)).map(Entry::snapshot);
    }

    @Override
    public List<Checkpoint> list() {
        var all = new ArrayList<Checkpoint>();
        entries.values().forEach(e -> all.add(e.checkpoint()));
        all.sort(Comparator.comparing(Checkpoint::createdAt).thenComparing(Checkpoint::checkpointId));
        return all;
    }

    @Override
    public boolean delete(String checkpointId) {
        return entries.remove(checkpointId) != null;
    }
}
