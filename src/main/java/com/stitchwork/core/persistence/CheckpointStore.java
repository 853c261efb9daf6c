package com.stitchwork.core.persistence;

import com.stitchwork.core.workspace.WorkspaceSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Storage for checkpoints and the workspace snapshots taken with them.
 */
public interface CheckpointStore {

    void save(Checkpoint checkpoint, WorkspaceSnapshot snapshot);

    Optional<Checkpoint> load(String checkpointId);

    Optional<WorkspaceSnapshot> loadSnapshot(String checkpointId);

    /**
     * All checkpoints, oldest first.
     */
    List<Checkpoint> list();

    boolean delete(String checkpointId);
}
