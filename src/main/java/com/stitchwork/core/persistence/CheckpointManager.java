package com.stitchwork.core.persistence;

import com.stitchwork.core.executor.ExecutorState;
import com.stitchwork.core.metrics.EngineMetrics;
import com.stitchwork.core.workspace.WorkspaceManager;
import com.stitchwork.core.workspace.WorkspaceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Takes and restores checkpoints: executor state plus the workspace snapshot it depends on.
 *
 * <p>A checkpoint records the ref of its workspace snapshot. Resuming recomputes the snapshot's
 * digest and refuses to continue if it no longer matches, or if the base layer the snapshot
 * sits on is not registered with the target {@link WorkspaceManager}.
 */
public class CheckpointManager {

    private static final Logger log = LoggerFactory.getLogger(CheckpointManager.class);

    private final CheckpointStore store;
    private final EngineMetrics metrics;
    private final Clock clock;

    public CheckpointManager(CheckpointStore store) {
        this(store, null, Clock.systemUTC());
    }

    public CheckpointManager(CheckpointStore store, EngineMetrics metrics, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.metrics = metrics;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Persists {@code state} together with {@code snapshot}.
     *
     * @return the stored checkpoint
     * @throws IllegalArgumentException if the snapshot belongs to a different base layer
     */
    public Checkpoint snapshot(ExecutorState state, WorkspaceSnapshot snapshot) {
        if (!state.baseRef().equals(snapshot.baseRef())) {
            throw new IllegalArgumentException("Snapshot base " + snapshot.baseRef()
                    + " does not match run base " + state.baseRef());
        }
        String id = checkpointId(state.runId(), state.lastEventSequence());
        var checkpoint = new Checkpoint(id, state.runId(), clock.instant(), state.baseRef(),
                snapshot.snapshotRef(), state.completed(), state.pending(), state.lastEventSequence());
        store.save(checkpoint, snapshot);
        if (metrics != null) {
            metrics.recordCheckpoint();
        }
        log.info("Checkpoint {} saved ({} completed, {} pending, {} overlay(s))",
                id, checkpoint.completedCount(), checkpoint.pending().size(), snapshot.overlays().size());
        return checkpoint;
    }

    /**
     * Restores the checkpoint's workspaces into {@code workspaces} and returns the executor state
     * to resume from.
     *
     * @throws NoSuchElementException      if no checkpoint has this id
     * @throws CheckpointMismatchException if the stored snapshot is missing, altered, or sits on an
     *                                     unregistered base layer
     */
    public ExecutorState resume(String checkpointId, WorkspaceManager workspaces) {
        Checkpoint checkpoint = load(checkpointId);
        WorkspaceSnapshot snapshot = store.loadSnapshot(checkpointId)
                .orElseThrow(() -> new CheckpointMismatchException(
                        "Workspace snapshot for checkpoint " + checkpointId + " is missing"));
        return resume(checkpoint, snapshot, workspaces);
    }

    /**
     * Like {@link #resume(String, WorkspaceManager)} but with a snapshot supplied by the caller.
     */
    public ExecutorState resume(Checkpoint checkpoint, WorkspaceSnapshot snapshot, WorkspaceManager workspaces) {
        String id = checkpoint.checkpointId();
        if (!snapshot.snapshotRef().equals(checkpoint.workspaceSnapshotRef())) {
            throw new CheckpointMismatchException("Checkpoint " + id + " expects snapshot "
                    + checkpoint.workspaceSnapshotRef() + " but got " + snapshot.snapshotRef());
        }
        if (!snapshot.verifyRef()) {
            throw new CheckpointMismatchException("Workspace snapshot for checkpoint " + id
                    + " does not match its recorded digest");
        }
        if (!snapshot.baseRef().equals(checkpoint.baseRef()) || !workspaces.hasBase(snapshot.baseRef())) {
            throw new CheckpointMismatchException("Base layer " + snapshot.baseRef()
                    + " for checkpoint " + id + " is not available");
        }
        workspaces.restore(snapshot, checkpoint.runId());
        log.info("Resuming run {} from checkpoint {} ({} pending)",
                checkpoint.runId(), id, checkpoint.pending().size());
        return new ExecutorState(checkpoint.runId(), checkpoint.baseRef(), checkpoint.completed(),
                checkpoint.pending(), checkpoint.lastEventSequence());
    }

    /**
     * @throws NoSuchElementException if no checkpoint has this id
     */
    public Checkpoint load(String checkpointId) {
        return store.load(checkpointId)
                .orElseThrow(() -> new NoSuchElementException("No checkpoint " + checkpointId));
    }

    public Optional<WorkspaceSnapshot> loadSnapshot(String checkpointId) {
        return store.loadSnapshot(checkpointId);
    }

    public List<Checkpoint> list() {
        return store.list();
    }

    public List<Checkpoint> list(String runId) {
        return store.list().stream().filter(c -> c.runId().equals(runId)).toList();
    }

    public Optional<Checkpoint> latest(String runId) {
        List<Checkpoint> all = list(runId);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    public boolean delete(String checkpointId) {
        boolean removed = store.delete(checkpointId);
        if (removed) {
            log.info("Deleted checkpoint {}", checkpointId);
        }
        return removed;
    }

    static String checkpointId(String runId, long sequence) {
        return runId + "-" + String.format("%08d", sequence);
    }
}
