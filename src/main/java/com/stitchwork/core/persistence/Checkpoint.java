package com.stitchwork.core.persistence;

import com.stitchwork.core.model.ResultSummary;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Durable record of a run's progress.
 *
 * @param checkpointId         unique id, {@code <runId>-<sequence>}
 * @param runId                the run
 * @param createdAt            when it was taken
 * @param baseRef              base layer of the run's workspaces
 * @param workspaceSnapshotRef ref of the workspace snapshot stored alongside
 * @param completed            terminal node summaries in completion order
 * @param pending              nodes still to run
 * @param lastEventSequence    last event sequence emitted before the checkpoint
 */
public record Checkpoint(
    String checkpointId,
    String runId,
    Instant createdAt,
    String baseRef,
    String workspaceSnapshotRef,
    Map<String, ResultSummary> completed,
    List<String> pending,
    long lastEventSequence
) {

    public Checkpoint {
        Objects.requireNonNull(checkpointId, "checkpointId must not be null");
        Objects.requireNonNull(runId, "runId must not be null");
        completed = completed == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(completed));
        pending = pending == null ? List.of() : List.copyOf(pending);
    }

    public int completedCount() {
        return completed.size();
    }
}
