package com.stitchwork.core.executor;

import com.stitchwork.core.model.ResultSummary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time view of a run: terminal summaries, nodes still to run, and the last event
 * sequence seen. This is what checkpoints persist and what {@link GraphExecutor#resume} starts from.
 *
 * @param runId             the run
 * @param baseRef           base layer the run's workspaces fork from
 * @param completed         summaries of every terminal node, in completion order
 * @param pending           ids of nodes not yet terminal
 * @param lastEventSequence sequence of the last event emitted before the snapshot
 */
public record ExecutorState(
    String runId,
    String baseRef,
    Map<String, ResultSummary> completed,
    List<String> pending,
    long lastEventSequence
) {

    public ExecutorState {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(baseRef, "baseRef must not be null");
        completed = completed == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(completed));
        pending = pending == null ? List.of() : List.copyOf(pending);
    }

    public boolean isFinished() {
        return pending.isEmpty();
    }

    public List<String> completedIds() {
        return new ArrayList<>(completed.keySet());
    }
}
