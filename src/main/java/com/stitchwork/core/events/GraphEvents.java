package com.stitchwork.core.events;

import com.stitchwork.core.model.ResultSummary;
import com.stitchwork.core.model.RunStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Event payloads emitted by the executor, the stitcher and the checkpoint manager.
 */
public final class GraphEvents {

    private GraphEvents() {}

    public record GraphStartEvent(String runId, int nodeCount, boolean resumed) implements EngineEvent {}

    /**
     * Terminal event of a run: overall status plus one summary per node.
     */
    public record GraphCompleteEvent(
        String runId,
        RunStatus status,
        Map<String, ResultSummary> results,
        List<String> rejectedPaths
    ) implements EngineEvent {

        public GraphCompleteEvent {
            results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
            rejectedPaths = List.copyOf(rejectedPaths);
        }
    }

    public record NodeStartEvent(String runId, String nodeId, String nodeName, int attempt) implements EngineEvent {}

    /**
     * Emitted exactly once per node when it reaches a terminal status.
     */
    public record NodeCompleteEvent(String runId, String nodeId, ResultSummary summary) implements EngineEvent {}

    public record NodeErrorEvent(
        String runId,
        String nodeId,
        String error,
        int attempt,
        boolean willRetry
    ) implements EngineEvent {}

    /**
     * A sibling group (or a file's top-level spans) was stitched into its target buffer.
     *
     * @param targetNodeId parent node receiving the patches, null for a whole-file merge
     */
    public record PatchBatchMergedEvent(
        String runId,
        String targetNodeId,
        String path,
        int patchCount
    ) implements EngineEvent {

        @Override
        public String nodeId() {
            return targetNodeId;
        }
    }

    public record PatchBatchRejectedEvent(
        String runId,
        String targetNodeId,
        String path,
        String reason,
        List<String> diagnostics
    ) implements EngineEvent {

        public PatchBatchRejectedEvent {
            diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        }

        @Override
        public String nodeId() {
            return targetNodeId;
        }
    }

    public record CheckpointSavedEvent(String runId, String checkpointId, int completedCount) implements EngineEvent {}

    /**
     * A node asks a human for input; answered by a matching {@link HumanInputResponseEvent}.
     */
    public record HumanInputRequestEvent(
        String runId,
        String nodeId,
        String requestId,
        String question,
        List<String> options
    ) implements EngineEvent {

        public HumanInputRequestEvent {
            options = options == null ? List.of() : List.copyOf(options);
        }
    }

    public record HumanInputResponseEvent(String requestId, String response) implements EngineEvent {}
}
