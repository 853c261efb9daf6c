package com.stitchwork.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of one node, attached to it for the rest of the run and carried in checkpoints.
 *
 * @param nodeId       the node this summary belongs to
 * @param status       terminal status
 * @param patches      accepted patches (absolute offsets in the node's source file)
 * @param artifacts    produced artifacts
 * @param writtenPaths overlay paths written while persisting the result
 * @param message      agent message or skip reason
 * @param error        error detail for failed nodes, null otherwise
 * @param attempts     number of execution attempts
 * @param elapsedMs    wall-clock execution time in milliseconds
 */
public record ResultSummary(
    String nodeId,
    NodeStatus status,
    List<Patch> patches,
    List<Artifact> artifacts,
    List<String> writtenPaths,
    String message,
    String error,
    int attempts,
    long elapsedMs
) implements Serializable {

    public ResultSummary {
        patches = patches == null ? List.of() : List.copyOf(patches);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        writtenPaths = writtenPaths == null ? List.of() : List.copyOf(writtenPaths);
    }

    public static ResultSummary failed(String nodeId, String error, int attempts, long elapsedMs) {
        return new ResultSummary(nodeId, NodeStatus.FAILED, List.of(), List.of(), List.of(),
                null, error, attempts, elapsedMs);
    }

    public static ResultSummary skipped(String nodeId, String reason) {
        return new ResultSummary(nodeId, NodeStatus.SKIPPED, List.of(), List.of(), List.of(),
                reason, null, 0, 0L);
    }

    public boolean succeeded() {
        return status == NodeStatus.SUCCEEDED;
    }

    public String brief() {
        String outcome = status.name().toLowerCase();
        if (error != null) {
            return outcome + ": " + error;
        }
        return outcome + " (" + patches.size() + " patches, " + artifacts.size() + " artifacts)"
                + (message != null ? ": " + message : "");
    }
}
