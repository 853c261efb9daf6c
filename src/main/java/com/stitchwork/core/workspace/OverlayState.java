package com.stitchwork.core.workspace;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Serializable copy of one workspace's overlay.
 *
 * @param workspaceId id of the captured workspace
 * @param ownerNodeId node that owns it
 * @param writes      written paths and their content
 * @param deletions   tombstoned paths
 */
public record OverlayState(
    String workspaceId,
    String ownerNodeId,
    Map<String, byte[]> writes,
    List<String> deletions
) {

    public OverlayState {
        writes = writes == null ? Map.of() : new TreeMap<>(writes);
        deletions = deletions == null ? List.of() : List.copyOf(deletions);
    }
}
