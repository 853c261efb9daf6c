package com.stitchwork.core.workspace;

import java.util.List;

/**
 * Outcome of promoting a workspace overlay.
 */
public record CommitResult(String workspaceId, boolean applied, List<String> paths, String message) {

    public CommitResult {
        paths = paths == null ? List.of() : List.copyOf(paths);
    }
}
