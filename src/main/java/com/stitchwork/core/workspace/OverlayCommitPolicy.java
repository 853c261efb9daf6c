package com.stitchwork.core.workspace;

/**
 * Decides how an overlay is promoted when a caller commits a workspace.
 * <p>
 * Implementations must either apply the overlay completely or throw; they must never drop
 * writes silently.
 */
@FunctionalInterface
public interface OverlayCommitPolicy {

    CommitResult commit(Workspace workspace, BaseLayer base);
}
