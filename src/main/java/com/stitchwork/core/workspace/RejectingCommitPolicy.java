package com.stitchwork.core.workspace;

/**
 * Default commit policy: refuses every commit and leaves the overlay untouched.
 */
public class RejectingCommitPolicy implements OverlayCommitPolicy {

    @Override
    public CommitResult commit(Workspace workspace, BaseLayer base) {
        throw new WorkspaceException("Commit is not supported for workspace " + workspace.id()
                + " (" + workspace.writtenPaths().size() + " pending writes kept in overlay)");
    }
}
