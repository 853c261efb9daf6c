package com.stitchwork.core.workspace;

import com.stitchwork.core.EngineException;

/**
 * Isolation or lifecycle violation on a workspace. Fatal to the node that hit it.
 */
public class WorkspaceException extends EngineException {
    public WorkspaceException(String message) {
        super(message);
    }

    public WorkspaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
