package com.stitchwork.core.persistence;

import com.stitchwork.core.EngineException;

/**
 * A checkpoint cannot be resumed because its workspace snapshot or base layer does not match
 * what it recorded.
 */
public class CheckpointMismatchException extends EngineException {

    public CheckpointMismatchException(String message) {
        super(message);
    }
}
