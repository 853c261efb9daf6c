package com.stitchwork.core.persistence;

import com.stitchwork.core.EngineException;

/**
 * Reading or writing the checkpoint store failed.
 */
public class CheckpointStoreException extends EngineException {

    public CheckpointStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
