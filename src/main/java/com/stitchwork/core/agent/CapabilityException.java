package com.stitchwork.core.agent;

import com.stitchwork.core.EngineException;

/**
 * Thrown when a relevance oracle or generator fails or returns unusable output.
 */
public class CapabilityException extends EngineException {

    public CapabilityException(String message) {
        super(message);
    }

    public CapabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
