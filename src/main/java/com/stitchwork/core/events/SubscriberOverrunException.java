package com.stitchwork.core.events;

import com.stitchwork.core.EngineException;

/**
 * Raised to a subscriber that fell behind and was disconnected because its queue filled up.
 */
public class SubscriberOverrunException extends EngineException {
    public SubscriberOverrunException(String message) {
        super(message);
    }
}
