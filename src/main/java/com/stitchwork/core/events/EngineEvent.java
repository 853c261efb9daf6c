package com.stitchwork.core.events;

/**
 * Payload of an event emitted on the {@link EventBus}. Implementations are immutable records.
 */
public interface EngineEvent {

    /**
     * The node the event relates to, or null for run-level events.
     */
    default String nodeId() {
        return null;
    }
}
