package com.stitchwork.core.events;

import java.time.Instant;

/**
 * An emitted event as stored in the bus log and delivered to subscribers.
 *
 * @param sequence  position in the bus log, strictly increasing per bus
 * @param type      simple name of the payload type, e.g. "NodeStartEvent"
 * @param nodeId    emitting node (nullable for run-level events)
 * @param payload   the typed event
 * @param timestamp when the event was emitted
 */
public record Event(
    long sequence,
    String type,
    String nodeId,
    EngineEvent payload,
    Instant timestamp
) {

    public <T extends EngineEvent> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }

    public boolean is(Class<? extends EngineEvent> type) {
        return type.isInstance(payload);
    }
}
