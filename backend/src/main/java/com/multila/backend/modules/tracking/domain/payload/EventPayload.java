package com.multila.backend.modules.tracking.domain.payload;

/**
 * Validated shape of an event value, selected by the event type.
 */
public interface EventPayload {

    String eventType();

    /** Whether the replay surface can interpret this payload. */
    default boolean replayable() {
        return true;
    }
}
