package com.multila.backend.modules.tracking.domain.payload;

/**
 * Event of a type without a known schema. Stored and exported untouched.
 */
public record OpaquePayload(String eventType) implements EventPayload {

    @Override
    public boolean replayable() {
        return false;
    }
}
