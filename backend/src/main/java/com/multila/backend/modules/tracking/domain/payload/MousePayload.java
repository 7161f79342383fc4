package com.multila.backend.modules.tracking.domain.payload;

import java.util.List;

/**
 * One chunk of a mouse trace. Each frame starts with a one-letter kind and ends with its time offset.
 */
public record MousePayload(List<List<Object>> frames, double timeElapsed) implements EventPayload {

    public static final String TYPE = "mouse";

    @Override
    public String eventType() {
        return TYPE;
    }
}
