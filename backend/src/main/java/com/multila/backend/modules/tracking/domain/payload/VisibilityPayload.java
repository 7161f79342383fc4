package com.multila.backend.modules.tracking.domain.payload;

public record VisibilityPayload(boolean visible) implements EventPayload {

    public static final String TYPE = "visibility";

    @Override
    public String eventType() {
        return TYPE;
    }
}
