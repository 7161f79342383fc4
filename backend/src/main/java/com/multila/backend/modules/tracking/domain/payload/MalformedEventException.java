package com.multila.backend.modules.tracking.domain.payload;

public class MalformedEventException extends RuntimeException {

    private final String eventType;

    public MalformedEventException(String eventType, String message) {
        super(message);
        this.eventType = eventType;
    }

    public String getEventType() {
        return eventType;
    }
}
