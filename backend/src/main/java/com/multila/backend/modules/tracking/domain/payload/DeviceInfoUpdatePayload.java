package com.multila.backend.modules.tracking.domain.payload;

public record DeviceInfoUpdatePayload(int width, int height, String formFactor, String userAgent) implements EventPayload {

    public static final String TYPE = "device_info_update";

    @Override
    public String eventType() {
        return TYPE;
    }
}
