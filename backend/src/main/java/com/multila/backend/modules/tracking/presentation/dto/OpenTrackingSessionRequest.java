package com.multila.backend.modules.tracking.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

public record OpenTrackingSessionRequest(
        @JsonProperty("sess") String sessCode,
        @JsonProperty("start_time") OffsetDateTime startTime,
        @JsonProperty("device_info") Map<String, Object> deviceInfo
) {
}
