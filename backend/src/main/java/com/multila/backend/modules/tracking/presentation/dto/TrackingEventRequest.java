package com.multila.backend.modules.tracking.presentation.dto;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record TrackingEventRequest(
        @JsonProperty("tracking_session_id") @NotNull(message = "tracking_session_id is required") Long trackingSessionId,
        @JsonProperty("event_time") @NotNull(message = "event_time is required") OffsetDateTime eventTime,
        @JsonProperty("event_type") @NotBlank(message = "event_type is required")
        @Size(max = 128, message = "event_type must have at most 128 characters") String eventType,
        @JsonProperty("event_value") JsonNode eventValue
) {
}
