package com.multila.backend.modules.tracking.presentation.dto;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotNull;

public record CloseTrackingSessionRequest(
        @JsonProperty("tracking_session_id") @NotNull(message = "tracking_session_id is required") Long trackingSessionId,
        @JsonProperty("end_time") OffsetDateTime endTime
) {
}
