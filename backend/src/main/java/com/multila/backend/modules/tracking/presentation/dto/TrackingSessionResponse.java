package com.multila.backend.modules.tracking.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TrackingSessionResponse(@JsonProperty("tracking_session_id") Long trackingSessionId) {
}
