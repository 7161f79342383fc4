package com.multila.backend.modules.feedback.presentation.dto;

import com.multila.backend.modules.feedback.domain.UserFeedback;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UserFeedbackRequest(
        @JsonProperty("sess") String sessCode,
        @JsonProperty("tracking_session_id") Long trackingSessionId,
        @JsonProperty("content_section") @NotBlank(message = "content_section is required")
        @Size(max = 1024, message = "content_section must have at most 1024 characters") String contentSection,
        @Min(value = UserFeedback.MIN_SCORE, message = "score must be between 1 and 5")
        @Max(value = UserFeedback.MAX_SCORE, message = "score must be between 1 and 5") Integer score,
        String text
) {
}
