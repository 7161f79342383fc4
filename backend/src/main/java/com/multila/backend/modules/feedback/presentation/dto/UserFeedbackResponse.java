package com.multila.backend.modules.feedback.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UserFeedbackResponse(@JsonProperty("user_feedback_id") Long userFeedbackId) {
}
