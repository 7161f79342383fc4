package com.multila.backend.modules.replay.presentation.dto;

import com.multila.backend.modules.replay.domain.ReplayState;

import jakarta.validation.constraints.NotBlank;

public record ReplayMessageRequest(
        ReplayState state,
        String origin,
        @NotBlank(message = "msgtype is required") String msgtype,
        Object data
) {
}
