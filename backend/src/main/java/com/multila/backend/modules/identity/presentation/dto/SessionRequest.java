package com.multila.backend.modules.identity.presentation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;

public record SessionRequest(
        @JsonProperty("sess") @JsonAlias("application_session_code")
        @NotBlank(message = "sess is required") String sessCode
) {
}
