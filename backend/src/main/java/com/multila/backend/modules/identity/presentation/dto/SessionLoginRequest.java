package com.multila.backend.modules.identity.presentation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;

public record SessionLoginRequest(
        @JsonProperty("sess") @JsonAlias("application_session_code")
        @NotBlank(message = "sess is required") String sessCode,
        String username,
        String email,
        @NotBlank(message = "password is required") String password
) {
}
