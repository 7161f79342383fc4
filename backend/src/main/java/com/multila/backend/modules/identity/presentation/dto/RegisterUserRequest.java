package com.multila.backend.modules.identity.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record RegisterUserRequest(
        String username,
        String email,
        @NotBlank(message = "password is required") String password
) {
}
