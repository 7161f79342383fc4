package com.multila.backend.modules.identity.presentation.dto;

import java.util.UUID;

public record RegisterUserResponse(UUID id, String username, String email) {
}
