package com.multila.backend.modules.identity.presentation.dto;

import java.time.OffsetDateTime;

public record AdminTokenResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        OffsetDateTime issuedAt
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";
}
