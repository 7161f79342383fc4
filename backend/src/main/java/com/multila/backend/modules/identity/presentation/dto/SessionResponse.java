package com.multila.backend.modules.identity.presentation.dto;

import java.util.Map;

import com.multila.backend.modules.identity.application.ClientSession;
import com.multila.backend.modules.registry.domain.AuthMode;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionResponse(
        @JsonProperty("sess_code") String sessCode,
        @JsonProperty("auth_mode") AuthMode authMode,
        String token,
        @JsonProperty("user_code") String userCode,
        Map<String, Object> config
) {

    public static SessionResponse from(ClientSession session) {
        return new SessionResponse(
                session.applicationSessionCode(),
                session.authMode(),
                session.token(),
                session.userCode(),
                session.config()
        );
    }
}
