package com.multila.backend.modules.identity.application;

import java.util.Map;

import com.multila.backend.modules.registry.domain.AuthMode;

/**
 * Outcome of a session bootstrap or login. {@code token}, {@code userCode} and {@code config} are null
 * while a login-mode session is still waiting for credentials.
 */
public record ClientSession(
        Outcome outcome,
        String applicationSessionCode,
        AuthMode authMode,
        String token,
        String userCode,
        Map<String, Object> config
) {

    public enum Outcome {
        CREATED,
        RESOLVED,
        LOGIN_REQUIRED
    }

    public static ClientSession loginRequired(String applicationSessionCode) {
        return new ClientSession(Outcome.LOGIN_REQUIRED, applicationSessionCode, AuthMode.LOGIN, null, null, null);
    }
}
