package com.multila.backend.global.security;

import java.util.UUID;

/**
 * Identity behind a client-application token. Exactly one of {@code userId} and
 * {@code userAppSessionId} is set.
 */
public record ClientPrincipal(Long tokenId, UUID userId, Long userAppSessionId, String applicationSessionCode) {

    public boolean anonymous() {
        return userId == null;
    }
}
