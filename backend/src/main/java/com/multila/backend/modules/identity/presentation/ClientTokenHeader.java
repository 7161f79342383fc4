package com.multila.backend.modules.identity.presentation;

/**
 * Parses the {@code Authorization: Token <token>} header form used by client applications.
 */
public final class ClientTokenHeader {

    public static final String SCHEME_PREFIX = "Token ";

    private ClientTokenHeader() {
    }

    /**
     * @return the token, or null when the header is absent or uses another scheme
     */
    public static String extract(String authorization) {
        if (authorization == null || !authorization.regionMatches(true, 0, SCHEME_PREFIX, 0, SCHEME_PREFIX.length())) {
            return null;
        }
        String token = authorization.substring(SCHEME_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
