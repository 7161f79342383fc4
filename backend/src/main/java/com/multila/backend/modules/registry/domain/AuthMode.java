package com.multila.backend.modules.registry.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How users of an application session are identified.
 */
public enum AuthMode {
    /** Anonymous users, identified only by their bearer token. */
    NONE,
    /** Registered users who log in with credentials. */
    LOGIN;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }
}
