package com.multila.backend.modules.registry.domain;

import com.multila.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * A shareable instantiation of a configuration. The {@code code} is the public handle distributed to
 * end users, e.g. as {@code ?sess=<code>} on the application URL.
 */
@Entity
@Table(name = "application_session")
public class ApplicationSession extends AbstractTimestampedEntity {

    @Id
    @Column(name = "code", nullable = false, updatable = false, length = 10)
    private String code;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "config_id", nullable = false)
    private ApplicationConfig config;

    @Enumerated(EnumType.STRING)
    @Column(name = "auth_mode", nullable = false, length = 8)
    private AuthMode authMode;

    @Column(name = "description", nullable = false, length = 256)
    private String description = "";

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    protected ApplicationSession() {
    }

    public ApplicationSession(String code, ApplicationConfig config, AuthMode authMode) {
        this.code = code;
        this.config = config;
        this.authMode = authMode;
    }

    public String getCode() {
        return code;
    }

    public ApplicationConfig getConfig() {
        return config;
    }

    public void setConfig(ApplicationConfig config) {
        this.config = config;
    }

    public AuthMode getAuthMode() {
        return authMode;
    }

    public void setAuthMode(AuthMode authMode) {
        this.authMode = authMode;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean requiresLogin() {
        return authMode == AuthMode.LOGIN;
    }

    /**
     * Public URL of this session: the application URL with the session code attached.
     */
    public String sessionUrl() {
        String baseUrl = config.getApplication().getUrl();
        if (!baseUrl.endsWith("/")) {
            baseUrl += "/";
        }
        return baseUrl + "?sess=" + code;
    }
}
