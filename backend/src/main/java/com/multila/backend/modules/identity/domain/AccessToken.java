package com.multila.backend.modules.identity.domain;

import java.time.OffsetDateTime;

import com.multila.backend.modules.registry.domain.UserApplicationSession;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;

/**
 * Opaque bearer credential of a client application. Bound either to a registered user or to exactly
 * one anonymous user application session, never both.
 */
@Entity
@Table(name = "access_token")
public class AccessToken {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "token", nullable = false, unique = true, updatable = false, length = 64)
    private String token;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", updatable = false)
    private PlatformUser user;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_app_session_id", updatable = false)
    private UserApplicationSession userAppSession;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "revoked_at")
    private OffsetDateTime revokedAt;

    protected AccessToken() {
    }

    public static AccessToken forAnonymous(String token, UserApplicationSession userAppSession, OffsetDateTime now) {
        if (!userAppSession.isAnonymous()) {
            throw new IllegalArgumentException("user application session is not anonymous");
        }
        AccessToken accessToken = new AccessToken();
        accessToken.token = token;
        accessToken.userAppSession = userAppSession;
        accessToken.createdAt = now;
        return accessToken;
    }

    public Long getId() {
        return id;
    }

    public String getToken() {
        return token;
    }

    public PlatformUser getUser() {
        return user;
    }

    public UserApplicationSession getUserAppSession() {
        return userAppSession;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }

    public boolean isRegistered() {
        return user != null;
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public void revoke(OffsetDateTime now) {
        if (revokedAt == null) {
            revokedAt = now;
        }
    }
}
