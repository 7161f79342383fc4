package com.multila.backend.modules.registry.domain;

import java.time.OffsetDateTime;

import com.multila.backend.modules.identity.domain.PlatformUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * One user's run of an application session. {@code user} is null exactly for anonymous runs
 * (application sessions with {@link AuthMode#NONE}).
 */
@Entity
@Table(name = "user_app_session")
public class UserApplicationSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "code", nullable = false, unique = true, updatable = false, length = 64)
    private String code;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "application_session_code", nullable = false, updatable = false)
    private ApplicationSession applicationSession;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", updatable = false)
    private PlatformUser user;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected UserApplicationSession() {
    }

    public static UserApplicationSession anonymous(String code, ApplicationSession applicationSession,
                                                   OffsetDateTime createdAt) {
        if (applicationSession.requiresLogin()) {
            throw new IllegalArgumentException("application session " + applicationSession.getCode()
                    + " requires a registered user");
        }
        UserApplicationSession session = new UserApplicationSession();
        session.code = code;
        session.applicationSession = applicationSession;
        session.createdAt = createdAt;
        return session;
    }

    public Long getId() {
        return id;
    }

    public String getCode() {
        return code;
    }

    public ApplicationSession getApplicationSession() {
        return applicationSession;
    }

    public PlatformUser getUser() {
        return user;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public boolean isAnonymous() {
        return user == null;
    }
}
