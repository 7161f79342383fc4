package com.multila.backend.modules.registry.domain;

import com.multila.backend.global.jpa.AbstractTimestampedEntity;

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
 * A learning application hosted at some URL that talks to this API.
 */
@Entity
@Table(name = "application")
public class Application extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", nullable = false, unique = true, length = 64)
    private String name;

    @Column(name = "url", nullable = false, unique = true, length = 512)
    private String url;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "default_application_session_code")
    private ApplicationSession defaultApplicationSession;

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public ApplicationSession getDefaultApplicationSession() {
        return defaultApplicationSession;
    }

    public void setDefaultApplicationSession(ApplicationSession defaultApplicationSession) {
        this.defaultApplicationSession = defaultApplicationSession;
    }

    /**
     * True when {@code referrer} points at this application; a single trailing slash is ignored.
     */
    public boolean matchesReferrer(String referrer) {
        if (referrer == null || url == null) {
            return false;
        }
        return url.equals(referrer) || (referrer.endsWith("/") && (url + "/").equals(referrer));
    }
}
