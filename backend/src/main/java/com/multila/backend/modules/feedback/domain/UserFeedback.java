package com.multila.backend.modules.feedback.domain;

import java.time.OffsetDateTime;

import com.multila.backend.modules.registry.domain.UserApplicationSession;
import com.multila.backend.modules.tracking.domain.TrackingSession;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

/**
 * Feedback of one user application session on one content section of the application. The tracking
 * session is null when tracking was disabled or declined.
 */
@Entity
@Immutable
@Table(name = "user_feedback")
public class UserFeedback {

    public static final int MIN_SCORE = 1;
    public static final int MAX_SCORE = 5;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_app_session_id", nullable = false, updatable = false)
    private UserApplicationSession userAppSession;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "tracking_session_id", updatable = false)
    private TrackingSession trackingSession;

    /** XPath of the content section. */
    @Column(name = "content_section", nullable = false, updatable = false, length = 1024)
    private String contentSection;

    @Column(name = "score", updatable = false)
    private Short score;

    @Column(name = "text", updatable = false, columnDefinition = "text")
    private String text;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected UserFeedback() {
    }

    public UserFeedback(UserApplicationSession userAppSession, TrackingSession trackingSession, String contentSection,
                        Integer score, String text, OffsetDateTime createdAt) {
        if (score == null && text == null) {
            throw new IllegalArgumentException("either score or text must be given");
        }
        if (score != null && (score < MIN_SCORE || score > MAX_SCORE)) {
            throw new IllegalArgumentException("score must be between " + MIN_SCORE + " and " + MAX_SCORE);
        }
        this.userAppSession = userAppSession;
        this.trackingSession = trackingSession;
        this.contentSection = contentSection;
        this.score = score == null ? null : score.shortValue();
        this.text = text;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public UserApplicationSession getUserAppSession() {
        return userAppSession;
    }

    public TrackingSession getTrackingSession() {
        return trackingSession;
    }

    public String getContentSection() {
        return contentSection;
    }

    public Integer getScore() {
        return score == null ? null : score.intValue();
    }

    public String getText() {
        return text;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
