package com.multila.backend.modules.tracking.domain;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import com.fasterxml.jackson.databind.JsonNode;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Append-only fact recorded in a tracking session. The generated id reflects arrival order and breaks
 * ties between equal {@code eventTime}s. The value is any JSON document, or null.
 */
@Entity
@Immutable
@Table(name = "tracking_event")
public class TrackingEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "tracking_session_id", nullable = false, updatable = false)
    private TrackingSession trackingSession;

    @Column(name = "event_time", nullable = false, updatable = false)
    private OffsetDateTime eventTime;

    @Column(name = "event_type", nullable = false, updatable = false, length = 128)
    private String eventType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "event_value", updatable = false, columnDefinition = "jsonb")
    private JsonNode eventValue;

    @Column(name = "received_at", nullable = false, updatable = false)
    private OffsetDateTime receivedAt;

    protected TrackingEvent() {
    }

    public TrackingEvent(TrackingSession trackingSession, OffsetDateTime eventTime, String eventType,
                         JsonNode eventValue, OffsetDateTime receivedAt) {
        this.trackingSession = trackingSession;
        this.eventTime = eventTime;
        this.eventType = eventType;
        this.eventValue = eventValue;
        this.receivedAt = receivedAt;
    }

    public Long getId() {
        return id;
    }

    public TrackingSession getTrackingSession() {
        return trackingSession;
    }

    public OffsetDateTime getEventTime() {
        return eventTime;
    }

    public String getEventType() {
        return eventType;
    }

    public JsonNode getEventValue() {
        return eventValue;
    }

    public OffsetDateTime getReceivedAt() {
        return receivedAt;
    }
}
