package com.multila.backend.modules.tracking.domain;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import com.multila.backend.modules.registry.domain.UserApplicationSession;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One continuous device-interaction window of a user application session. At most one session per
 * user application session has no {@code endTime}.
 */
@Entity
@Table(name = "tracking_session")
public class TrackingSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_app_session_id", nullable = false, updatable = false)
    private UserApplicationSession userAppSession;

    @Column(name = "start_time", nullable = false, updatable = false)
    private OffsetDateTime startTime;

    @Column(name = "end_time")
    private OffsetDateTime endTime;

    /** Server time at which {@link #endTime} was set. */
    @Column(name = "closed_at")
    private OffsetDateTime closedAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "device_info", nullable = false, updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> deviceInfo = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "app_config_snapshot", updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> appConfigSnapshot;

    protected TrackingSession() {
    }

    public TrackingSession(UserApplicationSession userAppSession, OffsetDateTime startTime,
                           Map<String, Object> deviceInfo, Map<String, Object> appConfigSnapshot) {
        this.userAppSession = userAppSession;
        this.startTime = startTime;
        this.deviceInfo = deviceInfo == null ? new LinkedHashMap<>() : new LinkedHashMap<>(deviceInfo);
        this.appConfigSnapshot = appConfigSnapshot;
    }

    public Long getId() {
        return id;
    }

    public UserApplicationSession getUserAppSession() {
        return userAppSession;
    }

    public OffsetDateTime getStartTime() {
        return startTime;
    }

    public OffsetDateTime getEndTime() {
        return endTime;
    }

    public OffsetDateTime getClosedAt() {
        return closedAt;
    }

    public Map<String, Object> getDeviceInfo() {
        return deviceInfo;
    }

    public Map<String, Object> getAppConfigSnapshot() {
        return appConfigSnapshot;
    }

    public boolean isOpen() {
        return endTime == null;
    }

    /**
     * Closes the session; closing an already closed session keeps the first end time.
     */
    public void close(OffsetDateTime endTime, OffsetDateTime closedAt) {
        if (this.endTime != null) {
            return;
        }
        this.endTime = endTime.isBefore(startTime) ? startTime : endTime;
        this.closedAt = closedAt;
    }

    /**
     * Open sessions accept events; closed ones only until {@code gracePeriod} has passed since closing.
     */
    public boolean acceptsEventsAt(OffsetDateTime now, Duration gracePeriod) {
        if (isOpen()) {
            return true;
        }
        OffsetDateTime reference = closedAt != null ? closedAt : endTime;
        return !now.isAfter(reference.plus(gracePeriod));
    }
}
