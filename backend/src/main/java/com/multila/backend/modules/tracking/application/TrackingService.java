package com.multila.backend.modules.tracking.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import com.multila.backend.global.error.ProblemException;
import com.multila.backend.global.security.ClientPrincipal;
import com.multila.backend.modules.registry.application.ClientUserSessionResolver;
import com.multila.backend.modules.registry.application.SessionRegistryService;
import com.multila.backend.modules.registry.domain.UserApplicationSession;
import com.multila.backend.modules.tracking.domain.TrackingEvent;
import com.multila.backend.modules.tracking.domain.TrackingSession;
import com.multila.backend.modules.tracking.domain.payload.EventPayload;
import com.multila.backend.modules.tracking.domain.payload.EventPayloadParser;
import com.multila.backend.modules.tracking.domain.payload.MalformedEventException;
import com.multila.backend.modules.tracking.infrastructure.persistence.TrackingEventRepository;
import com.multila.backend.modules.tracking.infrastructure.persistence.TrackingSessionRepository;
import com.multila.backend.modules.tracking.presentation.dto.CloseTrackingSessionRequest;
import com.multila.backend.modules.tracking.presentation.dto.OpenTrackingSessionRequest;
import com.multila.backend.modules.tracking.presentation.dto.TrackingEventRequest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Ingestion of tracking sessions and their events on behalf of an authenticated client.
 */
@Service
public class TrackingService {

    private static final Logger log = LoggerFactory.getLogger(TrackingService.class);

    private final TrackingSessionRepository trackingSessionRepository;
    private final TrackingEventRepository trackingEventRepository;
    private final ClientUserSessionResolver userSessionResolver;
    private final SessionRegistryService sessionRegistryService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration closedGracePeriod;

    public TrackingService(
            TrackingSessionRepository trackingSessionRepository,
            TrackingEventRepository trackingEventRepository,
            ClientUserSessionResolver userSessionResolver,
            SessionRegistryService sessionRegistryService,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${multila.tracking.closed-grace-period:PT30S}") Duration closedGracePeriod
    ) {
        this.trackingSessionRepository = trackingSessionRepository;
        this.trackingEventRepository = trackingEventRepository;
        this.userSessionResolver = userSessionResolver;
        this.sessionRegistryService = sessionRegistryService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.closedGracePeriod = closedGracePeriod;
    }

    /**
     * Opens a tracking session for the caller's user application session, closing any session of it that
     * is still open. The parent row is locked so concurrent opens serialise.
     */
    @Transactional
    public Long open(ClientPrincipal principal, OpenTrackingSessionRequest request) {
        UserApplicationSession userSession = userSessionResolver.lockUserSession(principal, request.sessCode());
        OffsetDateTime now = now();
        OffsetDateTime startTime = request.startTime() != null ? request.startTime() : now;

        List<TrackingSession> stillOpen = trackingSessionRepository.findOpenByUserAppSessionId(userSession.getId());
        for (TrackingSession previous : stillOpen) {
            previous.close(now, now);
            log.info("Closed tracking session {} superseded by a new one", previous.getId());
        }
        if (!stillOpen.isEmpty()) {
            trackingSessionRepository.flush();
        }

        Map<String, Object> configSnapshot = sessionRegistryService.configPayload(userSession.getApplicationSession());
        TrackingSession created = trackingSessionRepository.save(
                new TrackingSession(userSession, startTime, request.deviceInfo(), configSnapshot));
        log.info("Opened tracking session {} for user application session {}", created.getId(), userSession.getId());
        return created.getId();
    }

    /**
     * Stores one event. Malformed values are rejected before anything is written.
     */
    @Transactional
    public void append(ClientPrincipal principal, TrackingEventRequest request) {
        TrackingSession trackingSession = findOwnedSession(principal, request.trackingSessionId());
        if (!trackingSession.acceptsEventsAt(now(), closedGracePeriod)) {
            throw sessionClosed(request.trackingSessionId());
        }

        JsonNode value = isAbsent(request.eventValue()) ? null : request.eventValue();
        EventPayload payload;
        try {
            payload = EventPayloadParser.parse(request.eventType(), value == null ? null : objectMapper.convertValue(value, Object.class));
        } catch (MalformedEventException ex) {
            log.warn("Dropped malformed event of type '{}' for tracking session {}: {}", ex.getEventType(),
                    request.trackingSessionId(), ex.getMessage());
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "MALFORMED_EVENT", ex.getMessage(), ex);
        }

        trackingEventRepository.save(new TrackingEvent(trackingSession, request.eventTime(), payload.eventType(), value, now()));
        log.debug("Stored {} event for tracking session {}", payload.eventType(), trackingSession.getId());
    }

    /**
     * Closes a tracking session. Closing twice is harmless and keeps the first end time.
     */
    @Transactional
    public Long close(ClientPrincipal principal, CloseTrackingSessionRequest request) {
        TrackingSession trackingSession = findOwnedSession(principal, request.trackingSessionId());
        OffsetDateTime now = now();
        if (trackingSession.isOpen()) {
            trackingSession.close(request.endTime() != null ? request.endTime() : now, now);
            log.info("Closed tracking session {}", trackingSession.getId());
        }
        return trackingSession.getId();
    }

    private TrackingSession findOwnedSession(ClientPrincipal principal, Long trackingSessionId) {
        return trackingSessionRepository.findWithOwner(trackingSessionId)
                .filter(trackingSession -> isOwner(principal, trackingSession.getUserAppSession()))
                .orElseThrow(() -> sessionClosed(trackingSessionId));
    }

    private static boolean isOwner(ClientPrincipal principal, UserApplicationSession userSession) {
        if (principal.anonymous()) {
            return userSession.getId().equals(principal.userAppSessionId());
        }
        return userSession.getUser() != null && userSession.getUser().getId().equals(principal.userId());
    }

    private static boolean isAbsent(JsonNode eventValue) {
        return eventValue == null || eventValue.isNull() || eventValue.isMissingNode();
    }

    private static ProblemException sessionClosed(Long trackingSessionId) {
        return new ProblemException(HttpStatus.CONFLICT, "TRACKING_SESSION_CLOSED",
                "tracking session " + trackingSessionId + " is unknown or closed");
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
