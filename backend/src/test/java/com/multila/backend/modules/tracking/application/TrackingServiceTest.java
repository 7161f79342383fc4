package com.multila.backend.modules.tracking.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.multila.backend.global.error.ProblemException;
import com.multila.backend.global.security.ClientPrincipal;
import com.multila.backend.modules.registry.application.ClientUserSessionResolver;
import com.multila.backend.modules.registry.application.SessionRegistryService;
import com.multila.backend.modules.registry.domain.ApplicationSession;
import com.multila.backend.modules.registry.domain.AuthMode;
import com.multila.backend.modules.registry.domain.UserApplicationSession;
import com.multila.backend.modules.registry.infrastructure.persistence.UserApplicationSessionRepository;
import com.multila.backend.modules.tracking.domain.TrackingEvent;
import com.multila.backend.modules.tracking.domain.TrackingSession;
import com.multila.backend.modules.tracking.infrastructure.persistence.TrackingEventRepository;
import com.multila.backend.modules.tracking.infrastructure.persistence.TrackingSessionRepository;
import com.multila.backend.modules.tracking.presentation.dto.CloseTrackingSessionRequest;
import com.multila.backend.modules.tracking.presentation.dto.OpenTrackingSessionRequest;
import com.multila.backend.modules.tracking.presentation.dto.TrackingEventRequest;
import com.multila.backend.support.DomainFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class TrackingServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final OffsetDateTime NOW_UTC = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private TrackingSessionRepository trackingSessionRepository;
    @Mock
    private TrackingEventRepository trackingEventRepository;
    @Mock
    private UserApplicationSessionRepository userApplicationSessionRepository;
    @Mock
    private SessionRegistryService sessionRegistryService;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private TrackingService trackingService;
    private UserApplicationSession userSession;
    private ClientPrincipal principal;

    @BeforeEach
    void setUp() {
        trackingService = new TrackingService(trackingSessionRepository, trackingEventRepository,
                new ClientUserSessionResolver(userApplicationSessionRepository, sessionRegistryService),
                sessionRegistryService, objectMapper,
                Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofSeconds(30));
        ApplicationSession applicationSession = DomainFixtures.applicationSession("S1", AuthMode.NONE);
        userSession = DomainFixtures.anonymousUserSession(10L, "u-code", applicationSession, NOW_UTC);
        principal = new ClientPrincipal(1L, null, 10L, "S1");
        lenient().when(sessionRegistryService.configPayload(any())).thenReturn(Map.of("exercises", Map.of()));
    }

    @Test
    void openingClosesThePreviouslyOpenSession() {
        TrackingSession previous = trackingSession(4L, NOW_UTC.minusMinutes(20));
        when(userApplicationSessionRepository.findByIdForUpdate(10L)).thenReturn(Optional.of(userSession));
        when(trackingSessionRepository.findOpenByUserAppSessionId(10L)).thenReturn(List.of(previous));
        when(trackingSessionRepository.save(any(TrackingSession.class))).thenAnswer(invocation -> {
            TrackingSession saved = invocation.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", 5L);
            return saved;
        });

        Long id = trackingService.open(principal, new OpenTrackingSessionRequest(null, null, Map.of("os", "linux")));

        assertThat(id).isEqualTo(5L);
        assertThat(previous.isOpen()).isFalse();
        assertThat(previous.getEndTime()).isEqualTo(NOW_UTC);
        verify(trackingSessionRepository).flush();
        ArgumentCaptor<TrackingSession> captor = ArgumentCaptor.forClass(TrackingSession.class);
        verify(trackingSessionRepository).save(captor.capture());
        assertThat(captor.getValue().getStartTime()).isEqualTo(NOW_UTC);
        assertThat(captor.getValue().getAppConfigSnapshot()).containsKey("exercises");
    }

    @Test
    void openingForAnotherApplicationSessionIsRejected() {
        assertThatThrownBy(() -> trackingService.open(principal, new OpenTrackingSessionRequest("S2", null, null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVALID_TOKEN"));
    }

    @Test
    void registeredUserMustNameTheApplicationSession() {
        ClientPrincipal registered = new ClientPrincipal(2L, UUID.randomUUID(), null, null);

        assertThatThrownBy(() -> trackingService.open(registered, new OpenTrackingSessionRequest(null, null, null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("VALIDATION_ERROR"));
    }

    @Test
    void eventIsStoredForOwnOpenSession() {
        TrackingSession session = trackingSession(5L, NOW_UTC.minusMinutes(1));
        when(trackingSessionRepository.findWithOwner(5L)).thenReturn(Optional.of(session));

        trackingService.append(principal, event(5L, "mouse",
                "{\"frames\":[[\"m\",1,2,0.1]],\"timeElapsed\":0.5}"));

        ArgumentCaptor<TrackingEvent> captor = ArgumentCaptor.forClass(TrackingEvent.class);
        verify(trackingEventRepository).save(captor.capture());
        assertThat(captor.getValue().getEventType()).isEqualTo("mouse");
        assertThat(captor.getValue().getEventValue().has("frames")).isTrue();
    }

    @Test
    void eventForForeignSessionLooksClosed() {
        UserApplicationSession other = DomainFixtures.anonymousUserSession(99L, "other", userSession.getApplicationSession(), NOW_UTC);
        TrackingSession foreign = new TrackingSession(other, NOW_UTC, Map.of(), null);
        when(trackingSessionRepository.findWithOwner(7L)).thenReturn(Optional.of(foreign));

        assertThatThrownBy(() -> trackingService.append(principal, event(7L, "visibility", "{\"state\":\"visible\"}")))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("TRACKING_SESSION_CLOSED"));
        verify(trackingEventRepository, never()).save(any());
    }

    @Test
    void eventAfterGracePeriodIsRejected() {
        TrackingSession session = trackingSession(5L, NOW_UTC.minusMinutes(10));
        session.close(NOW_UTC.minusMinutes(2), NOW_UTC.minusMinutes(2));
        when(trackingSessionRepository.findWithOwner(5L)).thenReturn(Optional.of(session));

        assertThatThrownBy(() -> trackingService.append(principal, event(5L, "visibility", "{\"state\":\"visible\"}")))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("TRACKING_SESSION_CLOSED"));
    }

    @Test
    void lateEventWithinGracePeriodIsStored() {
        TrackingSession session = trackingSession(5L, NOW_UTC.minusMinutes(10));
        session.close(NOW_UTC.minusSeconds(10), NOW_UTC.minusSeconds(10));
        when(trackingSessionRepository.findWithOwner(5L)).thenReturn(Optional.of(session));

        trackingService.append(principal, event(5L, "visibility", "{\"state\":\"hidden\"}"));

        verify(trackingEventRepository).save(any(TrackingEvent.class));
    }

    @Test
    void malformedEventIsNotStored() {
        TrackingSession session = trackingSession(5L, NOW_UTC.minusMinutes(1));
        when(trackingSessionRepository.findWithOwner(5L)).thenReturn(Optional.of(session));

        assertThatThrownBy(() -> trackingService.append(principal, event(5L, "mouse", "{\"frames\":\"oops\"}")))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("MALFORMED_EVENT"));
        assertThatThrownBy(() -> trackingService.append(principal, event(5L, "visibility", "[\"visible\"]")))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("MALFORMED_EVENT"));
        verify(trackingEventRepository, never()).save(any());
    }

    @ParameterizedTest
    @ValueSource(strings = {"[1,2,3]", "\"clicked\"", "42", "true", "{\"x\":1}"})
    void unknownEventTypeKeepsAnyJsonValue(String json) throws Exception {
        TrackingSession session = trackingSession(5L, NOW_UTC.minusMinutes(1));
        when(trackingSessionRepository.findWithOwner(5L)).thenReturn(Optional.of(session));

        trackingService.append(principal, event(5L, "custom_click", json));

        ArgumentCaptor<TrackingEvent> captor = ArgumentCaptor.forClass(TrackingEvent.class);
        verify(trackingEventRepository).save(captor.capture());
        assertThat(captor.getValue().getEventType()).isEqualTo("custom_click");
        assertThat(captor.getValue().getEventValue()).isEqualTo(objectMapper.readTree(json));
    }

    @Test
    void nullValueIsStoredAsNull() {
        TrackingSession session = trackingSession(5L, NOW_UTC.minusMinutes(1));
        when(trackingSessionRepository.findWithOwner(5L)).thenReturn(Optional.of(session));

        trackingService.append(principal, event(5L, "page_loaded", "null"));

        ArgumentCaptor<TrackingEvent> captor = ArgumentCaptor.forClass(TrackingEvent.class);
        verify(trackingEventRepository).save(captor.capture());
        assertThat(captor.getValue().getEventValue()).isNull();
    }

    @Test
    void closingTwiceKeepsFirstEndTime() {
        TrackingSession session = trackingSession(5L, NOW_UTC.minusMinutes(10));
        when(trackingSessionRepository.findWithOwner(5L)).thenReturn(Optional.of(session));

        trackingService.close(principal, new CloseTrackingSessionRequest(5L, NOW_UTC.minusMinutes(1)));
        trackingService.close(principal, new CloseTrackingSessionRequest(5L, NOW_UTC));

        assertThat(session.getEndTime()).isEqualTo(NOW_UTC.minusMinutes(1));
    }

    private TrackingSession trackingSession(long id, OffsetDateTime start) {
        TrackingSession session = new TrackingSession(userSession, start, Map.of(), null);
        ReflectionTestUtils.setField(session, "id", id);
        return session;
    }

    private TrackingEventRequest event(long trackingSessionId, String type, String json) {
        try {
            JsonNode value = objectMapper.readTree(json);
            return new TrackingEventRequest(trackingSessionId, NOW_UTC, type, value);
        } catch (Exception ex) {
            throw new IllegalStateException(ex);
        }
    }
}
