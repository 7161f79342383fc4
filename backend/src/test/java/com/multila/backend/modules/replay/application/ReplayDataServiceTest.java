package com.multila.backend.modules.replay.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.multila.backend.global.error.ProblemException;
import com.multila.backend.modules.registry.domain.ApplicationSession;
import com.multila.backend.modules.registry.domain.AuthMode;
import com.multila.backend.modules.registry.domain.UserApplicationSession;
import com.multila.backend.modules.tracking.domain.TrackingEvent;
import com.multila.backend.modules.tracking.domain.TrackingSession;
import com.multila.backend.modules.tracking.infrastructure.persistence.TrackingEventRepository;
import com.multila.backend.modules.tracking.infrastructure.persistence.TrackingSessionRepository;
import com.multila.backend.support.DomainFixtures;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class ReplayDataServiceTest {

    private static final OffsetDateTime START = OffsetDateTime.of(2024, 3, 1, 10, 0, 0, 0, ZoneOffset.UTC);

    @Mock
    private TrackingSessionRepository trackingSessionRepository;
    @Mock
    private TrackingEventRepository trackingEventRepository;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ReplayDataService service;

    @BeforeEach
    void setUp() {
        service = new ReplayDataService(trackingSessionRepository, trackingEventRepository, objectMapper,
                "https://admin.example.org");
    }

    @Test
    void describeUsesRecordedConfigAndSessionUrl() {
        ApplicationSession applicationSession = DomainFixtures.applicationSession("S1", AuthMode.NONE);
        UserApplicationSession userSession = DomainFixtures.anonymousUserSession(10L, "u", applicationSession, START);
        TrackingSession trackingSession = new TrackingSession(userSession, START, Map.of(), Map.of("recorded", true));
        ReflectionTestUtils.setField(trackingSession, "id", 42L);
        when(trackingSessionRepository.findWithOwner(42L)).thenReturn(Optional.of(trackingSession));
        when(trackingEventRepository.countByTrackingSessionId(42L)).thenReturn(3L);

        ReplayDataService.ReplayDescriptor descriptor = service.describe(42L);

        assertThat(descriptor.liveUrl()).isEqualTo("https://apps.example.org/demo/?sess=S1");
        assertThat(descriptor.replayUrl()).isEqualTo("https://apps.example.org/demo/?sess=S1&replay=42");
        assertThat(descriptor.embedOrigin()).isEqualTo("https://apps.example.org");
        assertThat(descriptor.controllerOrigin()).isEqualTo("https://admin.example.org");
        assertThat(descriptor.config()).containsEntry("recorded", true);
        assertThat(descriptor.eventCount()).isEqualTo(3L);
    }

    @Test
    void describeOfUnknownSessionIsNotFound() {
        when(trackingSessionRepository.findWithOwner(7L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.describe(7L))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("TRACKING_SESSION_NOT_FOUND"));
    }

    @Test
    void mouseChunkKeepsReplayableFramesInTimeOrder() {
        Map<String, Object> value = Map.of(
                "frames", List.of(
                        List.of("c", 5, 5, 0.9),
                        List.of("x", 1, 1, 0.1),
                        List.of("m", 3, 4, 0.2),
                        List.of("S", 0, 120, 0.5)),
                "timeElapsed", 1.0);

        Map<String, Object> chunk = ReplayDataService.replayableMouseChunk(value);

        assertThat((List<Object>) chunk.get("frames")).containsExactly(
                List.of("m", 3, 4, 0.2),
                List.of("S", 0, 120, 0.5),
                List.of("c", 5, 5, 0.9));
        assertThat(chunk).containsEntry("timeElapsed", 1.0);
    }

    @Test
    void nonReplayableEventsAreFlagged() {
        TrackingEvent event = new TrackingEvent(null, START, "custom_widget", objectMapper.valueToTree(Map.of("a", 1)), START);

        Map<String, Object> data = service.toReplayData(event);

        assertThat(data).containsEntry("replayable", false)
                .containsEntry("event_type", "custom_widget")
                .containsEntry("event_value", Map.of("a", 1));
    }

    @Test
    void opaqueArrayValueIsPassedThrough() {
        TrackingEvent event = new TrackingEvent(null, START, "custom_click", objectMapper.valueToTree(List.of(1, 2, 3)), START);

        Map<String, Object> data = service.toReplayData(event);

        assertThat(data).containsEntry("replayable", false)
                .containsEntry("event_value", List.of(1, 2, 3));
    }

    @Test
    void originDropsPathAndQuery() {
        assertThat(ReplayDataService.originOf("http://localhost:8081/app/?sess=S1")).isEqualTo("http://localhost:8081");
    }

    @Test
    void negativeIndexHasNoEvent() {
        assertThat(service.event(1L, -1)).isEmpty();
    }
}
