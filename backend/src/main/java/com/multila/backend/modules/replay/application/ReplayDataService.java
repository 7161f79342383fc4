package com.multila.backend.modules.replay.application;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.multila.backend.global.error.ProblemException;
import com.multila.backend.modules.registry.domain.ApplicationSession;
import com.multila.backend.modules.tracking.domain.TrackingEvent;
import com.multila.backend.modules.tracking.domain.TrackingSession;
import com.multila.backend.modules.tracking.domain.payload.EventPayloadParser;
import com.multila.backend.modules.tracking.domain.payload.MalformedEventException;
import com.multila.backend.modules.tracking.domain.payload.MousePayload;
import com.multila.backend.modules.tracking.infrastructure.persistence.TrackingEventRepository;
import com.multila.backend.modules.tracking.infrastructure.persistence.TrackingSessionRepository;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read side of a recorded tracking session for replay.
 */
@Service
public class ReplayDataService {

    static final Set<String> REPLAYABLE_FRAME_KINDS = Set.of("m", "c", "s", "S", "i", "o");

    private final TrackingSessionRepository trackingSessionRepository;
    private final TrackingEventRepository trackingEventRepository;
    private final ObjectMapper objectMapper;
    private final String controllerOrigin;

    public ReplayDataService(
            TrackingSessionRepository trackingSessionRepository,
            TrackingEventRepository trackingEventRepository,
            ObjectMapper objectMapper,
            @Value("${multila.replay.controller-origin:http://localhost:5173}") String controllerOrigin
    ) {
        this.trackingSessionRepository = trackingSessionRepository;
        this.trackingEventRepository = trackingEventRepository;
        this.objectMapper = objectMapper;
        this.controllerOrigin = controllerOrigin;
    }

    @Transactional(readOnly = true)
    public ReplayDescriptor describe(Long trackingSessionId) {
        TrackingSession trackingSession = trackingSessionRepository.findWithOwner(trackingSessionId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "TRACKING_SESSION_NOT_FOUND",
                        "unknown tracking session " + trackingSessionId));
        ApplicationSession applicationSession = trackingSession.getUserAppSession().getApplicationSession();
        String sessionUrl = applicationSession.sessionUrl();
        Map<String, Object> config = trackingSession.getAppConfigSnapshot() != null
                ? trackingSession.getAppConfigSnapshot()
                : applicationSession.getConfig().getConfig();
        return new ReplayDescriptor(
                trackingSession.getId(),
                sessionUrl + "&replay=" + trackingSession.getId(),
                sessionUrl,
                originOf(sessionUrl),
                controllerOrigin,
                config == null ? Map.of() : new LinkedHashMap<>(config),
                trackingEventRepository.countByTrackingSessionId(trackingSession.getId())
        );
    }

    /**
     * The {@code index}-th event of a session in event-time then arrival order.
     */
    @Transactional(readOnly = true)
    public Optional<Map<String, Object>> event(Long trackingSessionId, int index) {
        if (index < 0) {
            return Optional.empty();
        }
        List<TrackingEvent> page = trackingEventRepository.findByTrackingSessionIdOrderByEventTimeAscIdAsc(
                trackingSessionId, PageRequest.of(index, 1));
        return page.stream().findFirst().map(this::toReplayData);
    }

    @SuppressWarnings("unchecked")
    Map<String, Object> toReplayData(TrackingEvent event) {
        Object value = event.getEventValue() == null ? null : objectMapper.convertValue(event.getEventValue(), Object.class);
        boolean replayable;
        try {
            replayable = EventPayloadParser.parse(event.getEventType(), value).replayable();
        } catch (MalformedEventException ex) {
            replayable = false;
        }
        if (replayable && MousePayload.TYPE.equals(event.getEventType())) {
            value = replayableMouseChunk((Map<String, Object>) value);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("event_time", event.getEventTime().toInstant().toString());
        data.put("event_type", event.getEventType());
        data.put("replayable", replayable);
        data.put("event_value", value);
        return data;
    }

    /**
     * Keeps only the frame kinds the player understands, ordered by their trailing time offset.
     */
    static Map<String, Object> replayableMouseChunk(Map<String, Object> value) {
        Map<String, Object> chunk = new LinkedHashMap<>(value);
        List<List<?>> frames = new ArrayList<>();
        for (Object raw : (List<?>) value.get("frames")) {
            List<?> frame = (List<?>) raw;
            if (REPLAYABLE_FRAME_KINDS.contains(String.valueOf(frame.get(0)))) {
                frames.add(frame);
            }
        }
        frames.sort(Comparator.comparingDouble(frame -> ((Number) frame.get(frame.size() - 1)).doubleValue()));
        chunk.put("frames", frames);
        return chunk;
    }

    static String originOf(String url) {
        try {
            URI uri = new URI(url);
            return uri.getScheme() + "://" + uri.getRawAuthority();
        } catch (URISyntaxException ex) {
            throw new IllegalStateException("application URL is not a valid URI: " + url, ex);
        }
    }

    public record ReplayDescriptor(
            Long trackingSessionId,
            String replayUrl,
            String liveUrl,
            String embedOrigin,
            String controllerOrigin,
            Map<String, Object> config,
            long eventCount
    ) {
    }
}
