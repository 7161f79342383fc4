package com.multila.backend.modules.tracking.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import org.junit.jupiter.api.Test;

class TrackingSessionTest {

    private static final OffsetDateTime START = OffsetDateTime.of(2024, 3, 1, 10, 0, 0, 0, ZoneOffset.UTC);

    @Test
    void closeKeepsFirstEndTime() {
        TrackingSession session = new TrackingSession(null, START, Map.of(), null);

        session.close(START.plusMinutes(5), START.plusMinutes(5));
        session.close(START.plusMinutes(9), START.plusMinutes(9));

        assertThat(session.isOpen()).isFalse();
        assertThat(session.getEndTime()).isEqualTo(START.plusMinutes(5));
    }

    @Test
    void endTimeNeverPrecedesStart() {
        TrackingSession session = new TrackingSession(null, START, null, null);

        session.close(START.minusMinutes(1), START.plusMinutes(1));

        assertThat(session.getEndTime()).isEqualTo(START);
        assertThat(session.getDeviceInfo()).isEmpty();
    }

    @Test
    void closedSessionAcceptsEventsOnlyWithinGracePeriod() {
        TrackingSession session = new TrackingSession(null, START, Map.of(), null);
        OffsetDateTime closedAt = START.plusMinutes(10);
        session.close(closedAt, closedAt);

        assertThat(session.acceptsEventsAt(closedAt.plusSeconds(30), Duration.ofSeconds(30))).isTrue();
        assertThat(session.acceptsEventsAt(closedAt.plusSeconds(31), Duration.ofSeconds(30))).isFalse();
    }
}
