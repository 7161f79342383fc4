package com.multila.backend.modules.tracking.infrastructure.persistence;

import java.util.List;

import com.multila.backend.modules.tracking.domain.TrackingEvent;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TrackingEventRepository extends JpaRepository<TrackingEvent, Long> {

    long countByTrackingSessionId(Long trackingSessionId);

    /**
     * Events of a session in replay order: event time, then arrival.
     */
    List<TrackingEvent> findByTrackingSessionIdOrderByEventTimeAscIdAsc(Long trackingSessionId, Pageable pageable);
}
