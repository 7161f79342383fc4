package com.multila.backend.modules.tracking.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.multila.backend.modules.tracking.domain.TrackingSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TrackingSessionRepository extends JpaRepository<TrackingSession, Long> {

    @Query("select ts from TrackingSession ts where ts.userAppSession.id = :userAppSessionId and ts.endTime is null")
    List<TrackingSession> findOpenByUserAppSessionId(@Param("userAppSessionId") Long userAppSessionId);

    @Query("""
            select ts from TrackingSession ts
            join fetch ts.userAppSession uas
            join fetch uas.applicationSession s
            join fetch s.config c
            join fetch c.application
            left join fetch uas.user
            where ts.id = :id
            """)
    Optional<TrackingSession> findWithOwner(@Param("id") Long id);
}
