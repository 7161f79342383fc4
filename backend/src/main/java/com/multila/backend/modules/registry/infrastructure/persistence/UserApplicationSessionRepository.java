package com.multila.backend.modules.registry.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.multila.backend.modules.registry.domain.UserApplicationSession;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserApplicationSessionRepository extends JpaRepository<UserApplicationSession, Long> {

    @Query("""
            select uas from UserApplicationSession uas
            join fetch uas.applicationSession s
            where s.code = :appSessCode and uas.user.id = :userId
            """)
    Optional<UserApplicationSession> findRegistered(
            @Param("appSessCode") String appSessCode,
            @Param("userId") UUID userId
    );

    /**
     * Creates the user application session of a registered user unless it already exists. Concurrent
     * first contacts serialise on the partial unique index; the loser inserts nothing.
     */
    @Modifying
    @Query(value = """
            insert into user_app_session (code, application_session_code, user_id, created_at)
            values (:code, :appSessCode, :userId, :createdAt)
            on conflict (application_session_code, user_id) where user_id is not null do nothing
            """, nativeQuery = true)
    int insertRegisteredIfAbsent(
            @Param("code") String code,
            @Param("appSessCode") String appSessCode,
            @Param("userId") UUID userId,
            @Param("createdAt") OffsetDateTime createdAt
    );

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select uas from UserApplicationSession uas where uas.id = :id")
    Optional<UserApplicationSession> findByIdForUpdate(@Param("id") Long id);
}
