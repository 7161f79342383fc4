package com.multila.backend.modules.identity.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.multila.backend.modules.identity.domain.AccessToken;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccessTokenRepository extends JpaRepository<AccessToken, Long> {

    @EntityGraph(attributePaths = {"user", "userAppSession", "userAppSession.applicationSession"})
    Optional<AccessToken> findByTokenAndRevokedAtIsNull(String token);

    @Query("select t from AccessToken t where t.user.id = :userId and t.revokedAt is null")
    Optional<AccessToken> findActiveByUserId(@Param("userId") UUID userId);

    /**
     * Inserts the single live token of a registered user unless one already exists.
     *
     * @return number of inserted rows (0 when another request won the race)
     */
    @Modifying
    @Query(value = """
            insert into access_token (token, user_id, created_at)
            values (:token, :userId, :createdAt)
            on conflict (user_id) where user_id is not null and revoked_at is null do nothing
            """, nativeQuery = true)
    int insertUserTokenIfAbsent(
            @Param("token") String token,
            @Param("userId") UUID userId,
            @Param("createdAt") OffsetDateTime createdAt
    );
}
