package com.multila.backend.modules.identity.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.multila.backend.modules.identity.domain.PlatformUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PlatformUserRepository extends JpaRepository<PlatformUser, UUID> {

    Optional<PlatformUser> findByUsername(String username);

    @Query("select u from PlatformUser u where lower(u.email) = lower(:email)")
    Optional<PlatformUser> findByEmailIgnoreCase(@Param("email") String email);

    boolean existsByUsername(String username);

    @Query("select count(u) > 0 from PlatformUser u where lower(u.email) = lower(:email)")
    boolean existsByEmailIgnoreCase(@Param("email") String email);
}
