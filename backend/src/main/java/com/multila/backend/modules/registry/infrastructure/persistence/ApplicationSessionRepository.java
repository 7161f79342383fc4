package com.multila.backend.modules.registry.infrastructure.persistence;

import java.util.Optional;

import com.multila.backend.modules.registry.domain.ApplicationSession;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ApplicationSessionRepository extends JpaRepository<ApplicationSession, String> {

    @EntityGraph(attributePaths = {"config", "config.application"})
    Optional<ApplicationSession> findByCode(String code);
}
