package com.multila.backend.modules.registry.infrastructure.persistence;

import com.multila.backend.modules.registry.domain.ApplicationConfig;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ApplicationConfigRepository extends JpaRepository<ApplicationConfig, Long> {
}
