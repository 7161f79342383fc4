package com.multila.backend.modules.registry.infrastructure.persistence;

import java.util.Optional;

import com.multila.backend.modules.registry.domain.ApplicationSessionGate;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ApplicationSessionGateRepository extends JpaRepository<ApplicationSessionGate, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select g from ApplicationSessionGate g where g.code = :code")
    Optional<ApplicationSessionGate> findByCodeForUpdate(@Param("code") String code);
}
