package com.multila.backend.modules.registry.infrastructure.persistence;

import java.util.List;

import com.multila.backend.modules.registry.domain.Application;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface ApplicationRepository extends JpaRepository<Application, Long> {

    @Query("""
            select a from Application a
            join fetch a.defaultApplicationSession s
            where s.active = true
            """)
    List<Application> findAllWithActiveDefaultSession();
}
