package com.multila.backend.modules.feedback.infrastructure.persistence;

import com.multila.backend.modules.feedback.domain.UserFeedback;

import org.springframework.data.jpa.repository.JpaRepository;

public interface UserFeedbackRepository extends JpaRepository<UserFeedback, Long> {

    boolean existsByUserAppSessionIdAndContentSection(Long userAppSessionId, String contentSection);
}
