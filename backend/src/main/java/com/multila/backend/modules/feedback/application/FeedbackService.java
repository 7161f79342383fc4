package com.multila.backend.modules.feedback.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.multila.backend.global.error.ProblemException;
import com.multila.backend.global.security.ClientPrincipal;
import com.multila.backend.modules.feedback.domain.UserFeedback;
import com.multila.backend.modules.feedback.infrastructure.persistence.UserFeedbackRepository;
import com.multila.backend.modules.feedback.presentation.dto.UserFeedbackRequest;
import com.multila.backend.modules.registry.application.ClientUserSessionResolver;
import com.multila.backend.modules.registry.domain.UserApplicationSession;
import com.multila.backend.modules.tracking.domain.TrackingSession;
import com.multila.backend.modules.tracking.infrastructure.persistence.TrackingSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stores user feedback on content sections, at most one item per user application session and section.
 */
@Service
public class FeedbackService {

    private static final Logger log = LoggerFactory.getLogger(FeedbackService.class);

    private final UserFeedbackRepository userFeedbackRepository;
    private final TrackingSessionRepository trackingSessionRepository;
    private final ClientUserSessionResolver userSessionResolver;
    private final Clock clock;

    public FeedbackService(
            UserFeedbackRepository userFeedbackRepository,
            TrackingSessionRepository trackingSessionRepository,
            ClientUserSessionResolver userSessionResolver,
            Clock clock
    ) {
        this.userFeedbackRepository = userFeedbackRepository;
        this.trackingSessionRepository = trackingSessionRepository;
        this.userSessionResolver = userSessionResolver;
        this.clock = clock;
    }

    @Transactional
    public Long submit(ClientPrincipal principal, UserFeedbackRequest request) {
        if (request.score() == null && request.text() == null) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_ERROR",
                    "either score or text must be given");
        }
        UserApplicationSession userSession = userSessionResolver.lockUserSession(principal, request.sessCode());
        TrackingSession trackingSession = null;
        if (request.trackingSessionId() != null) {
            trackingSession = trackingSessionRepository.findWithOwner(request.trackingSessionId())
                    .filter(candidate -> candidate.getUserAppSession().getId().equals(userSession.getId()))
                    .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "TRACKING_SESSION_NOT_FOUND",
                            "unknown tracking session " + request.trackingSessionId()));
        }
        if (userFeedbackRepository.existsByUserAppSessionIdAndContentSection(userSession.getId(), request.contentSection())) {
            throw alreadyGiven(request.contentSection());
        }

        UserFeedback saved;
        try {
            saved = userFeedbackRepository.saveAndFlush(new UserFeedback(userSession, trackingSession,
                    request.contentSection(), request.score(), request.text(), OffsetDateTime.now(clock)));
        } catch (DataIntegrityViolationException ex) {
            throw alreadyGiven(request.contentSection());
        }
        log.info("Stored feedback {} of user application session {}", saved.getId(), userSession.getId());
        return saved.getId();
    }

    private static ProblemException alreadyGiven(String contentSection) {
        return new ProblemException(HttpStatus.CONFLICT, "FEEDBACK_ALREADY_GIVEN",
                "feedback for content section " + contentSection + " was already given");
    }
}
