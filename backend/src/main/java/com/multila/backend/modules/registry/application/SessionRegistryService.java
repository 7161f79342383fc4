package com.multila.backend.modules.registry.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.multila.backend.global.common.SecureCodeGenerator;
import com.multila.backend.global.error.ProblemException;
import com.multila.backend.modules.identity.domain.PlatformUser;
import com.multila.backend.modules.registry.domain.Application;
import com.multila.backend.modules.registry.domain.ApplicationSession;
import com.multila.backend.modules.registry.domain.UserApplicationSession;
import com.multila.backend.modules.registry.infrastructure.persistence.ApplicationRepository;
import com.multila.backend.modules.registry.infrastructure.persistence.ApplicationSessionRepository;
import com.multila.backend.modules.registry.infrastructure.persistence.UserApplicationSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves application sessions by their public code and creates the per-user runs of them.
 */
@Service
public class SessionRegistryService {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistryService.class);

    private final ApplicationRepository applicationRepository;
    private final ApplicationSessionRepository applicationSessionRepository;
    private final UserApplicationSessionRepository userApplicationSessionRepository;
    private final SecureCodeGenerator codeGenerator;
    private final Clock clock;

    public SessionRegistryService(
            ApplicationRepository applicationRepository,
            ApplicationSessionRepository applicationSessionRepository,
            UserApplicationSessionRepository userApplicationSessionRepository,
            SecureCodeGenerator codeGenerator,
            Clock clock
    ) {
        this.applicationRepository = applicationRepository;
        this.applicationSessionRepository = applicationSessionRepository;
        this.userApplicationSessionRepository = userApplicationSessionRepository;
        this.codeGenerator = codeGenerator;
        this.clock = clock;
    }

    /**
     * @throws ProblemException 404 {@code APP_SESSION_NOT_FOUND} when the code is unknown or disabled
     */
    @Transactional(readOnly = true)
    public ApplicationSession resolveActiveSession(String code) {
        if (code == null || code.isBlank()) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "APP_SESSION_NOT_FOUND");
        }
        return applicationSessionRepository.findByCode(code)
                .filter(ApplicationSession::isActive)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "APP_SESSION_NOT_FOUND",
                        "application session not found: " + code));
    }

    /**
     * Every call creates a new anonymous run; anonymous identities are only reused through their token.
     */
    @Transactional
    public UserApplicationSession createAnonymousUserSession(ApplicationSession applicationSession) {
        UserApplicationSession created = userApplicationSessionRepository.save(
                UserApplicationSession.anonymous(codeGenerator.nextHex(), applicationSession, now()));
        log.info("Created anonymous user application session id={} for application session {}",
                created.getId(), applicationSession.getCode());
        return created;
    }

    /**
     * Idempotent: repeated calls for the same user and application session return the same row.
     */
    @Transactional
    public UserApplicationSession createOrFetchRegisteredUserSession(ApplicationSession applicationSession,
                                                                     PlatformUser user) {
        if (!applicationSession.requiresLogin()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "AUTH_MODE_MISMATCH",
                    "application session " + applicationSession.getCode() + " does not use login");
        }
        Optional<UserApplicationSession> existing =
                userApplicationSessionRepository.findRegistered(applicationSession.getCode(), user.getId());
        if (existing.isPresent()) {
            return existing.get();
        }
        int inserted = userApplicationSessionRepository.insertRegisteredIfAbsent(
                codeGenerator.nextHex(), applicationSession.getCode(), user.getId(), now());
        if (inserted > 0) {
            log.info("Created user application session of user {} for application session {}",
                    user.getId(), applicationSession.getCode());
        }
        return userApplicationSessionRepository.findRegistered(applicationSession.getCode(), user.getId())
                .orElseThrow(() -> new IllegalStateException("user application session vanished after insert"));
    }

    /**
     * Copy of the live configuration payload handed to the client.
     */
    public Map<String, Object> configPayload(ApplicationSession applicationSession) {
        Map<String, Object> config = applicationSession.getConfig().getConfig();
        return config == null ? new LinkedHashMap<>() : new LinkedHashMap<>(config);
    }

    @Transactional(readOnly = true)
    public Optional<String> findDefaultSessionCode(String referrer) {
        if (referrer == null || referrer.isBlank()) {
            return Optional.empty();
        }
        return applicationRepository.findAllWithActiveDefaultSession().stream()
                .filter(application -> application.matchesReferrer(referrer))
                .map(Application::getDefaultApplicationSession)
                .map(ApplicationSession::getCode)
                .findFirst();
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
