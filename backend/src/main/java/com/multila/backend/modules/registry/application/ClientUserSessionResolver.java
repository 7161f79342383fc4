package com.multila.backend.modules.registry.application;

import com.multila.backend.global.error.ProblemException;
import com.multila.backend.global.security.ClientPrincipal;
import com.multila.backend.modules.registry.domain.ApplicationSession;
import com.multila.backend.modules.registry.domain.UserApplicationSession;
import com.multila.backend.modules.registry.infrastructure.persistence.UserApplicationSessionRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Finds the user application session a client token acts in. Anonymous tokens are bound to one;
 * registered tokens name it through the application session code.
 */
@Component
public class ClientUserSessionResolver {

    private final UserApplicationSessionRepository userApplicationSessionRepository;
    private final SessionRegistryService sessionRegistryService;

    public ClientUserSessionResolver(
            UserApplicationSessionRepository userApplicationSessionRepository,
            SessionRegistryService sessionRegistryService
    ) {
        this.userApplicationSessionRepository = userApplicationSessionRepository;
        this.sessionRegistryService = sessionRegistryService;
    }

    /**
     * Resolves and row-locks the caller's user application session for the rest of the transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public UserApplicationSession lockUserSession(ClientPrincipal principal, String sessCode) {
        if (principal.anonymous()) {
            if (sessCode != null && !sessCode.equals(principal.applicationSessionCode())) {
                throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_TOKEN",
                        "token belongs to a different application session");
            }
            return userApplicationSessionRepository.findByIdForUpdate(principal.userAppSessionId())
                    .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_TOKEN"));
        }

        if (sessCode == null || sessCode.isBlank()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_ERROR",
                    "sess is required for registered users");
        }
        ApplicationSession applicationSession = sessionRegistryService.resolveActiveSession(sessCode);
        if (!applicationSession.requiresLogin()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "AUTH_MODE_MISMATCH",
                    "application session " + sessCode + " does not use login");
        }
        Long userSessionId = userApplicationSessionRepository.findRegistered(sessCode, principal.userId())
                .map(UserApplicationSession::getId)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED",
                        "log in to application session " + sessCode + " first"));
        return userApplicationSessionRepository.findByIdForUpdate(userSessionId)
                .orElseThrow(() -> new IllegalStateException("user application session " + userSessionId + " vanished"));
    }
}
