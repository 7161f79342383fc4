package com.multila.backend.modules.identity.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.multila.backend.global.common.SecureCodeGenerator;
import com.multila.backend.global.error.ProblemException;
import com.multila.backend.global.security.ClientPrincipal;
import com.multila.backend.modules.identity.domain.AccessToken;
import com.multila.backend.modules.identity.domain.PlatformUser;
import com.multila.backend.modules.identity.infrastructure.persistence.AccessTokenRepository;
import com.multila.backend.modules.identity.infrastructure.persistence.PlatformUserRepository;
import com.multila.backend.modules.identity.presentation.dto.SessionLoginRequest;
import com.multila.backend.modules.registry.application.SessionRegistryService;
import com.multila.backend.modules.registry.domain.ApplicationSession;
import com.multila.backend.modules.registry.domain.UserApplicationSession;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Token store of the client API. Maps opaque tokens to an anonymous user application session or to a
 * registered user, mints tokens on first contact and rejects unknown or revoked ones.
 */
@Service
public class IdentityService {

    private static final Logger log = LoggerFactory.getLogger(IdentityService.class);

    private final AccessTokenRepository accessTokenRepository;
    private final PlatformUserRepository platformUserRepository;
    private final SessionRegistryService sessionRegistryService;
    private final SecureCodeGenerator codeGenerator;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public IdentityService(
            AccessTokenRepository accessTokenRepository,
            PlatformUserRepository platformUserRepository,
            SessionRegistryService sessionRegistryService,
            SecureCodeGenerator codeGenerator,
            PasswordEncoder passwordEncoder,
            Clock clock
    ) {
        this.accessTokenRepository = accessTokenRepository;
        this.platformUserRepository = platformUserRepository;
        this.sessionRegistryService = sessionRegistryService;
        this.codeGenerator = codeGenerator;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    /**
     * Bootstraps or resumes a client identity for an application session.
     *
     * @param presentedToken token cached by the client, or null on first contact
     */
    @Transactional
    public ClientSession issueOrResolve(String presentedToken, String applicationSessionCode) {
        ApplicationSession applicationSession = sessionRegistryService.resolveActiveSession(applicationSessionCode);

        if (presentedToken == null) {
            if (applicationSession.requiresLogin()) {
                return ClientSession.loginRequired(applicationSession.getCode());
            }
            UserApplicationSession created = sessionRegistryService.createAnonymousUserSession(applicationSession);
            AccessToken token = accessTokenRepository.save(
                    AccessToken.forAnonymous(codeGenerator.nextHex(), created, now()));
            log.info("Issued anonymous token id={} for application session {}", token.getId(),
                    applicationSession.getCode());
            return toClientSession(ClientSession.Outcome.CREATED, token, created, applicationSession);
        }

        AccessToken token = findActiveToken(presentedToken);
        if (token.isRegistered()) {
            if (!applicationSession.requiresLogin()) {
                throw authModeMismatch(applicationSession);
            }
            PlatformUser user = requireActive(token.getUser());
            UserApplicationSession userSession =
                    sessionRegistryService.createOrFetchRegisteredUserSession(applicationSession, user);
            return toClientSession(ClientSession.Outcome.RESOLVED, token, userSession, applicationSession);
        }

        if (applicationSession.requiresLogin()) {
            throw authModeMismatch(applicationSession);
        }
        UserApplicationSession userSession = token.getUserAppSession();
        if (!userSession.getApplicationSession().getCode().equals(applicationSession.getCode())) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_TOKEN",
                    "token belongs to a different application session");
        }
        log.debug("Resolved anonymous token id={} for application session {}", token.getId(),
                applicationSession.getCode());
        return toClientSession(ClientSession.Outcome.RESOLVED, token, userSession, applicationSession);
    }

    /**
     * Authenticates a registered user against a login-mode application session. The user keeps a single
     * token across all of their logins.
     */
    @Transactional
    public ClientSession login(SessionLoginRequest request) {
        ApplicationSession applicationSession = sessionRegistryService.resolveActiveSession(request.sessCode());
        if (!applicationSession.requiresLogin()) {
            throw authModeMismatch(applicationSession);
        }
        PlatformUser user = findUser(request.username(), request.email());
        requireActive(user);
        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            log.info("Rejected login of user {} for application session {}", user.getId(), applicationSession.getCode());
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "invalid credentials");
        }

        UserApplicationSession userSession =
                sessionRegistryService.createOrFetchRegisteredUserSession(applicationSession, user);
        Optional<AccessToken> existing = accessTokenRepository.findActiveByUserId(user.getId());
        ClientSession.Outcome outcome = existing.isPresent() ? ClientSession.Outcome.RESOLVED : ClientSession.Outcome.CREATED;
        AccessToken token = existing.orElseGet(() -> createUserToken(user));
        log.info("User {} logged in to application session {}", user.getId(), applicationSession.getCode());
        return toClientSession(outcome, token, userSession, applicationSession);
    }

    /**
     * Resolves a presented token to the identity carried through the request context.
     */
    @Transactional(readOnly = true)
    public Optional<ClientPrincipal> authenticate(String presentedToken) {
        if (presentedToken == null || presentedToken.isBlank()) {
            return Optional.empty();
        }
        return accessTokenRepository.findByTokenAndRevokedAtIsNull(presentedToken)
                .filter(token -> !token.isRegistered() || token.getUser().isActive())
                .map(token -> token.isRegistered()
                        ? new ClientPrincipal(token.getId(), token.getUser().getId(), null, null)
                        : new ClientPrincipal(token.getId(), null, token.getUserAppSession().getId(),
                                token.getUserAppSession().getApplicationSession().getCode()));
    }

    private AccessToken createUserToken(PlatformUser user) {
        accessTokenRepository.insertUserTokenIfAbsent(codeGenerator.nextHex(), user.getId(), now());
        AccessToken token = accessTokenRepository.findActiveByUserId(user.getId())
                .orElseThrow(() -> new IllegalStateException("user token vanished after insert"));
        log.info("Issued token id={} for user {}", token.getId(), user.getId());
        return token;
    }

    private AccessToken findActiveToken(String presentedToken) {
        return accessTokenRepository.findByTokenAndRevokedAtIsNull(presentedToken)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_TOKEN",
                        "unknown or revoked token"));
    }

    private PlatformUser findUser(String username, String email) {
        boolean hasUsername = username != null && !username.isBlank();
        boolean hasEmail = email != null && !email.isBlank();
        if (!hasUsername && !hasEmail) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_ERROR",
                    "username or email is required");
        }
        Optional<PlatformUser> byUsername = hasUsername ? platformUserRepository.findByUsername(username) : Optional.empty();
        Optional<PlatformUser> byEmail = hasEmail ? platformUserRepository.findByEmailIgnoreCase(email) : Optional.empty();
        if (hasUsername && hasEmail && byUsername.isPresent() && byEmail.isPresent()
                && !byUsername.get().getId().equals(byEmail.get().getId())) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS",
                    "username and email belong to different users");
        }
        return byUsername.or(() -> byEmail)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND", "user not found"));
    }

    private PlatformUser requireActive(PlatformUser user) {
        if (!user.isActive()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "USER_INACTIVE", "user account is inactive");
        }
        return user;
    }

    private ProblemException authModeMismatch(ApplicationSession applicationSession) {
        return new ProblemException(HttpStatus.FORBIDDEN, "AUTH_MODE_MISMATCH",
                "token does not match auth mode '" + applicationSession.getAuthMode().wireValue()
                        + "' of application session " + applicationSession.getCode());
    }

    private ClientSession toClientSession(ClientSession.Outcome outcome, AccessToken token,
                                          UserApplicationSession userSession, ApplicationSession applicationSession) {
        return new ClientSession(
                outcome,
                applicationSession.getCode(),
                applicationSession.getAuthMode(),
                token.getToken(),
                userSession.getCode(),
                sessionRegistryService.configPayload(applicationSession)
        );
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
