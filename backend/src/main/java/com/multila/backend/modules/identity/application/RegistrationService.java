package com.multila.backend.modules.identity.application;

import java.util.Locale;
import java.util.regex.Pattern;

import com.multila.backend.global.error.ProblemException;
import com.multila.backend.modules.identity.domain.PlatformUser;
import com.multila.backend.modules.identity.infrastructure.persistence.PlatformUserRepository;
import com.multila.backend.modules.identity.presentation.dto.RegisterUserRequest;
import com.multila.backend.modules.identity.presentation.dto.RegisterUserResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Self-service registration of users for login-mode application sessions.
 */
@Service
public class RegistrationService {

    private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);

    static final int MIN_PASSWORD_LENGTH = 8;
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final PlatformUserRepository platformUserRepository;
    private final PasswordEncoder passwordEncoder;

    public RegistrationService(PlatformUserRepository platformUserRepository, PasswordEncoder passwordEncoder) {
        this.platformUserRepository = platformUserRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Transactional
    public RegisterUserResponse register(RegisterUserRequest request) {
        String username = blankToNull(request.username());
        String email = blankToNull(request.email());
        String password = request.password();

        if (username == null && email == null) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_ERROR",
                    "username or email is required");
        }
        if (email != null && !EMAIL_PATTERN.matcher(email).matches()) {
            throw rejected("INVALID_EMAIL", "email address is not valid");
        }
        if (password.length() < MIN_PASSWORD_LENGTH) {
            throw rejected("PW_TOO_SHORT", "password must have at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        if (username != null && password.equalsIgnoreCase(username)) {
            throw rejected("PW_SAME_AS_USER", "password must differ from the username");
        }
        if (email != null && password.equalsIgnoreCase(email)) {
            throw rejected("PW_SAME_AS_EMAIL", "password must differ from the email address");
        }

        // users registering with an email only get it as their username
        String effectiveUsername = username != null ? username : email.toLowerCase(Locale.ROOT);
        if (platformUserRepository.existsByUsername(effectiveUsername)
                || (email != null && platformUserRepository.existsByEmailIgnoreCase(email))) {
            throw rejected("USER_ALREADY_REGISTERED", "a user with this username or email already exists");
        }

        PlatformUser user = new PlatformUser(effectiveUsername, email, passwordEncoder.encode(password));
        try {
            user = platformUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "USER_ALREADY_REGISTERED",
                    "a user with this username or email already exists", ex);
        }
        log.info("Registered user {}", user.getId());
        return new RegisterUserResponse(user.getId(), user.getUsername(), user.getEmail());
    }

    private static ProblemException rejected(String code, String detail) {
        return new ProblemException(HttpStatus.FORBIDDEN, code, detail);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
