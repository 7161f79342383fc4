package com.multila.backend.modules.identity.application;

import java.util.List;

import com.multila.backend.global.error.ProblemException;
import com.multila.backend.modules.identity.domain.PlatformUser;
import com.multila.backend.modules.identity.infrastructure.persistence.PlatformUserRepository;
import com.multila.backend.modules.identity.presentation.dto.AdminLoginRequest;
import com.multila.backend.modules.identity.presentation.dto.AdminTokenResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AdminAuthService {

    private static final Logger log = LoggerFactory.getLogger(AdminAuthService.class);

    public static final String ROLE_ADMIN = "ADMIN";

    private final PlatformUserRepository platformUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    public AdminAuthService(
            PlatformUserRepository platformUserRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService
    ) {
        this.platformUserRepository = platformUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
    }

    @Transactional(readOnly = true)
    public AdminTokenResponse login(AdminLoginRequest request) {
        PlatformUser user = platformUserRepository.findByUsername(request.username().trim())
                .filter(PlatformUser::isActive)
                .filter(candidate -> passwordEncoder.matches(request.password(), candidate.getPasswordHash()))
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS",
                        "invalid credentials"));
        if (!user.isStaff()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "ADMIN_REQUIRED", "staff account required");
        }
        log.info("Administrator {} signed in", user.getId());
        return jwtTokenService.issueAccessToken(user.getId(), user.getUsername(), List.of(ROLE_ADMIN));
    }
}
