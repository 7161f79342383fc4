package com.multila.backend.global.security;

import com.multila.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static ClientPrincipal getCurrentClient() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof ClientPrincipal principal)) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED");
        }
        return principal;
    }
}
