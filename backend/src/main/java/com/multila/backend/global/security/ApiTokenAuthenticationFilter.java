package com.multila.backend.global.security;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.multila.backend.modules.identity.application.IdentityService;
import com.multila.backend.modules.identity.presentation.ClientTokenHeader;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates client applications presenting {@code Authorization: Token <token>} and places the
 * resolved {@link ClientPrincipal} in the security context.
 */
@Component
public class ApiTokenAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(ApiTokenAuthenticationFilter.class);

    public static final String ROLE_CLIENT = "CLIENT";

    private final IdentityService identityService;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    public ApiTokenAuthenticationFilter(IdentityService identityService,
                                        RestAuthenticationEntryPoint authenticationEntryPoint) {
        this.identityService = identityService;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String token = ClientTokenHeader.extract(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token != null) {
            Optional<ClientPrincipal> principal = identityService.authenticate(token);
            if (principal.isEmpty()) {
                SecurityContextHolder.clearContext();
                log.debug("Rejected unknown client token on {}", request.getServletPath());
                authenticationEntryPoint.writeUnauthorized(request, response, "INVALID_TOKEN", "unknown or revoked token");
                return;
            }
            UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                    principal.get(), token, List.of(new SimpleGrantedAuthority("ROLE_" + ROLE_CLIENT)));
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        // bootstrap endpoints resolve the optional token themselves
        String path = request.getServletPath();
        return path.startsWith("/session") || path.startsWith("/register_user") || path.startsWith("/health");
    }
}
