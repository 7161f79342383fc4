package com.multila.backend.modules.registry.presentation;

import com.multila.backend.global.error.ProblemException;
import com.multila.backend.modules.registry.application.SessionRegistryService;
import com.multila.backend.modules.registry.presentation.dto.DefaultSessionResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Session registry")
public class DefaultSessionController {

    private final SessionRegistryService sessionRegistryService;

    public DefaultSessionController(SessionRegistryService sessionRegistryService) {
        this.sessionRegistryService = sessionRegistryService;
    }

    @GetMapping("/session/default")
    @Operation(summary = "Look up the default application session of the application at the referrer URL")
    public ResponseEntity<DefaultSessionResponse> defaultSession(
            @RequestParam(name = "referrer", required = false) String referrer,
            @RequestHeader(name = HttpHeaders.REFERER, required = false) String refererHeader
    ) {
        String effective = referrer != null ? referrer : refererHeader;
        return sessionRegistryService.findDefaultSessionCode(effective)
                .map(code -> ResponseEntity.ok(new DefaultSessionResponse(code)))
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "APP_SESSION_NOT_FOUND",
                        "no default application session for this referrer"));
    }
}
