package com.multila.backend.modules.identity.presentation;

import com.multila.backend.modules.identity.application.ClientSession;
import com.multila.backend.modules.identity.application.IdentityService;
import com.multila.backend.modules.identity.presentation.dto.SessionLoginRequest;
import com.multila.backend.modules.identity.presentation.dto.SessionRequest;
import com.multila.backend.modules.identity.presentation.dto.SessionResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Client session")
public class SessionController {

    private final IdentityService identityService;

    public SessionController(IdentityService identityService) {
        this.identityService = identityService;
    }

    @PostMapping({"/session", "/session/"})
    @Operation(summary = "Bootstrap or resume a client identity for an application session")
    public ResponseEntity<SessionResponse> session(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody SessionRequest request
    ) {
        ClientSession session = identityService.issueOrResolve(ClientTokenHeader.extract(authorization), request.sessCode());
        return toResponse(session);
    }

    @PostMapping({"/session_login", "/session_login/"})
    @Operation(summary = "Log a registered user in to a login-mode application session")
    public ResponseEntity<SessionResponse> login(@Valid @RequestBody SessionLoginRequest request) {
        return toResponse(identityService.login(request));
    }

    private ResponseEntity<SessionResponse> toResponse(ClientSession session) {
        HttpStatus status = session.outcome() == ClientSession.Outcome.CREATED ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(SessionResponse.from(session));
    }
}
