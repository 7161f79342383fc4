package com.multila.backend.modules.identity.presentation;

import com.multila.backend.modules.identity.application.AdminAuthService;
import com.multila.backend.modules.identity.presentation.dto.AdminLoginRequest;
import com.multila.backend.modules.identity.presentation.dto.AdminTokenResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Administration")
public class AdminAuthController {

    private final AdminAuthService adminAuthService;

    public AdminAuthController(AdminAuthService adminAuthService) {
        this.adminAuthService = adminAuthService;
    }

    @PostMapping("/admin/auth/login")
    @Operation(summary = "Obtain an administrator access token")
    public ResponseEntity<AdminTokenResponse> login(@Valid @RequestBody AdminLoginRequest request) {
        return ResponseEntity.ok(adminAuthService.login(request));
    }
}
