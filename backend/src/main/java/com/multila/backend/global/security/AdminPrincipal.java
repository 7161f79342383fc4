package com.multila.backend.global.security;

import java.util.List;
import java.util.UUID;

public record AdminPrincipal(UUID userId, String username, List<String> roles) {
}
