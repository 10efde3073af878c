package com.meetlink.backend.global.security;

import java.util.List;
import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID userId, String loginId, List<String> roles) {

    public static final String ROLE_ADMIN = "ADMIN";

    public boolean isAdmin() {
        return roles != null && roles.contains(ROLE_ADMIN);
    }
}
