package com.meetlink.backend.global.security;

import java.util.Optional;
import java.util.UUID;

import com.meetlink.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Principal of the current request, or empty for anonymous callers of public routes.
     */
    public static Optional<JwtAuthenticationPrincipal> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal) {
            return Optional.of(principal);
        }
        return Optional.empty();
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        return findCurrentPrincipal()
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED"));
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }

    public static boolean hasRole(String roleCode) {
        return findCurrentPrincipal()
                .map(principal -> principal.roles().contains(roleCode))
                .orElse(false);
    }
}
