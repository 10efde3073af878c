package com.meetlink.backend.modules.meeting.application;

import java.util.UUID;

import com.meetlink.backend.global.security.JwtAuthenticationPrincipal;
import com.meetlink.backend.global.security.SecurityUtils;

/**
 * Who is asking. {@code userId} is null for anonymous callers of public routes and for
 * background jobs; {@code system} marks the latter.
 */
public record MeetingActor(UUID userId, boolean admin, boolean system) {

    private static final MeetingActor ANONYMOUS = new MeetingActor(null, false, false);
    private static final MeetingActor SYSTEM = new MeetingActor(null, false, true);

    public static MeetingActor current() {
        return SecurityUtils.findCurrentPrincipal()
                .map(MeetingActor::of)
                .orElse(ANONYMOUS);
    }

    public static MeetingActor of(JwtAuthenticationPrincipal principal) {
        return new MeetingActor(principal.userId(), principal.isAdmin(), false);
    }

    public static MeetingActor user(UUID userId) {
        return new MeetingActor(userId, false, false);
    }

    public static MeetingActor adminUser(UUID userId) {
        return new MeetingActor(userId, true, false);
    }

    public static MeetingActor anonymous() {
        return ANONYMOUS;
    }

    public static MeetingActor systemActor() {
        return SYSTEM;
    }

    public boolean isAuthenticated() {
        return userId != null;
    }

    /**
     * Value written to {@code audit_log.actor_id}.
     */
    public String auditId() {
        if (system) {
            return "system";
        }
        return userId != null ? userId.toString() : "anonymous";
    }
}
