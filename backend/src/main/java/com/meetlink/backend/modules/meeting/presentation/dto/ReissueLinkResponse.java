package com.meetlink.backend.modules.meeting.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ReissueLinkResponse(
        UUID sessionId,
        String joinUrl,
        String token,
        OffsetDateTime expiresAt,
        int revokedLinks
) {
}
