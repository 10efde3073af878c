package com.meetlink.backend.modules.meeting.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record CreateMeetingResponse(
        UUID sessionId,
        String joinUrl,
        String token,
        OffsetDateTime expiresAt,
        int durationMinutes,
        String title,
        UUID hostId
) {
}
