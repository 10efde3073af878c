package com.meetlink.backend.modules.meeting.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record JoinMeetingResponse(
        String providerRoomRef,
        String participantToken,
        UUID sessionId,
        OffsetDateTime autoEndAt,
        int durationMinutes
) {
}
