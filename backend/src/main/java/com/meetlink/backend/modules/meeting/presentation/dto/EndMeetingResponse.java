package com.meetlink.backend.modules.meeting.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.meetlink.backend.modules.meeting.domain.MeetingEndReason;

public record EndMeetingResponse(
        UUID sessionId,
        boolean ended,
        OffsetDateTime endedAt,
        MeetingEndReason reason,
        boolean alreadyEnded
) {
}
