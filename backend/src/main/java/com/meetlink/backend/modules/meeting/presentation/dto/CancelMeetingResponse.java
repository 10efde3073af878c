package com.meetlink.backend.modules.meeting.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.meetlink.backend.modules.meeting.domain.MeetingStatus;

public record CancelMeetingResponse(
        UUID sessionId,
        MeetingStatus status,
        OffsetDateTime cancelledAt
) {
}
