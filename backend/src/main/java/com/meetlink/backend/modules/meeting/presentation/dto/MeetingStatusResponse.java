package com.meetlink.backend.modules.meeting.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.meetlink.backend.modules.meeting.domain.MeetingEndReason;
import com.meetlink.backend.modules.meeting.domain.MeetingStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MeetingStatusResponse(
        UUID sessionId,
        MeetingStatus status,
        boolean timeExceeded,
        Long timeRemainingSeconds,
        OffsetDateTime autoEndAt,
        MeetingEndReason endReason,
        OffsetDateTime startedAt,
        OffsetDateTime endedAt,
        int durationMinutes
) {
}
