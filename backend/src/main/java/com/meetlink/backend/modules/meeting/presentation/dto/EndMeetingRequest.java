package com.meetlink.backend.modules.meeting.presentation.dto;

import com.meetlink.backend.modules.meeting.domain.MeetingEndReason;

import jakarta.validation.constraints.PositiveOrZero;

/**
 * The acting user comes from the bearer token, never from the body. A missing reason means {@code manual}.
 */
public record EndMeetingRequest(
        MeetingEndReason reason,
        @PositiveOrZero Long durationSeconds
) {

    public MeetingEndReason reasonOrDefault() {
        return reason != null ? reason : MeetingEndReason.MANUAL;
    }
}
