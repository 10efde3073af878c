package com.meetlink.backend.modules.meeting.presentation.dto;

import jakarta.validation.constraints.Size;

public record CancelMeetingRequest(
        @Size(max = 500) String reason
) {
}
