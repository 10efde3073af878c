package com.meetlink.backend.modules.meeting.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record JoinMeetingRequest(
        @NotBlank @Size(max = 128) String participantId,
        @NotBlank @Size(max = 120) String participantName
) {
}
