package com.meetlink.backend.modules.meeting.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * {@code hostId} defaults to the caller; {@code durationMinutes} above the ceiling is clamped, not rejected.
 */
public record CreateMeetingRequest(
        UUID hostId,
        @Size(max = 120) String hostName,
        @NotBlank @Size(max = 200) String title,
        @Min(2) @Max(50) Integer maxParticipants,
        @Positive Integer durationMinutes
) {
}
