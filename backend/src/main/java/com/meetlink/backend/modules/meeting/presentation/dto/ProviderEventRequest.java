package com.meetlink.backend.modules.meeting.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ProviderEventRequest(
        @NotBlank @Size(max = 64) String type,
        @NotBlank @Size(max = 128) String roomName
) {
}
