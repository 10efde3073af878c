package com.meetlink.backend.modules.meeting.presentation.dto;

public record ProviderEventResponse(String outcome) {
}
