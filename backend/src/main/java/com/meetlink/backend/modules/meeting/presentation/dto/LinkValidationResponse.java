package com.meetlink.backend.modules.meeting.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.meetlink.backend.modules.meeting.domain.LinkInvalidReason;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LinkValidationResponse(
        boolean valid,
        LinkInvalidReason reason,
        SessionSummary session
) {

    public static LinkValidationResponse valid(SessionSummary session) {
        return new LinkValidationResponse(true, null, session);
    }

    public static LinkValidationResponse invalid(LinkInvalidReason reason) {
        return new LinkValidationResponse(false, reason, null);
    }

    public record SessionSummary(UUID id, String title, String hostName, OffsetDateTime expiresAt) {
    }
}
