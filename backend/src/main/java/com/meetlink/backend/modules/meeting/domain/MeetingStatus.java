package com.meetlink.backend.modules.meeting.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * {@code SCHEDULED -> ACTIVE -> ENDED}, {@code SCHEDULED -> CANCELLED}. ENDED and CANCELLED are terminal.
 */
public enum MeetingStatus {
    SCHEDULED,
    ACTIVE,
    ENDED,
    CANCELLED;

    public boolean isClosed() {
        return this == ENDED || this == CANCELLED;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
