package com.meetlink.backend.modules.meeting.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LinkInvalidReason {
    NOT_FOUND,
    EXPIRED,
    USED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
