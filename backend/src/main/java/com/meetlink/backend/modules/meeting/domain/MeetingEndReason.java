package com.meetlink.backend.modules.meeting.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MeetingEndReason {
    MANUAL,
    TIME_LIMIT,
    ALL_LEFT;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MeetingEndReason fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (MeetingEndReason reason : values()) {
            if (reason.wireValue().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown end reason: " + value);
    }
}
