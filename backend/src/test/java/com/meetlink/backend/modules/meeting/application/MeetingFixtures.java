package com.meetlink.backend.modules.meeting.application;

import java.lang.reflect.Field;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.meetlink.backend.modules.meeting.domain.MeetingLink;
import com.meetlink.backend.modules.meeting.domain.MeetingSession;
import com.meetlink.backend.modules.meeting.domain.MeetingStatus;

final class MeetingFixtures {

    static final UUID HOST_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");
    static final UUID SESSION_ID = UUID.fromString("00000000-0000-0000-0000-000000000501");
    static final UUID LINK_ID = UUID.fromString("00000000-0000-0000-0000-000000000601");
    static final OffsetDateTime NOW = OffsetDateTime.parse("2026-03-02T09:00:00Z");

    private MeetingFixtures() {
    }

    static MeetingSession scheduledSession() {
        MeetingSession session = new MeetingSession();
        setField(session, "id", SESSION_ID);
        session.setHostId(HOST_ID);
        session.setHostName("host");
        session.setTitle("Weekly sync");
        session.setMaxParticipants(10);
        session.setProviderRoomName("room-1772442000000-0a1b2c3d");
        session.setProviderRoomUrl("https://meetlink.daily.co/room-1772442000000-0a1b2c3d");
        session.setStatus(MeetingStatus.SCHEDULED);
        session.setDurationLimitMinutes(40);
        return session;
    }

    static MeetingSession activeSession(OffsetDateTime startedAt) {
        MeetingSession session = scheduledSession();
        session.setStatus(MeetingStatus.ACTIVE);
        session.setStartedAt(startedAt);
        session.setAutoEndAt(startedAt.plusMinutes(session.getDurationLimitMinutes()));
        return session;
    }

    static MeetingLink link(MeetingSession session, String token, OffsetDateTime expiresAt) {
        MeetingLink link = new MeetingLink();
        setField(link, "id", LINK_ID);
        link.setSession(session);
        link.setToken(token);
        link.setExpiresAt(expiresAt);
        link.setCreatedBy(HOST_ID);
        return link;
    }

    static void setField(Object target, String fieldName, Object value) {
        try {
            Field field = target.getClass().getDeclaredField(fieldName);
            field.setAccessible(true);
            field.set(target, value);
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
