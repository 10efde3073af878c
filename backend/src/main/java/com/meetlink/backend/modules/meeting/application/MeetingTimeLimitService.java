package com.meetlink.backend.modules.meeting.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.meetlink.backend.global.error.ProblemException;
import com.meetlink.backend.modules.meeting.domain.MeetingSession;
import com.meetlink.backend.modules.meeting.domain.MeetingStatus;
import com.meetlink.backend.modules.meeting.infrastructure.persistence.MeetingSessionRepository;
import com.meetlink.backend.modules.meeting.presentation.dto.MeetingStatusResponse;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class MeetingTimeLimitService {

    private final MeetingSessionRepository meetingSessionRepository;
    private final Clock clock;

    public MeetingTimeLimitService(MeetingSessionRepository meetingSessionRepository, Clock clock) {
        this.meetingSessionRepository = meetingSessionRepository;
        this.clock = clock;
    }

    public MeetingStatusResponse status(UUID sessionId) {
        MeetingSession session = meetingSessionRepository.findById(sessionId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "SESSION_NOT_FOUND"));
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime autoEndAt = session.getAutoEndAt();

        Long remaining = null;
        if (session.getStatus() == MeetingStatus.ACTIVE && autoEndAt != null) {
            remaining = Math.max(0L, Duration.between(now, autoEndAt).getSeconds());
        }
        return new MeetingStatusResponse(
                session.getId(),
                session.getStatus(),
                isTimeExceeded(session, now),
                remaining,
                autoEndAt,
                session.getEndReason(),
                session.getStartedAt(),
                session.getEndedAt(),
                session.getDurationLimitMinutes()
        );
    }

    /**
     * True once the timer has run out, whatever the status. Unstarted sessions never exceed.
     */
    static boolean isTimeExceeded(MeetingSession session, OffsetDateTime now) {
        return session.getAutoEndAt() != null && !session.getAutoEndAt().isAfter(now);
    }
}
