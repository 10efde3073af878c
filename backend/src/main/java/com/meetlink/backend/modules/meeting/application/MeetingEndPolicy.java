package com.meetlink.backend.modules.meeting.application;

import java.time.OffsetDateTime;

import com.meetlink.backend.global.error.ProblemException;
import com.meetlink.backend.modules.meeting.domain.MeetingEndReason;
import com.meetlink.backend.modules.meeting.domain.MeetingSession;
import com.meetlink.backend.modules.meeting.domain.MeetingStatus;
import com.meetlink.backend.modules.meeting.infrastructure.persistence.MeetingLinkRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Who may close a meeting, and for which reason.
 * <ul>
 *     <li>{@code manual}: the host or an admin.</li>
 *     <li>{@code time_limit}: the host or an admin at any time, anyone else only once the limit is reached.</li>
 *     <li>{@code all_left}: the host, an admin, or an authenticated user who joined through one of the session's links.</li>
 * </ul>
 * Cancelling is reserved to the host and admins.
 */
@Component
public class MeetingEndPolicy {

    private final MeetingLinkRepository meetingLinkRepository;

    public MeetingEndPolicy(MeetingLinkRepository meetingLinkRepository) {
        this.meetingLinkRepository = meetingLinkRepository;
    }

    public void checkEnd(MeetingSession session, MeetingActor actor, MeetingEndReason reason, OffsetDateTime now) {
        if (isPrivileged(session, actor)) {
            return;
        }
        switch (reason) {
            case MANUAL -> throw new ProblemException(HttpStatus.FORBIDDEN, "END_NOT_PERMITTED",
                    "Only the host can end this meeting");
            case TIME_LIMIT -> {
                if (!isTimeLimitReached(session, now)) {
                    throw new ProblemException(HttpStatus.CONFLICT, "TIME_LIMIT_NOT_REACHED",
                            "The meeting has time left");
                }
            }
            case ALL_LEFT -> {
                if (!actor.isAuthenticated()
                        || meetingLinkRepository.countConsumedBy(session.getId(), actor.userId().toString()) == 0) {
                    throw new ProblemException(HttpStatus.FORBIDDEN, "END_NOT_PERMITTED",
                            "Only participants of this meeting can report that everyone left");
                }
            }
            default -> throw new IllegalStateException("Unhandled end reason " + reason);
        }
    }

    public void checkCancel(MeetingSession session, MeetingActor actor) {
        if (!isPrivileged(session, actor)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "NOT_MEETING_HOST");
        }
    }

    public boolean isPrivileged(MeetingSession session, MeetingActor actor) {
        return actor.admin() || session.isHostedBy(actor.userId());
    }

    static boolean isTimeLimitReached(MeetingSession session, OffsetDateTime now) {
        return session.getStatus() == MeetingStatus.ACTIVE
                && session.getAutoEndAt() != null
                && !session.getAutoEndAt().isAfter(now);
    }
}
