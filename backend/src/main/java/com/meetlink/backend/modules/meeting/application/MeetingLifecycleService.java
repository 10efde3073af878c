package com.meetlink.backend.modules.meeting.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.meetlink.backend.global.error.ProblemException;
import com.meetlink.backend.modules.audit.application.AuditLogService;
import com.meetlink.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.meetlink.backend.modules.meeting.domain.MeetingEndReason;
import com.meetlink.backend.modules.meeting.domain.MeetingLink;
import com.meetlink.backend.modules.meeting.domain.MeetingSession;
import com.meetlink.backend.modules.meeting.domain.MeetingStatus;
import com.meetlink.backend.modules.meeting.infrastructure.persistence.MeetingLinkRepository;
import com.meetlink.backend.modules.meeting.infrastructure.persistence.MeetingSessionRepository;
import com.meetlink.backend.modules.meeting.presentation.dto.CancelMeetingResponse;
import com.meetlink.backend.modules.meeting.presentation.dto.EndMeetingResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Transactional half of issuing and terminating meetings. Provider calls stay outside:
 * callers talk to the provider before {@link #recordScheduled} and after {@link #end} or
 * {@link #cancel} have committed.
 */
@Service
@Transactional
public class MeetingLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(MeetingLifecycleService.class);

    static final String ACTION_CREATED = "MEETING_CREATED";
    static final String ACTION_LINK_REISSUED = "MEETING_LINK_REISSUED";
    static final String ACTION_ENDED = "MEETING_ENDED";
    static final String ACTION_CANCELLED = "MEETING_CANCELLED";

    private static final int MAX_TRANSITION_ATTEMPTS = 3;

    private final MeetingSessionRepository meetingSessionRepository;
    private final MeetingLinkRepository meetingLinkRepository;
    private final MeetingEndPolicy meetingEndPolicy;
    private final LinkTokenGenerator linkTokenGenerator;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public MeetingLifecycleService(
            MeetingSessionRepository meetingSessionRepository,
            MeetingLinkRepository meetingLinkRepository,
            MeetingEndPolicy meetingEndPolicy,
            LinkTokenGenerator linkTokenGenerator,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.meetingSessionRepository = meetingSessionRepository;
        this.meetingLinkRepository = meetingLinkRepository;
        this.meetingEndPolicy = meetingEndPolicy;
        this.linkTokenGenerator = linkTokenGenerator;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Persists a freshly created session with its first link.
     */
    public MeetingLink recordScheduled(MeetingSession session, OffsetDateTime linkExpiresAt, MeetingActor actor) {
        MeetingSession saved = meetingSessionRepository.save(session);
        MeetingLink link = newLink(saved, linkExpiresAt, actor);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("title", saved.getTitle());
        detail.put("hostId", saved.getHostId().toString());
        detail.put("providerRoomName", saved.getProviderRoomName());
        detail.put("durationLimitMinutes", saved.getDurationLimitMinutes());
        detail.put("maxParticipants", saved.getMaxParticipants());
        detail.put("linkExpiresAt", linkExpiresAt.toString());
        auditLogService.record(AuditLogCommand.forSession(ACTION_CREATED, saved.getId(), actor.auditId(), detail));
        return link;
    }

    /**
     * Revokes every outstanding link of the session and issues a replacement.
     * A link for an active session expires with the session itself.
     */
    public ReissuedLink reissueLink(UUID sessionId, MeetingActor actor) {
        MeetingSession session = loadSession(sessionId);
        meetingEndPolicy.checkCancel(session, actor);

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (session.getStatus().isClosed()) {
            throw new ProblemException(HttpStatus.CONFLICT, "SESSION_CLOSED", "The meeting is " + session.getStatus().wireValue());
        }
        if (MeetingEndPolicy.isTimeLimitReached(session, now)) {
            throw new ProblemException(HttpStatus.CONFLICT, "SESSION_TIME_EXCEEDED");
        }
        OffsetDateTime expiresAt = session.getStatus() == MeetingStatus.ACTIVE
                ? session.getAutoEndAt()
                : now.plusMinutes(session.getDurationLimitMinutes());

        int revoked = meetingLinkRepository.revokeOutstanding(sessionId, now);
        MeetingLink link = newLink(meetingSessionRepository.getReferenceById(sessionId), expiresAt, actor);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("revokedLinks", revoked);
        detail.put("linkExpiresAt", expiresAt.toString());
        auditLogService.record(AuditLogCommand.forSession(ACTION_LINK_REISSUED, sessionId, actor.auditId(), detail));
        return new ReissuedLink(sessionId, link.getToken(), expiresAt, revoked);
    }

    /**
     * Moves the session to {@code ENDED} and revokes its outstanding links. Ending an ended
     * session reports the stored outcome without touching anything.
     */
    public EndOutcome end(UUID sessionId, MeetingEndReason reason, Long durationSeconds, MeetingActor actor) {
        for (int attempt = 1; attempt <= MAX_TRANSITION_ATTEMPTS; attempt++) {
            MeetingSession session = loadSession(sessionId);
            MeetingStatus observed = session.getStatus();
            if (observed == MeetingStatus.ENDED) {
                return EndOutcome.unchanged(alreadyEnded(session));
            }
            if (observed == MeetingStatus.CANCELLED) {
                throw new ProblemException(HttpStatus.CONFLICT, "SESSION_CANCELLED");
            }

            OffsetDateTime now = OffsetDateTime.now(clock);
            meetingEndPolicy.checkEnd(session, actor, reason, now);

            long duration = durationSeconds != null ? durationSeconds : elapsedSeconds(session, now);
            String roomName = session.getProviderRoomName();
            // Link rows are locked before the session row, the same order a join takes them.
            int revoked = meetingLinkRepository.revokeOutstanding(sessionId, now);
            if (meetingSessionRepository.end(sessionId, observed, now, reason, duration) == 0) {
                log.debug("Session {} left {} concurrently, re-reading", sessionId, observed);
                continue;
            }

            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("reason", reason.wireValue());
            detail.put("previousStatus", observed.wireValue());
            detail.put("durationSeconds", duration);
            detail.put("revokedLinks", revoked);
            auditLogService.record(AuditLogCommand.forSession(ACTION_ENDED, sessionId, actor.auditId(), detail));
            log.info("Meeting {} ended ({}) after {}s, {} link(s) revoked", sessionId, reason.wireValue(), duration,
                    revoked);
            return EndOutcome.transitioned(roomName,
                    new EndMeetingResponse(sessionId, true, now, reason, false));
        }
        throw new ProblemException(HttpStatus.CONFLICT, "SESSION_STATE_CHANGED",
                "The meeting changed state while ending it, try again");
    }

    /**
     * Cancels a meeting nobody has joined yet.
     */
    public CancelOutcome cancel(UUID sessionId, String reason, MeetingActor actor) {
        MeetingSession session = loadSession(sessionId);
        meetingEndPolicy.checkCancel(session, actor);
        if (session.getStatus() == MeetingStatus.CANCELLED) {
            return CancelOutcome.unchanged(toCancelResponse(session));
        }
        if (session.getStatus() != MeetingStatus.SCHEDULED) {
            throw new ProblemException(HttpStatus.CONFLICT, "SESSION_NOT_CANCELLABLE",
                    "Only meetings nobody has joined can be cancelled");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        String roomName = session.getProviderRoomName();
        int revoked = meetingLinkRepository.revokeOutstanding(sessionId, now);
        if (meetingSessionRepository.cancel(sessionId, actor.userId(), now, reason) == 0) {
            MeetingSession current = loadSession(sessionId);
            if (current.getStatus() == MeetingStatus.CANCELLED) {
                return CancelOutcome.unchanged(toCancelResponse(current));
            }
            throw new ProblemException(HttpStatus.CONFLICT, "SESSION_NOT_CANCELLABLE",
                    "The meeting started before it could be cancelled");
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        if (reason != null) {
            detail.put("reason", reason);
        }
        detail.put("revokedLinks", revoked);
        auditLogService.record(AuditLogCommand.forSession(ACTION_CANCELLED, sessionId, actor.auditId(), detail));
        log.info("Meeting {} cancelled by {}", sessionId, actor.auditId());
        return CancelOutcome.transitioned(roomName,
                new CancelMeetingResponse(sessionId, MeetingStatus.CANCELLED, now));
    }

    public int purgeLinksExpiredBefore(OffsetDateTime cutoff) {
        return meetingLinkRepository.purgeExpiredBefore(cutoff);
    }

    private MeetingLink newLink(MeetingSession session, OffsetDateTime expiresAt, MeetingActor actor) {
        MeetingLink link = new MeetingLink();
        link.setSession(session);
        link.setToken(linkTokenGenerator.nextToken());
        link.setExpiresAt(expiresAt);
        link.setMaxUses(MeetingLink.SINGLE_USE);
        link.setCreatedBy(actor.userId());
        return meetingLinkRepository.save(link);
    }

    private MeetingSession loadSession(UUID sessionId) {
        return meetingSessionRepository.findById(sessionId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "SESSION_NOT_FOUND"));
    }

    private static long elapsedSeconds(MeetingSession session, OffsetDateTime now) {
        if (session.getStartedAt() == null) {
            return 0L;
        }
        return Math.max(0L, Duration.between(session.getStartedAt(), now).getSeconds());
    }

    private static EndMeetingResponse alreadyEnded(MeetingSession session) {
        return new EndMeetingResponse(session.getId(), true, session.getEndedAt(), session.getEndReason(), true);
    }

    private static CancelMeetingResponse toCancelResponse(MeetingSession session) {
        return new CancelMeetingResponse(session.getId(), session.getStatus(), session.getCancelledAt());
    }

    public record ReissuedLink(UUID sessionId, String token, OffsetDateTime expiresAt, int revokedLinks) {
    }

    /**
     * {@code roomToRelease} is set only when this call performed the transition.
     */
    public record EndOutcome(String roomToRelease, EndMeetingResponse response) {

        static EndOutcome transitioned(String roomName, EndMeetingResponse response) {
            return new EndOutcome(roomName, response);
        }

        static EndOutcome unchanged(EndMeetingResponse response) {
            return new EndOutcome(null, response);
        }
    }

    public record CancelOutcome(String roomToRelease, CancelMeetingResponse response) {

        static CancelOutcome transitioned(String roomName, CancelMeetingResponse response) {
            return new CancelOutcome(roomName, response);
        }

        static CancelOutcome unchanged(CancelMeetingResponse response) {
            return new CancelOutcome(null, response);
        }
    }
}
