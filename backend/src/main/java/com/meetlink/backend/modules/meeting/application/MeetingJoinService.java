package com.meetlink.backend.modules.meeting.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.meetlink.backend.global.error.ProblemException;
import com.meetlink.backend.global.error.RetryableProblemException;
import com.meetlink.backend.modules.audit.application.AuditLogService;
import com.meetlink.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.meetlink.backend.modules.meeting.domain.MeetingLink;
import com.meetlink.backend.modules.meeting.domain.MeetingSession;
import com.meetlink.backend.modules.meeting.domain.MeetingStatus;
import com.meetlink.backend.modules.meeting.infrastructure.persistence.MeetingLinkRepository;
import com.meetlink.backend.modules.meeting.infrastructure.persistence.MeetingSessionRepository;
import com.meetlink.backend.modules.meeting.presentation.dto.JoinMeetingRequest;
import com.meetlink.backend.modules.meeting.presentation.dto.JoinMeetingResponse;
import com.meetlink.backend.modules.provider.application.VideoProviderClient;
import com.meetlink.backend.modules.provider.application.VideoProviderException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Consumes a join link and admits the participant.
 * <p>
 * Everything happens in one transaction: the guarded claim, the first-join activation and
 * the participant token. Any failure after the claim rolls it back, so the link stays
 * usable when the meeting refuses the participant or the provider is down.
 */
@Service
@Transactional
public class MeetingJoinService {

    private static final Logger log = LoggerFactory.getLogger(MeetingJoinService.class);

    static final String ACTION_LINK_CONSUMED = "MEETING_LINK_CONSUMED";
    static final int PROVIDER_RETRY_AFTER_SECONDS = 5;

    private final MeetingLinkRepository meetingLinkRepository;
    private final MeetingSessionRepository meetingSessionRepository;
    private final VideoProviderClient videoProviderClient;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public MeetingJoinService(
            MeetingLinkRepository meetingLinkRepository,
            MeetingSessionRepository meetingSessionRepository,
            VideoProviderClient videoProviderClient,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.meetingLinkRepository = meetingLinkRepository;
        this.meetingSessionRepository = meetingSessionRepository;
        this.videoProviderClient = videoProviderClient;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public JoinMeetingResponse join(String token, JoinMeetingRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (meetingLinkRepository.claim(token, request.participantId(), now) == 0) {
            throw rejection(token, now);
        }

        MeetingLink link = meetingLinkRepository.findByTokenWithSession(token)
                .orElseThrow(() -> new IllegalStateException("Claimed link vanished: " + token));
        MeetingSession session = link.getSession();
        UUID sessionId = session.getId();
        boolean firstJoin = false;

        if (session.getStatus() == MeetingStatus.SCHEDULED) {
            OffsetDateTime autoEndAt = now.plusMinutes(session.getDurationLimitMinutes());
            firstJoin = meetingSessionRepository.activate(sessionId, now, autoEndAt) == 1;
            // Winner or not, the stored timer is the one that counts.
            session = meetingSessionRepository.findById(sessionId)
                    .orElseThrow(() -> new IllegalStateException("Session vanished: " + sessionId));
        }

        if (session.getStatus().isClosed()) {
            throw new ProblemException(HttpStatus.CONFLICT, "SESSION_CLOSED",
                    "The meeting is " + session.getStatus().wireValue());
        }
        OffsetDateTime autoEndAt = session.getAutoEndAt();
        if (!autoEndAt.isAfter(now)) {
            throw new ProblemException(HttpStatus.CONFLICT, "SESSION_TIME_EXCEEDED");
        }

        String participantToken;
        try {
            participantToken = videoProviderClient.mintParticipantToken(session.getProviderRoomName(),
                    request.participantName(), Duration.between(now, autoEndAt));
        } catch (VideoProviderException ex) {
            log.warn("Participant token for session {} could not be minted: {}", sessionId, ex.getMessage());
            throw new RetryableProblemException(HttpStatus.SERVICE_UNAVAILABLE, "PROVIDER_UNAVAILABLE",
                    "The video provider is unavailable, the link was not used", PROVIDER_RETRY_AFTER_SECONDS, ex);
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("linkId", link.getId().toString());
        detail.put("participantName", request.participantName());
        detail.put("firstJoin", firstJoin);
        auditLogService.record(AuditLogCommand.forSession(ACTION_LINK_CONSUMED, sessionId,
                request.participantId(), detail));
        if (firstJoin) {
            log.info("Meeting {} started by first join, auto end at {}", sessionId, autoEndAt);
        }

        String roomRef = session.getProviderRoomUrl() != null ? session.getProviderRoomUrl()
                : session.getProviderRoomName();
        return new JoinMeetingResponse(roomRef, participantToken, sessionId, autoEndAt,
                session.getDurationLimitMinutes());
    }

    private ProblemException rejection(String token, OffsetDateTime now) {
        return meetingLinkRepository.findByTokenWithSession(token)
                .map(link -> link.isExpiredAt(now)
                        ? new ProblemException(HttpStatus.GONE, "LINK_EXPIRED")
                        : new ProblemException(HttpStatus.CONFLICT, "LINK_USED"))
                .orElseGet(() -> new ProblemException(HttpStatus.NOT_FOUND, "LINK_NOT_FOUND"));
    }
}
