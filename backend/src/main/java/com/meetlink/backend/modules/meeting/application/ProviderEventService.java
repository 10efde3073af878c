package com.meetlink.backend.modules.meeting.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.Set;

import com.meetlink.backend.global.error.ProblemException;
import com.meetlink.backend.modules.meeting.domain.MeetingEndReason;
import com.meetlink.backend.modules.meeting.domain.MeetingSession;
import com.meetlink.backend.modules.meeting.domain.MeetingStatus;
import com.meetlink.backend.modules.meeting.infrastructure.persistence.MeetingSessionRepository;
import com.meetlink.backend.modules.meeting.presentation.dto.ProviderEventRequest;
import com.meetlink.backend.modules.meeting.presentation.dto.ProviderEventResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Provider callbacks are hints. They never carry authority of their own: a meeting is
 * ended only when its stored timer has already run out.
 */
@Service
public class ProviderEventService {

    private static final Logger log = LoggerFactory.getLogger(ProviderEventService.class);

    static final String OUTCOME_ENDED = "ended";
    static final String OUTCOME_IGNORED = "ignored";
    static final String OUTCOME_UNKNOWN_ROOM = "unknown_room";

    private static final Set<String> END_HINTS = Set.of("meeting.ended", "room.expired");

    private final MeetingSessionRepository meetingSessionRepository;
    private final MeetingTerminator meetingTerminator;
    private final Clock clock;
    private final byte[] webhookSecret;

    public ProviderEventService(
            MeetingSessionRepository meetingSessionRepository,
            MeetingTerminator meetingTerminator,
            Clock clock,
            @Value("${app.video-provider.webhook-secret:}") String webhookSecret
    ) {
        this.meetingSessionRepository = meetingSessionRepository;
        this.meetingTerminator = meetingTerminator;
        this.clock = clock;
        this.webhookSecret = webhookSecret.getBytes(StandardCharsets.UTF_8);
    }

    public ProviderEventResponse handle(String signature, ProviderEventRequest event) {
        verifySignature(signature);
        if (!END_HINTS.contains(event.type())) {
            return new ProviderEventResponse(OUTCOME_IGNORED);
        }

        Optional<MeetingSession> found = meetingSessionRepository.findByProviderRoomName(event.roomName());
        if (found.isEmpty()) {
            log.debug("Provider event {} for unknown room {}", event.type(), event.roomName());
            return new ProviderEventResponse(OUTCOME_UNKNOWN_ROOM);
        }

        MeetingSession session = found.get();
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (session.getStatus() != MeetingStatus.ACTIVE || !MeetingEndPolicy.isTimeLimitReached(session, now)) {
            return new ProviderEventResponse(OUTCOME_IGNORED);
        }
        meetingTerminator.end(session.getId(), MeetingEndReason.TIME_LIMIT, null, MeetingActor.systemActor());
        log.info("Meeting {} ended after provider event {}", session.getId(), event.type());
        return new ProviderEventResponse(OUTCOME_ENDED);
    }

    private void verifySignature(String signature) {
        if (webhookSecret.length == 0) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "PROVIDER_EVENTS_DISABLED");
        }
        if (!StringUtils.hasText(signature)
                || !MessageDigest.isEqual(webhookSecret, signature.getBytes(StandardCharsets.UTF_8))) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_PROVIDER_SIGNATURE");
        }
    }
}
