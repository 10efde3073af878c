package com.meetlink.backend.modules.meeting.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HexFormat;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

import com.meetlink.backend.global.error.ProblemException;
import com.meetlink.backend.modules.meeting.domain.MeetingLink;
import com.meetlink.backend.modules.meeting.domain.MeetingSession;
import com.meetlink.backend.modules.meeting.domain.MeetingStatus;
import com.meetlink.backend.modules.meeting.presentation.dto.CreateMeetingRequest;
import com.meetlink.backend.modules.meeting.presentation.dto.CreateMeetingResponse;
import com.meetlink.backend.modules.meeting.presentation.dto.ReissueLinkResponse;
import com.meetlink.backend.modules.provider.application.VideoProviderClient;
import com.meetlink.backend.modules.provider.application.VideoProviderException;
import com.meetlink.backend.modules.provider.domain.ProviderRoom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Creates the provider room, then records session and first link. Not transactional on
 * purpose: no database transaction stays open across the provider round trip.
 */
@Service
public class MeetingLinkIssuer {

    private static final Logger log = LoggerFactory.getLogger(MeetingLinkIssuer.class);

    static final int DEFAULT_MAX_PARTICIPANTS = 10;
    private static final String JOIN_PATH = "/meet/";

    private final VideoProviderClient videoProviderClient;
    private final MeetingLifecycleService meetingLifecycleService;
    private final Clock clock;
    private final String joinBaseUrl;
    private final int maxDurationMinutes;

    public MeetingLinkIssuer(
            VideoProviderClient videoProviderClient,
            MeetingLifecycleService meetingLifecycleService,
            Clock clock,
            @Value("${app.meeting.join-base-url}") String joinBaseUrl,
            @Value("${app.meeting.max-duration-minutes:40}") int maxDurationMinutes
    ) {
        this.videoProviderClient = videoProviderClient;
        this.meetingLifecycleService = meetingLifecycleService;
        this.clock = clock;
        this.joinBaseUrl = joinBaseUrl.endsWith("/") ? joinBaseUrl.substring(0, joinBaseUrl.length() - 1) : joinBaseUrl;
        this.maxDurationMinutes = Math.min(Math.max(1, maxDurationMinutes), MeetingSession.MAX_DURATION_MINUTES);
    }

    public CreateMeetingResponse issue(CreateMeetingRequest request, MeetingActor actor, String callerName) {
        if (!actor.isAuthenticated()) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED");
        }
        UUID hostId = request.hostId() != null ? request.hostId() : actor.userId();
        if (!hostId.equals(actor.userId()) && !actor.admin()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "HOST_MISMATCH",
                    "Meetings can only be created for yourself");
        }

        int durationMinutes = clampDuration(request.durationMinutes());
        int maxParticipants = request.maxParticipants() != null ? request.maxParticipants() : DEFAULT_MAX_PARTICIPANTS;
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime linkExpiresAt = now.plusMinutes(durationMinutes);
        String roomName = newRoomName(now);

        // The room outlives the link by one full session so a late first join still gets its whole limit.
        ProviderRoom room;
        try {
            room = videoProviderClient.createRoom(roomName, linkExpiresAt.plusMinutes(durationMinutes), maxParticipants);
        } catch (VideoProviderException ex) {
            log.warn("Provider room creation failed for {}: {}", roomName, ex.getMessage());
            throw new ProblemException(HttpStatus.BAD_GATEWAY, "PROVIDER_UNAVAILABLE",
                    "The video provider could not create a room", ex);
        }

        MeetingSession session = new MeetingSession();
        session.setHostId(hostId);
        session.setHostName(StringUtils.hasText(request.hostName()) ? request.hostName().trim() : callerName);
        session.setTitle(request.title().trim());
        session.setMaxParticipants(maxParticipants);
        session.setProviderRoomName(room.name());
        session.setProviderRoomUrl(room.url());
        session.setStatus(MeetingStatus.SCHEDULED);
        session.setDurationLimitMinutes(durationMinutes);

        MeetingLink link;
        try {
            link = meetingLifecycleService.recordScheduled(session, linkExpiresAt, actor);
        } catch (RuntimeException ex) {
            log.error("Meeting persistence failed after provider room {} was created; reconcile if it survives",
                    room.name(), ex);
            releaseOrphanedRoom(room.name());
            throw new ProblemException(HttpStatus.INTERNAL_SERVER_ERROR, "MEETING_PERSISTENCE_FAILED",
                    "The meeting could not be saved (room " + room.name() + ")", ex);
        }

        log.info("Meeting {} scheduled for host {} ({} min, room {})", session.getId(), hostId, durationMinutes,
                room.name());
        return new CreateMeetingResponse(
                session.getId(),
                joinUrl(link.getToken()),
                link.getToken(),
                link.getExpiresAt(),
                durationMinutes,
                session.getTitle(),
                hostId
        );
    }

    public ReissueLinkResponse reissue(UUID sessionId, MeetingActor actor) {
        MeetingLifecycleService.ReissuedLink reissued = meetingLifecycleService.reissueLink(sessionId, actor);
        return new ReissueLinkResponse(
                reissued.sessionId(),
                joinUrl(reissued.token()),
                reissued.token(),
                reissued.expiresAt(),
                reissued.revokedLinks()
        );
    }

    String joinUrl(String token) {
        return joinBaseUrl + JOIN_PATH + token;
    }

    int clampDuration(Integer requested) {
        if (requested == null) {
            return maxDurationMinutes;
        }
        return Math.max(1, Math.min(requested, maxDurationMinutes));
    }

    static String newRoomName(OffsetDateTime now) {
        byte[] suffix = new byte[4];
        ThreadLocalRandom.current().nextBytes(suffix);
        return "room-" + now.toInstant().toEpochMilli() + "-" + HexFormat.of().formatHex(suffix);
    }

    private void releaseOrphanedRoom(String roomName) {
        try {
            videoProviderClient.deleteRoom(roomName);
        } catch (VideoProviderException ex) {
            log.error("Orphaned provider room {} could not be deleted: {}", roomName, ex.getMessage());
        }
    }
}
