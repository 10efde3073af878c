package com.meetlink.backend.modules.meeting.application;

import java.util.UUID;

import com.meetlink.backend.modules.meeting.domain.MeetingEndReason;
import com.meetlink.backend.modules.meeting.presentation.dto.CancelMeetingResponse;
import com.meetlink.backend.modules.meeting.presentation.dto.EndMeetingResponse;
import com.meetlink.backend.modules.provider.application.VideoProviderClient;
import com.meetlink.backend.modules.provider.application.VideoProviderException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Ends or cancels meetings. The state change commits first; releasing the provider room
 * afterwards is best effort and never undoes it.
 */
@Service
public class MeetingTerminator {

    private static final Logger log = LoggerFactory.getLogger(MeetingTerminator.class);

    private final MeetingLifecycleService meetingLifecycleService;
    private final VideoProviderClient videoProviderClient;

    public MeetingTerminator(MeetingLifecycleService meetingLifecycleService,
                             VideoProviderClient videoProviderClient) {
        this.meetingLifecycleService = meetingLifecycleService;
        this.videoProviderClient = videoProviderClient;
    }

    public EndMeetingResponse end(UUID sessionId, MeetingEndReason reason, Long durationSeconds, MeetingActor actor) {
        MeetingLifecycleService.EndOutcome outcome =
                meetingLifecycleService.end(sessionId, reason, durationSeconds, actor);
        releaseRoom(sessionId, outcome.roomToRelease());
        return outcome.response();
    }

    public CancelMeetingResponse cancel(UUID sessionId, String reason, MeetingActor actor) {
        MeetingLifecycleService.CancelOutcome outcome = meetingLifecycleService.cancel(sessionId, reason, actor);
        releaseRoom(sessionId, outcome.roomToRelease());
        return outcome.response();
    }

    private void releaseRoom(UUID sessionId, String roomName) {
        if (roomName == null) {
            return;
        }
        try {
            videoProviderClient.deleteRoom(roomName);
        } catch (VideoProviderException ex) {
            log.warn("Room {} of closed meeting {} could not be deleted, provider expiry will reclaim it: {}",
                    roomName, sessionId, ex.getMessage());
        } catch (RuntimeException ex) {
            // the transition is committed; the room is left to provider expiry
            log.warn("Releasing room {} of closed meeting {} failed unexpectedly", roomName, sessionId, ex);
        }
    }
}
