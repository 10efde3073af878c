package com.meetlink.backend.modules.meeting.application;

import static com.meetlink.backend.modules.meeting.application.MeetingFixtures.HOST_ID;
import static com.meetlink.backend.modules.meeting.application.MeetingFixtures.NOW;
import static com.meetlink.backend.modules.meeting.application.MeetingFixtures.SESSION_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.meetlink.backend.modules.meeting.domain.MeetingEndReason;
import com.meetlink.backend.modules.meeting.domain.MeetingStatus;
import com.meetlink.backend.modules.meeting.presentation.dto.CancelMeetingResponse;
import com.meetlink.backend.modules.meeting.presentation.dto.EndMeetingResponse;
import com.meetlink.backend.modules.provider.application.VideoProviderClient;
import com.meetlink.backend.modules.provider.application.VideoProviderException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MeetingTerminatorTest {

    @Mock
    private MeetingLifecycleService meetingLifecycleService;

    @Mock
    private VideoProviderClient videoProviderClient;

    @InjectMocks
    private MeetingTerminator terminator;

    @Test
    @DisplayName("a room that cannot be deleted does not undo the end")
    void roomDeletionFailureIsTolerated() {
        EndMeetingResponse ended = new EndMeetingResponse(SESSION_ID, true, NOW, MeetingEndReason.MANUAL, false);
        when(meetingLifecycleService.end(SESSION_ID, MeetingEndReason.MANUAL, null, MeetingActor.user(HOST_ID)))
                .thenReturn(new MeetingLifecycleService.EndOutcome("room-1", ended));
        doThrow(new VideoProviderException("timed out", null, true)).when(videoProviderClient).deleteRoom("room-1");

        EndMeetingResponse response = terminator.end(SESSION_ID, MeetingEndReason.MANUAL, null,
                MeetingActor.user(HOST_ID));

        assertThat(response).isEqualTo(ended);
        verify(videoProviderClient).deleteRoom("room-1");
    }

    @Test
    @DisplayName("an unexpected failure while releasing the room still returns the committed end")
    void unexpectedReleaseFailureIsTolerated() {
        EndMeetingResponse ended = new EndMeetingResponse(SESSION_ID, true, NOW, MeetingEndReason.TIME_LIMIT, false);
        when(meetingLifecycleService.end(SESSION_ID, MeetingEndReason.TIME_LIMIT, null, MeetingActor.systemActor()))
                .thenReturn(new MeetingLifecycleService.EndOutcome("legacy room", ended));
        doThrow(new IllegalArgumentException("Invalid provider room name: legacy room"))
                .when(videoProviderClient).deleteRoom("legacy room");

        EndMeetingResponse response = terminator.end(SESSION_ID, MeetingEndReason.TIME_LIMIT, null,
                MeetingActor.systemActor());

        assertThat(response).isEqualTo(ended);
    }

    @Test
    @DisplayName("a repeated end leaves the provider alone")
    void repeatedEndSkipsProvider() {
        EndMeetingResponse ended = new EndMeetingResponse(SESSION_ID, true, NOW, MeetingEndReason.MANUAL, true);
        when(meetingLifecycleService.end(SESSION_ID, MeetingEndReason.MANUAL, null, MeetingActor.anonymous()))
                .thenReturn(new MeetingLifecycleService.EndOutcome(null, ended));

        assertThat(terminator.end(SESSION_ID, MeetingEndReason.MANUAL, null, MeetingActor.anonymous())
                .alreadyEnded()).isTrue();
        verify(videoProviderClient, never()).deleteRoom(anyString());
    }

    @Test
    @DisplayName("cancelling releases the room")
    void cancelReleasesRoom() {
        CancelMeetingResponse cancelled = new CancelMeetingResponse(SESSION_ID, MeetingStatus.CANCELLED, NOW);
        when(meetingLifecycleService.cancel(SESSION_ID, "reason", MeetingActor.user(HOST_ID)))
                .thenReturn(new MeetingLifecycleService.CancelOutcome("room-1", cancelled));

        assertThat(terminator.cancel(SESSION_ID, "reason", MeetingActor.user(HOST_ID))).isEqualTo(cancelled);
        verify(videoProviderClient).deleteRoom("room-1");
    }
}
