package com.meetlink.backend.modules.meeting.application;

import static com.meetlink.backend.modules.meeting.application.MeetingFixtures.NOW;
import static com.meetlink.backend.modules.meeting.application.MeetingFixtures.SESSION_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Optional;

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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class MeetingJoinServiceTest {

    private static final String TOKEN = "tok-123";

    @Mock
    private MeetingLinkRepository meetingLinkRepository;

    @Mock
    private MeetingSessionRepository meetingSessionRepository;

    @Mock
    private VideoProviderClient videoProviderClient;

    @Mock
    private AuditLogService auditLogService;

    private MeetingJoinService joinService;

    private final JoinMeetingRequest request = new JoinMeetingRequest("guest-1", "Guest One");

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        joinService = new MeetingJoinService(meetingLinkRepository, meetingSessionRepository, videoProviderClient,
                auditLogService, clock);
    }

    @Test
    @DisplayName("first join activates the session and mints a token valid until auto end")
    void firstJoinStartsTimer() {
        MeetingSession scheduled = MeetingFixtures.scheduledSession();
        MeetingSession active = MeetingFixtures.activeSession(NOW);
        when(meetingLinkRepository.claim(TOKEN, "guest-1", NOW)).thenReturn(1);
        when(meetingLinkRepository.findByTokenWithSession(TOKEN))
                .thenReturn(Optional.of(MeetingFixtures.link(scheduled, TOKEN, NOW.plusMinutes(40))));
        when(meetingSessionRepository.activate(SESSION_ID, NOW, NOW.plusMinutes(40))).thenReturn(1);
        when(meetingSessionRepository.findById(SESSION_ID)).thenReturn(Optional.of(active));
        when(videoProviderClient.mintParticipantToken(scheduled.getProviderRoomName(), "Guest One",
                Duration.ofMinutes(40))).thenReturn("participant-token");

        JoinMeetingResponse response = joinService.join(TOKEN, request);

        assertThat(response.participantToken()).isEqualTo("participant-token");
        assertThat(response.autoEndAt()).isEqualTo(NOW.plusMinutes(40));
        assertThat(response.providerRoomRef()).isEqualTo(scheduled.getProviderRoomUrl());

        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(captor.capture());
        assertThat(captor.getValue().actionType()).isEqualTo("MEETING_LINK_CONSUMED");
        assertThat(captor.getValue().actorId()).isEqualTo("guest-1");
        assertThat(captor.getValue().detail()).containsEntry("firstJoin", true);
    }

    @Test
    @DisplayName("a losing activation adopts the timer the winner stored")
    void losingActivationKeepsWinnersTimer() {
        MeetingSession winnerView = MeetingFixtures.activeSession(NOW.minusSeconds(2));
        when(meetingLinkRepository.claim(TOKEN, "guest-1", NOW)).thenReturn(1);
        when(meetingLinkRepository.findByTokenWithSession(TOKEN))
                .thenReturn(Optional.of(MeetingFixtures.link(MeetingFixtures.scheduledSession(), TOKEN,
                        NOW.plusMinutes(40))));
        when(meetingSessionRepository.activate(SESSION_ID, NOW, NOW.plusMinutes(40))).thenReturn(0);
        when(meetingSessionRepository.findById(SESSION_ID)).thenReturn(Optional.of(winnerView));
        when(videoProviderClient.mintParticipantToken(anyString(), anyString(), any(Duration.class)))
                .thenReturn("participant-token");

        JoinMeetingResponse response = joinService.join(TOKEN, request);

        assertThat(response.autoEndAt()).isEqualTo(winnerView.getAutoEndAt());
        verify(videoProviderClient).mintParticipantToken(anyString(), eq("Guest One"),
                eq(Duration.ofMinutes(40).minusSeconds(2)));
    }

    @Test
    @DisplayName("joining an active session keeps its timer untouched")
    void joinActiveSession() {
        MeetingSession active = MeetingFixtures.activeSession(NOW.minusMinutes(10));
        when(meetingLinkRepository.claim(TOKEN, "guest-1", NOW)).thenReturn(1);
        when(meetingLinkRepository.findByTokenWithSession(TOKEN))
                .thenReturn(Optional.of(MeetingFixtures.link(active, TOKEN, active.getAutoEndAt())));
        when(videoProviderClient.mintParticipantToken(anyString(), anyString(), any(Duration.class)))
                .thenReturn("participant-token");

        JoinMeetingResponse response = joinService.join(TOKEN, request);

        assertThat(response.autoEndAt()).isEqualTo(NOW.plusMinutes(30));
        verify(meetingSessionRepository, never()).activate(any(), any(), any());
    }

    @Test
    @DisplayName("a failed claim is classified as not found, expired or used")
    void rejectedClaims() {
        when(meetingLinkRepository.claim(anyString(), anyString(), eq(NOW))).thenReturn(0);
        MeetingLink expired = MeetingFixtures.link(MeetingFixtures.scheduledSession(), "expired", NOW);
        MeetingLink used = MeetingFixtures.link(MeetingFixtures.scheduledSession(), "used", NOW.plusMinutes(5));
        used.setUsed(true);
        used.setUseCount(1);
        when(meetingLinkRepository.findByTokenWithSession("missing")).thenReturn(Optional.empty());
        when(meetingLinkRepository.findByTokenWithSession("expired")).thenReturn(Optional.of(expired));
        when(meetingLinkRepository.findByTokenWithSession("used")).thenReturn(Optional.of(used));

        assertThatThrownBy(() -> joinService.join("missing", request))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", "LINK_NOT_FOUND");
        assertThatThrownBy(() -> joinService.join("expired", request))
                .hasFieldOrPropertyWithValue("code", "LINK_EXPIRED");
        assertThatThrownBy(() -> joinService.join("used", request))
                .hasFieldOrPropertyWithValue("code", "LINK_USED");
        verify(videoProviderClient, never()).mintParticipantToken(anyString(), anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("a session past its time limit refuses the participant")
    void exceededSessionRefuses() {
        MeetingSession active = MeetingFixtures.activeSession(NOW.minusMinutes(40));
        when(meetingLinkRepository.claim(TOKEN, "guest-1", NOW)).thenReturn(1);
        when(meetingLinkRepository.findByTokenWithSession(TOKEN))
                .thenReturn(Optional.of(MeetingFixtures.link(active, TOKEN, NOW.plusMinutes(1))));

        assertThatThrownBy(() -> joinService.join(TOKEN, request))
                .hasFieldOrPropertyWithValue("code", "SESSION_TIME_EXCEEDED");
    }

    @Test
    @DisplayName("a closed session refuses the participant")
    void closedSessionRefuses() {
        MeetingSession ended = MeetingFixtures.activeSession(NOW.minusMinutes(5));
        ended.setStatus(MeetingStatus.ENDED);
        when(meetingLinkRepository.claim(TOKEN, "guest-1", NOW)).thenReturn(1);
        when(meetingLinkRepository.findByTokenWithSession(TOKEN))
                .thenReturn(Optional.of(MeetingFixtures.link(ended, TOKEN, NOW.plusMinutes(1))));

        assertThatThrownBy(() -> joinService.join(TOKEN, request))
                .hasFieldOrPropertyWithValue("code", "SESSION_CLOSED");
    }

    @Test
    @DisplayName("a provider failure surfaces as a retryable 503")
    void providerFailureIsRetryable() {
        MeetingSession active = MeetingFixtures.activeSession(NOW.minusMinutes(1));
        when(meetingLinkRepository.claim(TOKEN, "guest-1", NOW)).thenReturn(1);
        when(meetingLinkRepository.findByTokenWithSession(TOKEN))
                .thenReturn(Optional.of(MeetingFixtures.link(active, TOKEN, active.getAutoEndAt())));
        when(videoProviderClient.mintParticipantToken(anyString(), anyString(), any(Duration.class)))
                .thenThrow(new VideoProviderException("timed out", null, true));

        assertThatThrownBy(() -> joinService.join(TOKEN, request))
                .isInstanceOfSatisfying(RetryableProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
                    assertThat(ex.getRetryAfterSeconds()).isEqualTo(MeetingJoinService.PROVIDER_RETRY_AFTER_SECONDS);
                });
        verify(auditLogService, never()).record(any());
    }
}
