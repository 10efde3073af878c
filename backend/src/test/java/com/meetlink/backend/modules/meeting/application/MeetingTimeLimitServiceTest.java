package com.meetlink.backend.modules.meeting.application;

import static com.meetlink.backend.modules.meeting.application.MeetingFixtures.NOW;
import static com.meetlink.backend.modules.meeting.application.MeetingFixtures.SESSION_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Optional;

import com.meetlink.backend.modules.meeting.domain.MeetingEndReason;
import com.meetlink.backend.modules.meeting.domain.MeetingSession;
import com.meetlink.backend.modules.meeting.domain.MeetingStatus;
import com.meetlink.backend.modules.meeting.infrastructure.persistence.MeetingSessionRepository;
import com.meetlink.backend.modules.meeting.presentation.dto.MeetingStatusResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MeetingTimeLimitServiceTest {

    @Mock
    private MeetingSessionRepository meetingSessionRepository;

    private MeetingTimeLimitService timeLimitService;

    @BeforeEach
    void setUp() {
        timeLimitService = new MeetingTimeLimitService(meetingSessionRepository,
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("a scheduled session has no timer and never exceeds")
    void scheduledSession() {
        when(meetingSessionRepository.findById(SESSION_ID)).thenReturn(Optional.of(MeetingFixtures.scheduledSession()));

        MeetingStatusResponse status = timeLimitService.status(SESSION_ID);

        assertThat(status.status()).isEqualTo(MeetingStatus.SCHEDULED);
        assertThat(status.timeExceeded()).isFalse();
        assertThat(status.timeRemainingSeconds()).isNull();
        assertThat(status.autoEndAt()).isNull();
        assertThat(status.durationMinutes()).isEqualTo(40);
    }

    @Test
    @DisplayName("remaining time counts down and reaching auto end counts as exceeded")
    void activeSessionCountdown() {
        when(meetingSessionRepository.findById(SESSION_ID))
                .thenReturn(Optional.of(MeetingFixtures.activeSession(NOW.minusMinutes(15))));
        MeetingStatusResponse running = timeLimitService.status(SESSION_ID);
        assertThat(running.timeExceeded()).isFalse();
        assertThat(running.timeRemainingSeconds()).isEqualTo(25 * 60L);

        when(meetingSessionRepository.findById(SESSION_ID))
                .thenReturn(Optional.of(MeetingFixtures.activeSession(NOW.minusMinutes(40))));
        MeetingStatusResponse atLimit = timeLimitService.status(SESSION_ID);
        assertThat(atLimit.timeExceeded()).isTrue();
        assertThat(atLimit.timeRemainingSeconds()).isZero();
    }

    @Test
    @DisplayName("ended sessions keep their timer and end reason")
    void endedSession() {
        MeetingSession ended = MeetingFixtures.activeSession(NOW.minusMinutes(50));
        ended.setStatus(MeetingStatus.ENDED);
        ended.setEndedAt(NOW.minusMinutes(10));
        ended.setEndReason(MeetingEndReason.TIME_LIMIT);
        when(meetingSessionRepository.findById(SESSION_ID)).thenReturn(Optional.of(ended));

        MeetingStatusResponse status = timeLimitService.status(SESSION_ID);

        assertThat(status.timeExceeded()).isTrue();
        assertThat(status.timeRemainingSeconds()).isNull();
        assertThat(status.endReason()).isEqualTo(MeetingEndReason.TIME_LIMIT);
        assertThat(status.endedAt()).isEqualTo(NOW.minusMinutes(10));
    }

    @Test
    @DisplayName("unknown sessions are not found")
    void unknownSession() {
        when(meetingSessionRepository.findById(SESSION_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> timeLimitService.status(SESSION_ID))
                .hasFieldOrPropertyWithValue("code", "SESSION_NOT_FOUND");
    }
}
