package com.meetlink.backend.modules.meeting.application;

import static com.meetlink.backend.modules.meeting.application.MeetingFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Period;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import com.meetlink.backend.global.error.ProblemException;
import com.meetlink.backend.modules.meeting.domain.MeetingEndReason;
import com.meetlink.backend.modules.meeting.infrastructure.persistence.MeetingSessionRepository;
import com.meetlink.backend.modules.meeting.presentation.dto.EndMeetingResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class MeetingMaintenanceSchedulerTest {

    @Mock
    private MeetingSessionRepository meetingSessionRepository;

    @Mock
    private MeetingLifecycleService meetingLifecycleService;

    @Mock
    private MeetingTerminator meetingTerminator;

    private MeetingMaintenanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new MeetingMaintenanceScheduler(meetingSessionRepository, meetingLifecycleService,
                meetingTerminator, Clock.fixed(NOW.toInstant(), ZoneOffset.UTC), 50, Period.ofDays(7));
    }

    @Test
    @DisplayName("overdue meetings are ended as time_limit by the system, one failure does not stop the batch")
    void endsOverdueMeetings() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        UUID third = UUID.randomUUID();
        when(meetingSessionRepository.findOverdueActiveIds(NOW, PageRequest.of(0, 50)))
                .thenReturn(List.of(first, second, third));
        when(meetingTerminator.end(eq(first), eq(MeetingEndReason.TIME_LIMIT), isNull(), eq(MeetingActor.systemActor())))
                .thenReturn(new EndMeetingResponse(first, true, NOW, MeetingEndReason.TIME_LIMIT, false));
        when(meetingTerminator.end(eq(second), any(), any(), any()))
                .thenThrow(new ProblemException(HttpStatus.CONFLICT, "SESSION_STATE_CHANGED"));
        when(meetingTerminator.end(eq(third), any(), any(), any()))
                .thenReturn(new EndMeetingResponse(third, true, NOW, MeetingEndReason.MANUAL, true));

        assertThat(scheduler.endOverdueMeetings()).isEqualTo(1);
        verify(meetingTerminator).end(eq(third), eq(MeetingEndReason.TIME_LIMIT), isNull(), eq(MeetingActor.systemActor()));
    }

    @Test
    @DisplayName("a lock failure on one meeting leaves the rest of the batch to run")
    void lockFailureDoesNotAbortSweep() {
        UUID locked = UUID.randomUUID();
        UUID next = UUID.randomUUID();
        when(meetingSessionRepository.findOverdueActiveIds(NOW, PageRequest.of(0, 50)))
                .thenReturn(List.of(locked, next));
        when(meetingTerminator.end(eq(locked), any(), any(), any()))
                .thenThrow(new CannotAcquireLockException("deadlock detected"));
        when(meetingTerminator.end(eq(next), any(), any(), any()))
                .thenReturn(new EndMeetingResponse(next, true, NOW, MeetingEndReason.TIME_LIMIT, false));

        assertThat(scheduler.endOverdueMeetings()).isEqualTo(1);
        verify(meetingTerminator).end(eq(next), eq(MeetingEndReason.TIME_LIMIT), isNull(), eq(MeetingActor.systemActor()));
    }

    @Test
    @DisplayName("links are purged once past the retention window")
    void purgesWithRetention() {
        when(meetingLifecycleService.purgeLinksExpiredBefore(NOW.minusDays(7))).thenReturn(3);

        assertThat(scheduler.purgeExpiredLinks()).isEqualTo(3);
    }
}
