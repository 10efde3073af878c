package com.meetlink.backend.modules.meeting.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.meetlink.backend.modules.meeting.domain.MeetingEndReason;
import com.meetlink.backend.modules.meeting.domain.MeetingSession;
import com.meetlink.backend.modules.meeting.domain.MeetingStatus;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * State transitions are compare-and-set updates on {@code status}; a return value of
 * {@code 0} means another request moved the session first.
 */
public interface MeetingSessionRepository extends JpaRepository<MeetingSession, UUID> {

    Optional<MeetingSession> findByProviderRoomName(String providerRoomName);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update MeetingSession s
               set s.status = com.meetlink.backend.modules.meeting.domain.MeetingStatus.ACTIVE,
                   s.startedAt = :now,
                   s.autoEndAt = :autoEndAt,
                   s.updatedAt = :now
             where s.id = :id
               and s.status = com.meetlink.backend.modules.meeting.domain.MeetingStatus.SCHEDULED
            """)
    int activate(@Param("id") UUID id,
                 @Param("now") OffsetDateTime now,
                 @Param("autoEndAt") OffsetDateTime autoEndAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update MeetingSession s
               set s.status = com.meetlink.backend.modules.meeting.domain.MeetingStatus.ENDED,
                   s.endedAt = :now,
                   s.endReason = :reason,
                   s.durationSeconds = :durationSeconds,
                   s.updatedAt = :now
             where s.id = :id
               and s.status = :expectedStatus
            """)
    int end(@Param("id") UUID id,
            @Param("expectedStatus") MeetingStatus expectedStatus,
            @Param("now") OffsetDateTime now,
            @Param("reason") MeetingEndReason reason,
            @Param("durationSeconds") Long durationSeconds);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update MeetingSession s
               set s.status = com.meetlink.backend.modules.meeting.domain.MeetingStatus.CANCELLED,
                   s.cancelledBy = :cancelledBy,
                   s.cancelledAt = :now,
                   s.cancellationReason = :reason,
                   s.updatedAt = :now
             where s.id = :id
               and s.status = com.meetlink.backend.modules.meeting.domain.MeetingStatus.SCHEDULED
            """)
    int cancel(@Param("id") UUID id,
               @Param("cancelledBy") UUID cancelledBy,
               @Param("now") OffsetDateTime now,
               @Param("reason") String reason);

    @Query("""
            select s.id
              from MeetingSession s
             where s.status = com.meetlink.backend.modules.meeting.domain.MeetingStatus.ACTIVE
               and s.autoEndAt <= :now
             order by s.autoEndAt asc
            """)
    List<UUID> findOverdueActiveIds(@Param("now") OffsetDateTime now, Pageable pageable);
}
