package com.meetlink.backend.modules.meeting.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.meetlink.backend.modules.meeting.domain.MeetingLink;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MeetingLinkRepository extends JpaRepository<MeetingLink, UUID> {

    @Query("select l from MeetingLink l join fetch l.session where l.token = :token")
    Optional<MeetingLink> findByTokenWithSession(@Param("token") String token);

    /**
     * Claims one use of the link. The row lock taken by the update serialises concurrent
     * claimers and the guard is re-evaluated after the lock is granted, so for a single-use
     * link at most one caller ever sees {@code 1}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update MeetingLink l
               set l.useCount = l.useCount + 1,
                   l.used = case when l.useCount + 1 >= l.maxUses then true else false end,
                   l.usedAt = coalesce(l.usedAt, :now),
                   l.usedBy = coalesce(l.usedBy, :participantId),
                   l.updatedAt = :now
             where l.token = :token
               and l.used = false
               and l.useCount < l.maxUses
               and l.expiresAt > :now
            """)
    int claim(@Param("token") String token,
              @Param("participantId") String participantId,
              @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update MeetingLink l
               set l.expiresAt = :now,
                   l.updatedAt = :now
             where l.session.id = :sessionId
               and l.used = false
               and l.expiresAt > :now
            """)
    int revokeOutstanding(@Param("sessionId") UUID sessionId, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("delete from MeetingLink l where l.expiresAt < :cutoff")
    int purgeExpiredBefore(@Param("cutoff") OffsetDateTime cutoff);

    @Query("""
            select count(l)
              from MeetingLink l
             where l.session.id = :sessionId
               and l.usedBy = :participantId
               and l.useCount > 0
            """)
    long countConsumedBy(@Param("sessionId") UUID sessionId, @Param("participantId") String participantId);

    @Query("select l from MeetingLink l where l.session.id = :sessionId order by l.createdAt asc")
    List<MeetingLink> findBySessionId(@Param("sessionId") UUID sessionId);
}
