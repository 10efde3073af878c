package com.meetlink.backend.modules.meeting.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.meetlink.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * One meeting, independent of the provider room backing it.
 * <p>
 * Only creation goes through the persistence context. Every later transition
 * (first join, end, cancel) is a guarded bulk update in
 * {@code MeetingSessionRepository}, which is what keeps {@code startedAt},
 * {@code autoEndAt} and {@code endedAt} write-once under concurrent requests.
 */
@Entity
@Table(name = "meeting_session")
public class MeetingSession extends AbstractTimestampedEntity {

    /** Hard ceiling on a session's duration limit, in minutes. */
    public static final int MAX_DURATION_MINUTES = 40;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "host_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID hostId;

    @Column(name = "host_name", length = 120)
    private String hostName;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "max_participants", nullable = false)
    private int maxParticipants;

    @Column(name = "provider_room_name", nullable = false, length = 128)
    private String providerRoomName;

    @Column(name = "provider_room_url", length = 512)
    private String providerRoomUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private MeetingStatus status = MeetingStatus.SCHEDULED;

    @Column(name = "duration_limit_minutes", nullable = false)
    private int durationLimitMinutes;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "auto_end_at")
    private OffsetDateTime autoEndAt;

    @Column(name = "ended_at")
    private OffsetDateTime endedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "end_reason", length = 16)
    private MeetingEndReason endReason;

    @Column(name = "duration_seconds")
    private Long durationSeconds;

    @Column(name = "cancelled_by", columnDefinition = "uuid")
    private UUID cancelledBy;

    @Column(name = "cancelled_at")
    private OffsetDateTime cancelledAt;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    public UUID getId() {
        return id;
    }

    public UUID getHostId() {
        return hostId;
    }

    public void setHostId(UUID hostId) {
        this.hostId = hostId;
    }

    public String getHostName() {
        return hostName;
    }

    public void setHostName(String hostName) {
        this.hostName = hostName;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public int getMaxParticipants() {
        return maxParticipants;
    }

    public void setMaxParticipants(int maxParticipants) {
        this.maxParticipants = maxParticipants;
    }

    public String getProviderRoomName() {
        return providerRoomName;
    }

    public void setProviderRoomName(String providerRoomName) {
        this.providerRoomName = providerRoomName;
    }

    public String getProviderRoomUrl() {
        return providerRoomUrl;
    }

    public void setProviderRoomUrl(String providerRoomUrl) {
        this.providerRoomUrl = providerRoomUrl;
    }

    public MeetingStatus getStatus() {
        return status;
    }

    public void setStatus(MeetingStatus status) {
        this.status = status;
    }

    public int getDurationLimitMinutes() {
        return durationLimitMinutes;
    }

    public void setDurationLimitMinutes(int durationLimitMinutes) {
        this.durationLimitMinutes = durationLimitMinutes;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(OffsetDateTime startedAt) {
        this.startedAt = startedAt;
    }

    public OffsetDateTime getAutoEndAt() {
        return autoEndAt;
    }

    public void setAutoEndAt(OffsetDateTime autoEndAt) {
        this.autoEndAt = autoEndAt;
    }

    public OffsetDateTime getEndedAt() {
        return endedAt;
    }

    public void setEndedAt(OffsetDateTime endedAt) {
        this.endedAt = endedAt;
    }

    public MeetingEndReason getEndReason() {
        return endReason;
    }

    public void setEndReason(MeetingEndReason endReason) {
        this.endReason = endReason;
    }

    public Long getDurationSeconds() {
        return durationSeconds;
    }

    public void setDurationSeconds(Long durationSeconds) {
        this.durationSeconds = durationSeconds;
    }

    public UUID getCancelledBy() {
        return cancelledBy;
    }

    public void setCancelledBy(UUID cancelledBy) {
        this.cancelledBy = cancelledBy;
    }

    public OffsetDateTime getCancelledAt() {
        return cancelledAt;
    }

    public void setCancelledAt(OffsetDateTime cancelledAt) {
        this.cancelledAt = cancelledAt;
    }

    public String getCancellationReason() {
        return cancellationReason;
    }

    public void setCancellationReason(String cancellationReason) {
        this.cancellationReason = cancellationReason;
    }

    public boolean isHostedBy(UUID userId) {
        return userId != null && userId.equals(hostId);
    }
}
