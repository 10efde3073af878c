package com.meetlink.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.meetlink.backend.modules.audit.domain.AuditLog;
import com.meetlink.backend.modules.audit.infrastructure.AuditLogRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only trail of meeting lifecycle events. Joins the caller's transaction so an
 * entry exists exactly when the change it describes was committed.
 */
@Service
public class AuditLogService {

    public static final String RESOURCE_MEETING_SESSION = "MEETING_SESSION";

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setActorId(command.actorId());
        auditLog.setCorrelationId(command.correlationId());
        auditLog.setCreatedAt(OffsetDateTime.now(clock));

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            String actorId,
            UUID correlationId,
            Map<String, Object> detail
    ) {

        public static AuditLogCommand forSession(String actionType, UUID sessionId, String actorId,
                                                 Map<String, Object> detail) {
            return new AuditLogCommand(actionType, RESOURCE_MEETING_SESSION, sessionId.toString(), actorId,
                    sessionId, detail);
        }
    }
}
