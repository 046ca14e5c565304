package com.makrcave.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.makrcave.backend.global.web.RequestIdFilter;
import com.makrcave.backend.modules.audit.domain.AuditLog;
import com.makrcave.backend.modules.audit.infrastructure.AuditLogRepository;
import com.makrcave.backend.modules.member.domain.Member;

import jakarta.persistence.EntityManager;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    public static final String ACTION_LOGIN = "LOGIN";

    private final AuditLogRepository auditLogRepository;
    private final EntityManager entityManager;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, EntityManager entityManager, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.entityManager = entityManager;
        this.clock = clock;
    }

    @Transactional
    public AuditLog record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());

        if (command.actorUserId() != null) {
            Member actorReference = entityManager.getReference(Member.class, command.actorUserId());
            auditLog.setActor(actorReference);
        }

        auditLog.setMakerspaceId(command.makerspaceId());
        auditLog.setSessionId(command.sessionId());
        auditLog.setIpAddress(command.ipAddress());
        auditLog.setUserAgent(command.userAgent());
        auditLog.setSuccess(command.success());
        auditLog.setFailureReason(command.failureReason());
        auditLog.setCorrelationId(command.correlationId() != null
                ? command.correlationId()
                : RequestIdFilter.currentCorrelationId());

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }
        auditLog.setCreatedAt(OffsetDateTime.now(clock));

        return auditLogRepository.save(auditLog);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            UUID actorUserId,
            UUID makerspaceId,
            UUID sessionId,
            String ipAddress,
            String userAgent,
            boolean success,
            String failureReason,
            UUID correlationId,
            Map<String, Object> detail
    ) {

        public static AuditLogCommand success(
                String actionType,
                String resourceType,
                String resourceKey,
                UUID actorUserId,
                UUID makerspaceId,
                Map<String, Object> detail
        ) {
            return new AuditLogCommand(actionType, resourceType, resourceKey, actorUserId, makerspaceId,
                    null, null, null, true, null, null, detail);
        }
    }
}
