package com.discussboard.backend.modules.audit.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.discussboard.backend.modules.audit.domain.GlobalAuditLog;

public record AuditLogResponse(
        UUID id,
        UUID actorId,
        String actorType,
        String actionCategory,
        String targetTable,
        String targetId,
        Map<String, Object> eventPayload,
        String eventDescription,
        OffsetDateTime createdAt
) {

    public static AuditLogResponse from(GlobalAuditLog log) {
        return new AuditLogResponse(
                log.getId(),
                log.getActorId(),
                log.getActorType(),
                log.getActionCategory(),
                log.getTargetTable(),
                log.getTargetId(),
                log.getEventPayload(),
                log.getEventDescription(),
                log.getCreatedAt()
        );
    }
}
