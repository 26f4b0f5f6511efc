package com.discussboard.backend.modules.audit.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Filters for the audit trail. {@code sort} takes the form {@code "<field> <asc|desc>"}.
 */
public record AuditLogSearchRequest(
        Integer page,
        Integer limit,
        String actorType,
        UUID actorId,
        String actionCategory,
        String targetTable,
        String targetId,
        String description,
        OffsetDateTime createdFrom,
        OffsetDateTime createdTo,
        String sort
) {
}
