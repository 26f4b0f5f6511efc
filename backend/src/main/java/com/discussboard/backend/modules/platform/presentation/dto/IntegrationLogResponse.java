package com.discussboard.backend.modules.platform.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.modules.platform.domain.IntegrationLog;

public record IntegrationLogResponse(
        UUID id,
        UUID userAccountId,
        String integrationType,
        String integrationPartner,
        String payload,
        String integrationStatus,
        String externalReferenceId,
        String triggeredEvent,
        String errorMessage,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static IntegrationLogResponse from(IntegrationLog log) {
        return new IntegrationLogResponse(
                log.getId(),
                log.getUserAccountId(),
                log.getIntegrationType(),
                log.getIntegrationPartner(),
                log.getPayload(),
                log.getIntegrationStatus(),
                log.getExternalReferenceId(),
                log.getTriggeredEvent(),
                log.getErrorMessage(),
                log.getCreatedAt(),
                log.getUpdatedAt()
        );
    }
}
