package com.discussboard.backend.modules.platform.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record IntegrationLogSearchRequest(
        Integer page,
        Integer limit,
        UUID userAccountId,
        String integrationType,
        String integrationPartner,
        String integrationStatus,
        String triggeredEvent,
        OffsetDateTime createdFrom,
        OffsetDateTime createdTo,
        String sortBy,
        String sortDirection
) {
}
