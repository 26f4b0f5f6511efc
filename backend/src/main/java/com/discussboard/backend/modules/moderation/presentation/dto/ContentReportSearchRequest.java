package com.discussboard.backend.modules.moderation.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ContentReportSearchRequest(
        Integer page,
        Integer limit,
        UUID reporterMemberId,
        String contentType,
        String status,
        String reason,
        OffsetDateTime createdFrom,
        OffsetDateTime createdTo,
        String sortBy,
        String sortDirection
) {
}
