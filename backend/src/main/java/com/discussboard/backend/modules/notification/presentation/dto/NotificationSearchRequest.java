package com.discussboard.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record NotificationSearchRequest(
        Integer page,
        Integer limit,
        UUID userAccountId,
        String eventType,
        String deliveryChannel,
        String deliveryStatus,
        OffsetDateTime createdFrom,
        OffsetDateTime createdTo,
        String sortBy,
        String sortDirection
) {
}
