package com.discussboard.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.modules.notification.domain.Notification;

public record NotificationResponse(
        UUID id,
        UUID userAccountId,
        String eventType,
        String deliveryChannel,
        String subject,
        String body,
        String deliveryStatus,
        OffsetDateTime deliveredAt,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static NotificationResponse from(Notification notification) {
        return new NotificationResponse(
                notification.getId(),
                notification.getUserAccountId(),
                notification.getEventType(),
                EnumValues.wire(notification.getDeliveryChannel()),
                notification.getSubject(),
                notification.getBody(),
                EnumValues.wire(notification.getDeliveryStatus()),
                notification.getDeliveredAt(),
                notification.getCreatedAt(),
                notification.getUpdatedAt()
        );
    }
}
