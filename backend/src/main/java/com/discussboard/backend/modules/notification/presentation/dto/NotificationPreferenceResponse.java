package com.discussboard.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.modules.notification.domain.NotificationPreference;

public record NotificationPreferenceResponse(
        UUID id,
        UUID memberId,
        boolean emailNotificationsEnabled,
        boolean smsNotificationsEnabled,
        boolean pushNotificationsEnabled,
        boolean newsletterOptIn,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static NotificationPreferenceResponse from(NotificationPreference preference) {
        return new NotificationPreferenceResponse(
                preference.getId(),
                preference.getMemberId(),
                preference.isEmailEnabled(),
                preference.isSmsEnabled(),
                preference.isPushEnabled(),
                preference.isNewsletterOptIn(),
                preference.getCreatedAt(),
                preference.getUpdatedAt()
        );
    }
}
