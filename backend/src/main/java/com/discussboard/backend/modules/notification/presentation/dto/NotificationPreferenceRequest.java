package com.discussboard.backend.modules.notification.presentation.dto;

/**
 * Null switches keep their stored value.
 */
public record NotificationPreferenceRequest(
        Boolean emailNotificationsEnabled,
        Boolean smsNotificationsEnabled,
        Boolean pushNotificationsEnabled,
        Boolean newsletterOptIn
) {
}
