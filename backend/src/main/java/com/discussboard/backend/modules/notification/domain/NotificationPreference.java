package com.discussboard.backend.modules.notification.domain;

import java.util.UUID;

import com.discussboard.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Per-member delivery switches. Members without a row get the defaults from {@link #defaults(UUID)}.
 */
@Entity
@Table(name = "discuss_board_user_notification_preferences")
public class NotificationPreference extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "member_id", nullable = false, unique = true, columnDefinition = "uuid")
    private UUID memberId;

    @Column(name = "email_notifications_enabled", nullable = false)
    private boolean emailEnabled;

    @Column(name = "sms_notifications_enabled", nullable = false)
    private boolean smsEnabled;

    @Column(name = "push_notifications_enabled", nullable = false)
    private boolean pushEnabled;

    @Column(name = "newsletter_opt_in", nullable = false)
    private boolean newsletterOptIn;

    public static NotificationPreference defaults(UUID memberId) {
        NotificationPreference preference = new NotificationPreference();
        preference.memberId = memberId;
        preference.emailEnabled = true;
        preference.smsEnabled = false;
        preference.pushEnabled = true;
        preference.newsletterOptIn = false;
        return preference;
    }

    public UUID getId() {
        return id;
    }

    public UUID getMemberId() {
        return memberId;
    }

    public void setMemberId(UUID memberId) {
        this.memberId = memberId;
    }

    public boolean isEmailEnabled() {
        return emailEnabled;
    }

    public void setEmailEnabled(boolean emailEnabled) {
        this.emailEnabled = emailEnabled;
    }

    public boolean isSmsEnabled() {
        return smsEnabled;
    }

    public void setSmsEnabled(boolean smsEnabled) {
        this.smsEnabled = smsEnabled;
    }

    public boolean isPushEnabled() {
        return pushEnabled;
    }

    public void setPushEnabled(boolean pushEnabled) {
        this.pushEnabled = pushEnabled;
    }

    public boolean isNewsletterOptIn() {
        return newsletterOptIn;
    }

    public void setNewsletterOptIn(boolean newsletterOptIn) {
        this.newsletterOptIn = newsletterOptIn;
    }
}
