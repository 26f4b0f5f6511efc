package com.discussboard.backend.modules.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.auth.infrastructure.persistence.MemberRepository;
import com.discussboard.backend.modules.notification.application.NotificationService;
import com.discussboard.backend.modules.notification.domain.DeliveryChannel;
import com.discussboard.backend.modules.notification.domain.DeliveryStatus;
import com.discussboard.backend.modules.notification.domain.Notification;
import com.discussboard.backend.modules.notification.domain.NotificationPreference;
import com.discussboard.backend.modules.notification.infrastructure.persistence.NotificationPreferenceRepository;
import com.discussboard.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.discussboard.backend.modules.notification.presentation.dto.NotificationPreferenceRequest;
import com.discussboard.backend.modules.notification.presentation.dto.NotificationPreferenceResponse;
import com.discussboard.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private NotificationRepository notificationRepository;

    @Mock
    private NotificationPreferenceRepository preferenceRepository;

    @Mock
    private MemberRepository memberRepository;

    private NotificationService notificationService;
    private Member recipient;

    @BeforeEach
    void setUp() {
        notificationService = new NotificationService(notificationRepository, preferenceRepository, memberRepository);
        recipient = TestEntities.member("alice");

        lenient().when(memberRepository.findActiveByUserAccountId(recipient.getUserAccount().getId()))
                .thenReturn(Optional.of(recipient));
        lenient().when(memberRepository.findActiveById(recipient.getId())).thenReturn(Optional.of(recipient));
        lenient().when(notificationRepository.save(any(Notification.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(preferenceRepository.saveAndFlush(any(NotificationPreference.class)))
                .thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("without stored preferences the notification goes out as a pending push")
    void defaultsToPush() {
        when(preferenceRepository.findByMemberId(recipient.getId())).thenReturn(Optional.empty());

        Notification notification = notificationService.notify(recipient.getUserAccount().getId(),
                NotificationService.EVENT_COMMENT_CREATED, "New comment", "bob: hi").orElseThrow();

        assertThat(notification.getDeliveryChannel()).isEqualTo(DeliveryChannel.PUSH);
        assertThat(notification.getDeliveryStatus()).isEqualTo(DeliveryStatus.PENDING);
        assertThat(notification.getEventType()).isEqualTo("comment_created");
    }

    @Test
    void fallsBackToEmailWhenPushDisabled() {
        NotificationPreference preference = NotificationPreference.defaults(recipient.getId());
        preference.setPushEnabled(false);
        when(preferenceRepository.findByMemberId(recipient.getId())).thenReturn(Optional.of(preference));

        Optional<Notification> notification = notificationService.notify(recipient.getUserAccount().getId(),
                NotificationService.EVENT_MODERATION_ACTION, "Action", "warn");

        assertThat(notification).map(Notification::getDeliveryChannel).contains(DeliveryChannel.EMAIL);
    }

    @Test
    void storesNothingWhenEveryChannelIsOff() {
        NotificationPreference preference = NotificationPreference.defaults(recipient.getId());
        preference.setPushEnabled(false);
        preference.setEmailEnabled(false);
        when(preferenceRepository.findByMemberId(recipient.getId())).thenReturn(Optional.of(preference));

        assertThat(notificationService.notify(recipient.getUserAccount().getId(),
                NotificationService.EVENT_APPEAL_DECISION, "Appeal", "accepted")).isEmpty();
        verify(notificationRepository, never()).save(any());
    }

    @Test
    void readingAnotherAccountsNotificationIsForbidden() {
        Notification notification = TestEntities.withId(new Notification(), UUID.randomUUID());
        notification.setUserAccountId(UUID.randomUUID());
        when(notificationRepository.findActiveById(notification.getId())).thenReturn(Optional.of(notification));

        assertThatThrownBy(() -> notificationService.getOwn(recipient.getUserAccount().getId(), notification.getId()))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("NOTIFICATION_FORBIDDEN");
    }

    @Test
    @DisplayName("preference updates only touch the fields that are present")
    void partialPreferenceUpdate() {
        when(preferenceRepository.findByMemberId(recipient.getId())).thenReturn(Optional.empty());

        NotificationPreferenceResponse response = notificationService.updatePreferences(recipient.getId(),
                recipient.getId(), new NotificationPreferenceRequest(null, true, false, null));

        assertThat(response.emailNotificationsEnabled()).isTrue();
        assertThat(response.smsNotificationsEnabled()).isTrue();
        assertThat(response.pushNotificationsEnabled()).isFalse();
        assertThat(response.newsletterOptIn()).isFalse();
    }

    @Test
    void membersCannotEditOthersPreferences() {
        assertThatThrownBy(() -> notificationService.updatePreferences(UUID.randomUUID(), recipient.getId(),
                new NotificationPreferenceRequest(true, null, null, null)))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("PREFERENCE_FORBIDDEN");
    }

    @Test
    @DisplayName("subjects longer than the column are cut to fit")
    void truncatesLongSubject() {
        when(preferenceRepository.findByMemberId(recipient.getId())).thenReturn(Optional.empty());
        String subject = "New comment on \"" + "t".repeat(300) + "\"";

        Notification notification = notificationService.notify(recipient.getUserAccount().getId(),
                NotificationService.EVENT_COMMENT_CREATED, subject, "bob: hi").orElseThrow();

        assertThat(notification.getSubject()).hasSize(Notification.MAX_SUBJECT_LENGTH).endsWith("...");
    }
}
