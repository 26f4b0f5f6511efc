package com.discussboard.backend.modules.notification.application;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.global.common.paging.PageQuery;
import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.auth.infrastructure.persistence.MemberRepository;
import com.discussboard.backend.modules.notification.domain.DeliveryChannel;
import com.discussboard.backend.modules.notification.domain.DeliveryStatus;
import com.discussboard.backend.modules.notification.domain.Notification;
import com.discussboard.backend.modules.notification.domain.NotificationPreference;
import com.discussboard.backend.modules.notification.infrastructure.persistence.NotificationPreferenceRepository;
import com.discussboard.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.discussboard.backend.modules.notification.presentation.dto.NotificationPreferenceRequest;
import com.discussboard.backend.modules.notification.presentation.dto.NotificationPreferenceResponse;
import com.discussboard.backend.modules.notification.presentation.dto.NotificationResponse;
import com.discussboard.backend.modules.notification.presentation.dto.NotificationSearchRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    public static final String EVENT_COMMENT_CREATED = "comment_created";
    public static final String EVENT_MODERATION_ACTION = "moderation_action";
    public static final String EVENT_APPEAL_DECISION = "appeal_decision";

    static final Set<String> SORT_FIELDS = Set.of("createdAt", "updatedAt", "eventType", "deliveryStatus");

    private final NotificationRepository notificationRepository;
    private final NotificationPreferenceRepository preferenceRepository;
    private final MemberRepository memberRepository;

    public NotificationService(
            NotificationRepository notificationRepository,
            NotificationPreferenceRepository preferenceRepository,
            MemberRepository memberRepository
    ) {
        this.notificationRepository = notificationRepository;
        this.preferenceRepository = preferenceRepository;
        this.memberRepository = memberRepository;
    }

    /**
     * Queues a notification on the channel the recipient prefers. Push wins over email;
     * nothing is stored when both are switched off.
     */
    public Optional<Notification> notify(UUID userAccountId, String eventType, String subject, String body) {
        NotificationPreference preference = memberRepository.findActiveByUserAccountId(userAccountId)
                .map(member -> preferenceRepository.findByMemberId(member.getId())
                        .orElseGet(() -> NotificationPreference.defaults(member.getId())))
                .orElseGet(() -> NotificationPreference.defaults(null));

        DeliveryChannel channel;
        if (preference.isPushEnabled()) {
            channel = DeliveryChannel.PUSH;
        } else if (preference.isEmailEnabled()) {
            channel = DeliveryChannel.EMAIL;
        } else {
            log.debug("Skipping {} notification for account {}: all channels disabled", eventType, userAccountId);
            return Optional.empty();
        }

        Notification notification = new Notification();
        notification.setUserAccountId(userAccountId);
        notification.setEventType(eventType);
        notification.setDeliveryChannel(channel);
        notification.setSubject(truncateSubject(subject));
        notification.setBody(body);
        notification.setDeliveryStatus(DeliveryStatus.PENDING);
        return Optional.of(notificationRepository.save(notification));
    }

    @Transactional(readOnly = true)
    public NotificationResponse getOwn(UUID userAccountId, UUID notificationId) {
        Notification notification = notificationRepository.findActiveById(notificationId)
                .orElseThrow(() -> ProblemException.notFound("NOTIFICATION_NOT_FOUND", "Notification not found"));
        if (!notification.getUserAccountId().equals(userAccountId)) {
            throw ProblemException.forbidden("NOTIFICATION_FORBIDDEN", "Notification belongs to another account");
        }
        return NotificationResponse.from(notification);
    }

    @Transactional(readOnly = true)
    public PageResponse<NotificationResponse> search(NotificationSearchRequest request) {
        return PageResponse.from(notificationRepository.search(
                request.userAccountId(),
                request.eventType() == null || request.eventType().isBlank() ? null : request.eventType().trim(),
                EnumValues.parseOptional(DeliveryChannel.class, request.deliveryChannel(), "INVALID_DELIVERY_CHANNEL"),
                EnumValues.parseOptional(DeliveryStatus.class, request.deliveryStatus(), "INVALID_DELIVERY_STATUS"),
                request.createdFrom(),
                request.createdTo(),
                PageQuery.of(request.page(), request.limit(), request.sortBy(), request.sortDirection(), SORT_FIELDS)
        ), NotificationResponse::from);
    }

    @Transactional(readOnly = true)
    public NotificationPreferenceResponse getPreferences(UUID callerMemberId, UUID memberId) {
        requireSelf(callerMemberId, memberId);
        requireMember(memberId);
        return NotificationPreferenceResponse.from(preferenceRepository.findByMemberId(memberId)
                .orElseGet(() -> NotificationPreference.defaults(memberId)));
    }

    public NotificationPreferenceResponse updatePreferences(UUID callerMemberId, UUID memberId,
                                                            NotificationPreferenceRequest request) {
        requireSelf(callerMemberId, memberId);
        return upsert(memberId, request);
    }

    public NotificationPreferenceResponse updatePreferencesAsAdministrator(UUID memberId,
                                                                           NotificationPreferenceRequest request) {
        return upsert(memberId, request);
    }

    private NotificationPreferenceResponse upsert(UUID memberId, NotificationPreferenceRequest request) {
        requireMember(memberId);
        NotificationPreference preference = preferenceRepository.findByMemberId(memberId)
                .orElseGet(() -> NotificationPreference.defaults(memberId));
        if (request.emailNotificationsEnabled() != null) {
            preference.setEmailEnabled(request.emailNotificationsEnabled());
        }
        if (request.smsNotificationsEnabled() != null) {
            preference.setSmsEnabled(request.smsNotificationsEnabled());
        }
        if (request.pushNotificationsEnabled() != null) {
            preference.setPushEnabled(request.pushNotificationsEnabled());
        }
        if (request.newsletterOptIn() != null) {
            preference.setNewsletterOptIn(request.newsletterOptIn());
        }
        return NotificationPreferenceResponse.from(preferenceRepository.saveAndFlush(preference));
    }

    private void requireSelf(UUID callerMemberId, UUID memberId) {
        if (!memberId.equals(callerMemberId)) {
            throw ProblemException.forbidden("PREFERENCE_FORBIDDEN", "Preferences belong to another member");
        }
    }

    private void requireMember(UUID memberId) {
        if (memberRepository.findActiveById(memberId).isEmpty()) {
            throw ProblemException.notFound("MEMBER_NOT_FOUND", "Member not found");
        }
    }

    static String truncateSubject(String subject) {
        if (subject.length() <= Notification.MAX_SUBJECT_LENGTH) {
            return subject;
        }
        return subject.substring(0, Notification.MAX_SUBJECT_LENGTH - 3) + "...";
    }
}
