package com.discussboard.backend.modules.notification.presentation;

import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.security.SecurityUtils;
import com.discussboard.backend.modules.notification.application.NotificationService;
import com.discussboard.backend.modules.notification.presentation.dto.NotificationPreferenceRequest;
import com.discussboard.backend.modules.notification.presentation.dto.NotificationPreferenceResponse;
import com.discussboard.backend.modules.notification.presentation.dto.NotificationResponse;
import com.discussboard.backend.modules.notification.presentation.dto.NotificationSearchRequest;

import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/discussBoard")
@Tag(name = "Notifications", description = "Notification inbox and delivery preferences")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping({"/member/notifications/{notificationId}", "/moderator/notifications/{notificationId}"})
    public ResponseEntity<NotificationResponse> get(@PathVariable("notificationId") UUID notificationId) {
        return ResponseEntity.ok(notificationService.getOwn(SecurityUtils.getCurrentUserAccountId(), notificationId));
    }

    @PatchMapping("/administrator/notifications")
    public ResponseEntity<PageResponse<NotificationResponse>> search(@RequestBody NotificationSearchRequest request) {
        return ResponseEntity.ok(notificationService.search(request));
    }

    @GetMapping("/member/members/{memberId}/notificationPreferences")
    public ResponseEntity<NotificationPreferenceResponse> getPreferences(@PathVariable("memberId") UUID memberId) {
        return ResponseEntity.ok(notificationService.getPreferences(SecurityUtils.getCurrentMemberId(), memberId));
    }

    @PutMapping("/member/members/{memberId}/notificationPreferences")
    public ResponseEntity<NotificationPreferenceResponse> updatePreferences(
            @PathVariable("memberId") UUID memberId,
            @RequestBody NotificationPreferenceRequest request
    ) {
        return ResponseEntity.ok(
                notificationService.updatePreferences(SecurityUtils.getCurrentMemberId(), memberId, request));
    }

    @PutMapping("/administrator/members/{memberId}/notificationPreferences")
    public ResponseEntity<NotificationPreferenceResponse> updatePreferencesAsAdministrator(
            @PathVariable("memberId") UUID memberId,
            @RequestBody NotificationPreferenceRequest request
    ) {
        return ResponseEntity.ok(notificationService.updatePreferencesAsAdministrator(memberId, request));
    }
}
