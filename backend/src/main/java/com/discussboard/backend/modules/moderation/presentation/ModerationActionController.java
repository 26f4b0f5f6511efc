package com.discussboard.backend.modules.moderation.presentation;

import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.security.SecurityUtils;
import com.discussboard.backend.modules.auth.domain.ActorType;
import com.discussboard.backend.modules.moderation.application.ModerationActionService;
import com.discussboard.backend.modules.moderation.application.ModerationLogService;
import com.discussboard.backend.modules.moderation.presentation.dto.ModerationActionRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.ModerationActionResponse;
import com.discussboard.backend.modules.moderation.presentation.dto.ModerationActionSearchRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.ModerationActionUpdateRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.ModerationLogRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.ModerationLogResponse;
import com.discussboard.backend.modules.moderation.presentation.dto.ModerationLogSearchRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.ModerationLogUpdateRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/discussBoard")
@Tag(name = "Moderation actions", description = "Moderator decisions and their log trail")
public class ModerationActionController {

    private final ModerationActionService actionService;
    private final ModerationLogService logService;

    public ModerationActionController(ModerationActionService actionService, ModerationLogService logService) {
        this.actionService = actionService;
        this.logService = logService;
    }

    @PostMapping("/moderator/moderationActions")
    @Operation(summary = "Take a moderation action and apply its side effects")
    public ResponseEntity<ModerationActionResponse> createAsModerator(
            @Valid @RequestBody ModerationActionRequest request
    ) {
        return created(actionService.create(ActorType.MODERATOR, SecurityUtils.getCurrentMemberId(), request));
    }

    @PostMapping("/administrator/moderationActions")
    public ResponseEntity<ModerationActionResponse> createAsAdministrator(
            @Valid @RequestBody ModerationActionRequest request
    ) {
        return created(actionService.create(ActorType.ADMINISTRATOR, SecurityUtils.getCurrentMemberId(), request));
    }

    @PatchMapping("/moderator/moderationActions")
    public ResponseEntity<PageResponse<ModerationActionResponse>> search(
            @RequestBody ModerationActionSearchRequest request
    ) {
        return ResponseEntity.ok(actionService.search(request));
    }

    @GetMapping({"/moderator/moderationActions/{actionId}", "/administrator/moderationActions/{actionId}"})
    public ResponseEntity<ModerationActionResponse> get(@PathVariable("actionId") UUID actionId) {
        return ResponseEntity.ok(actionService.get(actionId));
    }

    @PutMapping("/moderator/moderationActions/{actionId}")
    public ResponseEntity<ModerationActionResponse> updateAsModerator(
            @PathVariable("actionId") UUID actionId,
            @Valid @RequestBody ModerationActionUpdateRequest request
    ) {
        return ResponseEntity.ok(
                actionService.update(ActorType.MODERATOR, SecurityUtils.getCurrentMemberId(), actionId, request));
    }

    @PutMapping("/administrator/moderationActions/{actionId}")
    public ResponseEntity<ModerationActionResponse> updateAsAdministrator(
            @PathVariable("actionId") UUID actionId,
            @Valid @RequestBody ModerationActionUpdateRequest request
    ) {
        return ResponseEntity.ok(
                actionService.update(ActorType.ADMINISTRATOR, SecurityUtils.getCurrentMemberId(), actionId, request));
    }

    @DeleteMapping("/administrator/moderationActions/{actionId}")
    public ResponseEntity<Void> erase(@PathVariable("actionId") UUID actionId) {
        actionService.erase(SecurityUtils.getCurrentMemberId(), actionId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/moderator/moderationActions/{actionId}/moderationLogs")
    public ResponseEntity<ModerationLogResponse> createLogAsModerator(
            @PathVariable("actionId") UUID actionId,
            @Valid @RequestBody ModerationLogRequest request
    ) {
        ModerationLogResponse response =
                logService.create(ActorType.MODERATOR, SecurityUtils.getCurrentMemberId(), actionId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/administrator/moderationActions/{actionId}/moderationLogs")
    public ResponseEntity<ModerationLogResponse> createLogAsAdministrator(
            @PathVariable("actionId") UUID actionId,
            @Valid @RequestBody ModerationLogRequest request
    ) {
        ModerationLogResponse response =
                logService.create(ActorType.ADMINISTRATOR, SecurityUtils.getCurrentMemberId(), actionId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PatchMapping({
            "/moderator/moderationActions/{actionId}/moderationLogs",
            "/administrator/moderationActions/{actionId}/moderationLogs"
    })
    public ResponseEntity<PageResponse<ModerationLogResponse>> searchLogs(
            @PathVariable("actionId") UUID actionId,
            @RequestBody ModerationLogSearchRequest request
    ) {
        return ResponseEntity.ok(logService.search(actionId, request));
    }

    @GetMapping({
            "/moderator/moderationActions/{actionId}/moderationLogs/{logId}",
            "/administrator/moderationActions/{actionId}/moderationLogs/{logId}"
    })
    public ResponseEntity<ModerationLogResponse> getLog(@PathVariable("actionId") UUID actionId,
                                                        @PathVariable("logId") UUID logId) {
        return ResponseEntity.ok(logService.get(actionId, logId));
    }

    @PutMapping("/administrator/moderationActions/{actionId}/moderationLogs/{logId}")
    public ResponseEntity<ModerationLogResponse> updateLog(
            @PathVariable("actionId") UUID actionId,
            @PathVariable("logId") UUID logId,
            @Valid @RequestBody ModerationLogUpdateRequest request
    ) {
        return ResponseEntity.ok(logService.update(SecurityUtils.getCurrentMemberId(), actionId, logId, request));
    }

    @DeleteMapping("/administrator/moderationActions/{actionId}/moderationLogs/{logId}")
    public ResponseEntity<Void> eraseLog(@PathVariable("actionId") UUID actionId,
                                         @PathVariable("logId") UUID logId) {
        logService.erase(SecurityUtils.getCurrentMemberId(), actionId, logId);
        return ResponseEntity.noContent().build();
    }

    private static ResponseEntity<ModerationActionResponse> created(ModerationActionResponse response) {
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
