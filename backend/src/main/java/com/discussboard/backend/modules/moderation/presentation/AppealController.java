package com.discussboard.backend.modules.moderation.presentation;

import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.security.SecurityUtils;
import com.discussboard.backend.modules.moderation.application.AppealService;
import com.discussboard.backend.modules.moderation.presentation.dto.AppealDecisionRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.AppealRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.AppealResponse;
import com.discussboard.backend.modules.moderation.presentation.dto.AppealSearchRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.AppealUpdateRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
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
@Tag(name = "Appeals", description = "Member appeals against moderation actions")
public class AppealController {

    private final AppealService appealService;

    public AppealController(AppealService appealService) {
        this.appealService = appealService;
    }

    @PostMapping("/member/appeals")
    public ResponseEntity<AppealResponse> create(@Valid @RequestBody AppealRequest request) {
        AppealResponse response = appealService.create(SecurityUtils.getCurrentMemberId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PutMapping("/member/appeals/{appealId}")
    public ResponseEntity<AppealResponse> updateOwn(@PathVariable("appealId") UUID appealId,
                                                    @Valid @RequestBody AppealUpdateRequest request) {
        return ResponseEntity.ok(appealService.updateOwn(SecurityUtils.getCurrentMemberId(), appealId, request));
    }

    @PatchMapping("/moderator/appeals")
    public ResponseEntity<PageResponse<AppealResponse>> search(@RequestBody AppealSearchRequest request) {
        return ResponseEntity.ok(appealService.search(request));
    }

    @GetMapping({"/moderator/appeals/{appealId}", "/administrator/appeals/{appealId}"})
    public ResponseEntity<AppealResponse> get(@PathVariable("appealId") UUID appealId) {
        return ResponseEntity.ok(appealService.get(appealId));
    }

    @PutMapping("/administrator/appeals/{appealId}")
    @Operation(summary = "Decide an appeal; accepting it reverts the moderation action")
    public ResponseEntity<AppealResponse> decide(@PathVariable("appealId") UUID appealId,
                                                 @Valid @RequestBody AppealDecisionRequest request) {
        return ResponseEntity.ok(appealService.decide(SecurityUtils.getCurrentMemberId(), appealId, request));
    }
}
