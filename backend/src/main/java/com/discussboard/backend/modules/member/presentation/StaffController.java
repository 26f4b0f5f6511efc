package com.discussboard.backend.modules.member.presentation;

import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.security.SecurityUtils;
import com.discussboard.backend.modules.auth.presentation.dto.AdministratorResponse;
import com.discussboard.backend.modules.auth.presentation.dto.ModeratorResponse;
import com.discussboard.backend.modules.member.application.StaffService;
import com.discussboard.backend.modules.member.presentation.dto.StaffSearchRequest;
import com.discussboard.backend.modules.member.presentation.dto.StaffUpdateRequest;

import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/discussBoard/administrator")
@Tag(name = "Staff", description = "Moderator and administrator records")
public class StaffController {

    private final StaffService staffService;

    public StaffController(StaffService staffService) {
        this.staffService = staffService;
    }

    @PatchMapping("/moderators")
    public ResponseEntity<PageResponse<ModeratorResponse>> searchModerators(@RequestBody StaffSearchRequest request) {
        return ResponseEntity.ok(staffService.searchModerators(request));
    }

    @GetMapping("/moderators/{moderatorId}")
    public ResponseEntity<ModeratorResponse> getModerator(@PathVariable("moderatorId") UUID moderatorId) {
        return ResponseEntity.ok(staffService.getModerator(moderatorId));
    }

    @PutMapping("/moderators/{moderatorId}")
    public ResponseEntity<ModeratorResponse> updateModerator(@PathVariable("moderatorId") UUID moderatorId,
                                                             @Valid @RequestBody StaffUpdateRequest request) {
        return ResponseEntity.ok(
                staffService.updateModerator(SecurityUtils.getCurrentMemberId(), moderatorId, request));
    }

    @PatchMapping("/administrators")
    public ResponseEntity<PageResponse<AdministratorResponse>> searchAdministrators(
            @RequestBody StaffSearchRequest request
    ) {
        return ResponseEntity.ok(staffService.searchAdministrators(request));
    }

    @GetMapping("/administrators/{administratorId}")
    public ResponseEntity<AdministratorResponse> getAdministrator(
            @PathVariable("administratorId") UUID administratorId
    ) {
        return ResponseEntity.ok(staffService.getAdministrator(administratorId));
    }

    @PutMapping("/administrators/{administratorId}")
    public ResponseEntity<AdministratorResponse> updateAdministrator(
            @PathVariable("administratorId") UUID administratorId,
            @Valid @RequestBody StaffUpdateRequest request
    ) {
        return ResponseEntity.ok(
                staffService.updateAdministrator(SecurityUtils.getCurrentMemberId(), administratorId, request));
    }

    @DeleteMapping("/administrators/{administratorId}")
    public ResponseEntity<Void> eraseAdministrator(@PathVariable("administratorId") UUID administratorId) {
        staffService.eraseAdministrator(SecurityUtils.getCurrentMemberId(), administratorId);
        return ResponseEntity.noContent().build();
    }
}
