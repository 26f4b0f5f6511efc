package com.discussboard.backend.modules.platform.presentation;

import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.security.SecurityUtils;
import com.discussboard.backend.modules.platform.application.SettingService;
import com.discussboard.backend.modules.platform.presentation.dto.SettingRequest;
import com.discussboard.backend.modules.platform.presentation.dto.SettingResponse;
import com.discussboard.backend.modules.platform.presentation.dto.SettingSearchRequest;
import com.discussboard.backend.modules.platform.presentation.dto.SettingUpdateRequest;

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
@RequestMapping("/discussBoard/administrator/settings")
@Tag(name = "Settings", description = "Platform configuration entries")
public class SettingController {

    private final SettingService settingService;

    public SettingController(SettingService settingService) {
        this.settingService = settingService;
    }

    @PatchMapping
    public ResponseEntity<PageResponse<SettingResponse>> search(@RequestBody SettingSearchRequest request) {
        return ResponseEntity.ok(settingService.search(request));
    }

    @GetMapping("/{settingId}")
    public ResponseEntity<SettingResponse> get(@PathVariable("settingId") UUID settingId) {
        return ResponseEntity.ok(settingService.get(settingId));
    }

    @PostMapping
    public ResponseEntity<SettingResponse> create(@Valid @RequestBody SettingRequest request) {
        SettingResponse response = settingService.create(SecurityUtils.getCurrentMemberId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PutMapping("/{settingId}")
    public ResponseEntity<SettingResponse> update(@PathVariable("settingId") UUID settingId,
                                                  @Valid @RequestBody SettingUpdateRequest request) {
        return ResponseEntity.ok(settingService.update(SecurityUtils.getCurrentMemberId(), settingId, request));
    }
}
