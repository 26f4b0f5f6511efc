package com.discussboard.backend.modules.platform.presentation;

import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.security.SecurityUtils;
import com.discussboard.backend.modules.platform.application.ForbiddenWordService;
import com.discussboard.backend.modules.platform.presentation.dto.ForbiddenWordRequest;
import com.discussboard.backend.modules.platform.presentation.dto.ForbiddenWordResponse;
import com.discussboard.backend.modules.platform.presentation.dto.ForbiddenWordSearchRequest;
import com.discussboard.backend.modules.platform.presentation.dto.ForbiddenWordUpdateRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/discussBoard/administrator/forbiddenWords")
@Tag(name = "Forbidden words", description = "Expressions rejected in posts and comments")
public class ForbiddenWordController {

    private final ForbiddenWordService forbiddenWordService;

    public ForbiddenWordController(ForbiddenWordService forbiddenWordService) {
        this.forbiddenWordService = forbiddenWordService;
    }

    @PatchMapping
    public ResponseEntity<PageResponse<ForbiddenWordResponse>> search(
            @RequestBody ForbiddenWordSearchRequest request
    ) {
        return ResponseEntity.ok(forbiddenWordService.search(request));
    }

    @Operation(summary = "Register a forbidden expression")
    @PostMapping
    public ResponseEntity<ForbiddenWordResponse> create(@Valid @RequestBody ForbiddenWordRequest request) {
        ForbiddenWordResponse response = forbiddenWordService.create(SecurityUtils.getCurrentMemberId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PutMapping("/{forbiddenWordId}")
    public ResponseEntity<ForbiddenWordResponse> update(@PathVariable("forbiddenWordId") UUID forbiddenWordId,
                                                        @Valid @RequestBody ForbiddenWordUpdateRequest request) {
        return ResponseEntity.ok(
                forbiddenWordService.update(SecurityUtils.getCurrentMemberId(), forbiddenWordId, request));
    }

    @DeleteMapping("/{forbiddenWordId}")
    public ResponseEntity<Void> erase(@PathVariable("forbiddenWordId") UUID forbiddenWordId) {
        forbiddenWordService.erase(SecurityUtils.getCurrentMemberId(), forbiddenWordId);
        return ResponseEntity.noContent().build();
    }
}
