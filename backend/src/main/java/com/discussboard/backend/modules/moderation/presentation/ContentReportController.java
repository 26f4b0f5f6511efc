package com.discussboard.backend.modules.moderation.presentation;

import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.security.SecurityUtils;
import com.discussboard.backend.modules.auth.domain.ActorType;
import com.discussboard.backend.modules.moderation.application.ContentReportService;
import com.discussboard.backend.modules.moderation.presentation.dto.ContentReportRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.ContentReportResponse;
import com.discussboard.backend.modules.moderation.presentation.dto.ContentReportSearchRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.ContentReportUpdateRequest;

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
@Tag(name = "Content reports", description = "Member reports on posts and comments")
public class ContentReportController {

    private final ContentReportService reportService;

    public ContentReportController(ContentReportService reportService) {
        this.reportService = reportService;
    }

    @PostMapping("/member/contentReports")
    @Operation(summary = "Report a post or a comment")
    public ResponseEntity<ContentReportResponse> create(@Valid @RequestBody ContentReportRequest request) {
        ContentReportResponse response = reportService.create(SecurityUtils.getCurrentMemberId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @DeleteMapping("/member/contentReports/{reportId}")
    @Operation(summary = "Withdraw an own pending report")
    public ResponseEntity<Void> withdraw(@PathVariable("reportId") UUID reportId) {
        reportService.eraseOwn(SecurityUtils.getCurrentMemberId(), reportId);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping({"/moderator/contentReports", "/administrator/contentReports"})
    public ResponseEntity<PageResponse<ContentReportResponse>> search(
            @RequestBody ContentReportSearchRequest request
    ) {
        return ResponseEntity.ok(reportService.search(request));
    }

    @GetMapping("/administrator/contentReports/{reportId}")
    public ResponseEntity<ContentReportResponse> get(@PathVariable("reportId") UUID reportId) {
        return ResponseEntity.ok(reportService.get(reportId));
    }

    @PutMapping("/moderator/contentReports/{reportId}")
    public ResponseEntity<ContentReportResponse> updateAsModerator(
            @PathVariable("reportId") UUID reportId,
            @Valid @RequestBody ContentReportUpdateRequest request
    ) {
        return ResponseEntity.ok(
                reportService.update(ActorType.MODERATOR, SecurityUtils.getCurrentMemberId(), reportId, request));
    }

    @PutMapping("/administrator/contentReports/{reportId}")
    public ResponseEntity<ContentReportResponse> updateAsAdministrator(
            @PathVariable("reportId") UUID reportId,
            @Valid @RequestBody ContentReportUpdateRequest request
    ) {
        return ResponseEntity.ok(
                reportService.update(ActorType.ADMINISTRATOR, SecurityUtils.getCurrentMemberId(), reportId, request));
    }

    @DeleteMapping("/moderator/contentReports/{reportId}")
    public ResponseEntity<Void> erase(@PathVariable("reportId") UUID reportId) {
        reportService.eraseAsModerator(SecurityUtils.getCurrentMemberId(), reportId);
        return ResponseEntity.noContent().build();
    }
}
