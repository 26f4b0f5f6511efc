package com.discussboard.backend.modules.audit.presentation;

import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.modules.audit.application.AuditLogService;
import com.discussboard.backend.modules.audit.presentation.dto.AuditLogResponse;
import com.discussboard.backend.modules.audit.presentation.dto.AuditLogSearchRequest;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/discussBoard/administrator/auditLogs")
public class AuditLogController {

    private final AuditLogService auditLogService;

    public AuditLogController(AuditLogService auditLogService) {
        this.auditLogService = auditLogService;
    }

    @PatchMapping
    public ResponseEntity<PageResponse<AuditLogResponse>> search(@RequestBody AuditLogSearchRequest request) {
        return ResponseEntity.ok(auditLogService.search(request));
    }

    @GetMapping("/{auditLogId}")
    public ResponseEntity<AuditLogResponse> get(@PathVariable("auditLogId") UUID auditLogId) {
        return ResponseEntity.ok(auditLogService.get(auditLogId));
    }
}
