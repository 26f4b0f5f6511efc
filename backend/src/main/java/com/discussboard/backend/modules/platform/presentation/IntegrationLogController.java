package com.discussboard.backend.modules.platform.presentation;

import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.modules.platform.application.IntegrationLogService;
import com.discussboard.backend.modules.platform.presentation.dto.IntegrationLogResponse;
import com.discussboard.backend.modules.platform.presentation.dto.IntegrationLogSearchRequest;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/discussBoard/administrator/integrationLogs")
public class IntegrationLogController {

    private final IntegrationLogService integrationLogService;

    public IntegrationLogController(IntegrationLogService integrationLogService) {
        this.integrationLogService = integrationLogService;
    }

    @PatchMapping
    public ResponseEntity<PageResponse<IntegrationLogResponse>> search(
            @RequestBody IntegrationLogSearchRequest request
    ) {
        return ResponseEntity.ok(integrationLogService.search(request));
    }

    @GetMapping("/{integrationLogId}")
    public ResponseEntity<IntegrationLogResponse> get(@PathVariable("integrationLogId") UUID integrationLogId) {
        return ResponseEntity.ok(integrationLogService.get(integrationLogId));
    }
}
