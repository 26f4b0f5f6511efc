package com.discussboard.backend.modules.platform.application;

import java.util.Set;
import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageQuery;
import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.platform.infrastructure.persistence.IntegrationLogRepository;
import com.discussboard.backend.modules.platform.presentation.dto.IntegrationLogResponse;
import com.discussboard.backend.modules.platform.presentation.dto.IntegrationLogSearchRequest;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class IntegrationLogService {

    static final int MAX_LIMIT = 1000;
    static final Set<String> SORT_FIELDS = Set.of(
            "createdAt",
            "updatedAt",
            "integrationType",
            "integrationPartner",
            "integrationStatus",
            "triggeredEvent"
    );

    private final IntegrationLogRepository integrationLogRepository;

    public IntegrationLogService(IntegrationLogRepository integrationLogRepository) {
        this.integrationLogRepository = integrationLogRepository;
    }

    public PageResponse<IntegrationLogResponse> search(IntegrationLogSearchRequest request) {
        return PageResponse.from(integrationLogRepository.search(
                request.userAccountId(),
                blankToNull(request.integrationType()),
                blankToNull(request.integrationPartner()),
                blankToNull(request.integrationStatus()),
                blankToNull(request.triggeredEvent()),
                request.createdFrom(),
                request.createdTo(),
                PageQuery.of(request.page(), request.limit(), MAX_LIMIT, request.sortBy(), request.sortDirection(),
                        SORT_FIELDS)
        ), IntegrationLogResponse::from);
    }

    public IntegrationLogResponse get(UUID integrationLogId) {
        return integrationLogRepository.findActiveById(integrationLogId)
                .map(IntegrationLogResponse::from)
                .orElseThrow(() -> ProblemException.notFound("INTEGRATION_LOG_NOT_FOUND", "Integration log not found"));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
