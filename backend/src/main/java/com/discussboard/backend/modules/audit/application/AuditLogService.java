package com.discussboard.backend.modules.audit.application;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageQuery;
import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.audit.domain.GlobalAuditLog;
import com.discussboard.backend.modules.audit.infrastructure.persistence.GlobalAuditLogRepository;
import com.discussboard.backend.modules.audit.presentation.dto.AuditLogResponse;
import com.discussboard.backend.modules.audit.presentation.dto.AuditLogSearchRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);
    static final int MAX_LIMIT = 100;
    static final Set<String> SORT_FIELDS = Set.of("createdAt", "actionCategory", "actorType", "targetTable");

    private final GlobalAuditLogRepository auditLogRepository;

    public AuditLogService(GlobalAuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actorType(), "actorType is required");
        Objects.requireNonNull(command.actionCategory(), "actionCategory is required");
        Objects.requireNonNull(command.targetTable(), "targetTable is required");

        GlobalAuditLog auditLog = new GlobalAuditLog();
        auditLog.setActorId(command.actorId());
        auditLog.setActorType(command.actorType());
        auditLog.setActionCategory(command.actionCategory());
        auditLog.setTargetTable(command.targetTable());
        auditLog.setTargetId(command.targetId() != null ? command.targetId().toString() : null);
        auditLog.setEventDescription(command.description());
        if (command.payload() != null && !command.payload().isEmpty()) {
            auditLog.setEventPayload(new HashMap<>(command.payload()));
        }
        auditLogRepository.save(auditLog);
        log.info("Audit {} {} on {}:{} by {} {}", command.actionCategory(), command.description(),
                command.targetTable(), command.targetId(), command.actorType(), command.actorId());
    }

    @Transactional(readOnly = true)
    public PageResponse<AuditLogResponse> search(AuditLogSearchRequest request) {
        Pageable pageable = PageQuery.ofExpression(request.page(), request.limit(), MAX_LIMIT, request.sort(),
                SORT_FIELDS);
        return PageResponse.from(auditLogRepository.search(
                blankToNull(request.actorType()),
                request.actorId(),
                blankToNull(request.actionCategory()),
                blankToNull(request.targetTable()),
                blankToNull(request.targetId()),
                PageQuery.likePattern(request.description()),
                request.createdFrom(),
                request.createdTo(),
                pageable
        ), AuditLogResponse::from);
    }

    @Transactional(readOnly = true)
    public AuditLogResponse get(UUID auditLogId) {
        return auditLogRepository.findById(auditLogId)
                .map(AuditLogResponse::from)
                .orElseThrow(() -> ProblemException.notFound("AUDIT_LOG_NOT_FOUND", "Audit log not found"));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public record AuditLogCommand(
            UUID actorId,
            String actorType,
            String actionCategory,
            String targetTable,
            UUID targetId,
            String description,
            Map<String, Object> payload
    ) {
    }
}
