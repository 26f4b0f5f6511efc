package com.discussboard.backend.modules.member.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.global.common.paging.PageQuery;
import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.audit.application.AuditLogService;
import com.discussboard.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.discussboard.backend.modules.auth.domain.Administrator;
import com.discussboard.backend.modules.auth.domain.Moderator;
import com.discussboard.backend.modules.auth.domain.StaffStatus;
import com.discussboard.backend.modules.auth.infrastructure.persistence.AdministratorRepository;
import com.discussboard.backend.modules.auth.infrastructure.persistence.ModeratorRepository;
import com.discussboard.backend.modules.auth.presentation.dto.AdministratorResponse;
import com.discussboard.backend.modules.auth.presentation.dto.ModeratorResponse;
import com.discussboard.backend.modules.member.presentation.dto.StaffSearchRequest;
import com.discussboard.backend.modules.member.presentation.dto.StaffUpdateRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Administrator-side management of moderator and administrator records.
 */
@Service
@Transactional
public class StaffService {

    private static final Logger log = LoggerFactory.getLogger(StaffService.class);
    static final Set<String> MODERATOR_SORT_FIELDS = Set.of("createdAt", "assignedAt", "status");
    static final Set<String> ADMINISTRATOR_SORT_FIELDS = Set.of("createdAt", "escalatedAt", "status");

    private final ModeratorRepository moderatorRepository;
    private final AdministratorRepository administratorRepository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public StaffService(
            ModeratorRepository moderatorRepository,
            AdministratorRepository administratorRepository,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.moderatorRepository = moderatorRepository;
        this.administratorRepository = administratorRepository;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public PageResponse<ModeratorResponse> searchModerators(StaffSearchRequest request) {
        return PageResponse.from(moderatorRepository.search(
                parseStatus(request.status()),
                request.memberId(),
                request.assignedByAdministratorId(),
                PageQuery.of(request.page(), request.limit(), request.sortBy(), request.sortDirection(),
                        MODERATOR_SORT_FIELDS)
        ), ModeratorResponse::from);
    }

    @Transactional(readOnly = true)
    public ModeratorResponse getModerator(UUID moderatorId) {
        return ModeratorResponse.from(loadModerator(moderatorId));
    }

    public ModeratorResponse updateModerator(UUID actorMemberId, UUID moderatorId, StaffUpdateRequest request) {
        Moderator moderator = loadModerator(moderatorId);
        StaffStatus status = EnumValues.parse(StaffStatus.class, request.status(), "INVALID_STAFF_STATUS");
        moderator.setStatus(status);
        moderator.setRevokedAt(status == StaffStatus.REVOKED ? OffsetDateTime.now(clock) : null);
        moderatorRepository.saveAndFlush(moderator);
        audit(actorMemberId, "moderator_status_change", "discuss_board_moderators", moderator.getId(), status);
        return ModeratorResponse.from(moderator);
    }

    @Transactional(readOnly = true)
    public PageResponse<AdministratorResponse> searchAdministrators(StaffSearchRequest request) {
        return PageResponse.from(administratorRepository.search(
                parseStatus(request.status()),
                request.memberId(),
                PageQuery.of(request.page(), request.limit(), request.sortBy(), request.sortDirection(),
                        ADMINISTRATOR_SORT_FIELDS)
        ), AdministratorResponse::from);
    }

    @Transactional(readOnly = true)
    public AdministratorResponse getAdministrator(UUID administratorId) {
        return AdministratorResponse.from(loadAdministrator(administratorId));
    }

    public AdministratorResponse updateAdministrator(UUID actorMemberId, UUID administratorId,
                                                     StaffUpdateRequest request) {
        Administrator administrator = loadAdministrator(administratorId);
        StaffStatus status = EnumValues.parse(StaffStatus.class, request.status(), "INVALID_STAFF_STATUS");
        administrator.setStatus(status);
        administrator.setRevokedAt(status == StaffStatus.REVOKED ? OffsetDateTime.now(clock) : null);
        administratorRepository.saveAndFlush(administrator);
        audit(actorMemberId, "administrator_status_change", "discuss_board_administrators",
                administrator.getId(), status);
        return AdministratorResponse.from(administrator);
    }

    public void eraseAdministrator(UUID actorMemberId, UUID administratorId) {
        Administrator administrator = loadAdministrator(administratorId);
        if (administrator.getMember().getId().equals(actorMemberId)) {
            throw ProblemException.conflict("CANNOT_DELETE_SELF", "Administrators cannot delete themselves");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        administrator.setStatus(StaffStatus.REVOKED);
        administrator.setRevokedAt(now);
        administrator.markDeleted(now);
        administratorRepository.save(administrator);
        audit(actorMemberId, "administrator_delete", "discuss_board_administrators", administrator.getId(),
                StaffStatus.REVOKED);
        log.info("Administrator {} removed by member {}", administratorId, actorMemberId);
    }

    private Moderator loadModerator(UUID moderatorId) {
        return moderatorRepository.findActiveById(moderatorId)
                .orElseThrow(() -> ProblemException.notFound("MODERATOR_NOT_FOUND", "Moderator not found"));
    }

    private Administrator loadAdministrator(UUID administratorId) {
        return administratorRepository.findActiveById(administratorId)
                .orElseThrow(() -> ProblemException.notFound("ADMINISTRATOR_NOT_FOUND", "Administrator not found"));
    }

    private static StaffStatus parseStatus(String raw) {
        return EnumValues.parseOptional(StaffStatus.class, raw, "INVALID_STAFF_STATUS");
    }

    private void audit(UUID actorMemberId, String category, String table, UUID targetId, StaffStatus status) {
        auditLogService.record(new AuditLogCommand(
                actorMemberId,
                "administrator",
                category,
                table,
                targetId,
                category.replace('_', ' '),
                Map.of("status", EnumValues.wire(status))
        ));
    }
}
