package com.discussboard.backend.modules.moderation.application;

import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.global.common.paging.PageQuery;
import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.auth.application.ActorLookupService;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.moderation.domain.Appeal;
import com.discussboard.backend.modules.moderation.domain.AppealStatus;
import com.discussboard.backend.modules.moderation.domain.ModerationAction;
import com.discussboard.backend.modules.moderation.infrastructure.persistence.AppealRepository;
import com.discussboard.backend.modules.moderation.infrastructure.persistence.ModerationActionRepository;
import com.discussboard.backend.modules.moderation.presentation.dto.AppealDecisionRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.AppealRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.AppealResponse;
import com.discussboard.backend.modules.moderation.presentation.dto.AppealSearchRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.AppealUpdateRequest;
import com.discussboard.backend.modules.notification.application.NotificationService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AppealService {

    private static final Logger log = LoggerFactory.getLogger(AppealService.class);
    static final Set<String> SORT_FIELDS = Set.of("createdAt", "updatedAt", "status");
    private static final Set<AppealStatus> OPEN_STATUSES = EnumSet.of(AppealStatus.PENDING, AppealStatus.REVIEWED);

    private final AppealRepository appealRepository;
    private final ModerationActionRepository actionRepository;
    private final ModerationActionService moderationActionService;
    private final ModerationLogService moderationLogService;
    private final ActorLookupService actorLookupService;
    private final NotificationService notificationService;

    public AppealService(
            AppealRepository appealRepository,
            ModerationActionRepository actionRepository,
            ModerationActionService moderationActionService,
            ModerationLogService moderationLogService,
            ActorLookupService actorLookupService,
            NotificationService notificationService
    ) {
        this.appealRepository = appealRepository;
        this.actionRepository = actionRepository;
        this.moderationActionService = moderationActionService;
        this.moderationLogService = moderationLogService;
        this.actorLookupService = actorLookupService;
        this.notificationService = notificationService;
    }

    public AppealResponse create(UUID appellantMemberId, AppealRequest request) {
        Member appellant = actorLookupService.requireMember(appellantMemberId);
        ModerationAction action = moderationActionService.loadActive(request.moderationActionId());
        Member affected = moderationActionService.affectedMember(action);
        if (affected == null || !affected.getId().equals(appellantMemberId)) {
            throw ProblemException.forbidden("APPEAL_FORBIDDEN", "Only the affected member may appeal this action");
        }
        if (appealRepository.existsForActionWithStatus(action.getId(), OPEN_STATUSES)) {
            throw ProblemException.conflict("DUPLICATE_APPEAL", "An open appeal already exists for this action");
        }

        Appeal appeal = new Appeal();
        appeal.setModerationAction(action);
        appeal.setAppellant(appellant);
        appeal.setAppealRationale(request.appealRationale().trim());
        appeal.setStatus(AppealStatus.PENDING);
        appeal = appealRepository.save(appeal);

        action.setAppeal(appeal);
        actionRepository.save(action);
        moderationLogService.record(appellant, action, appeal, null, ModerationLogService.EVENT_APPEAL_SUBMITTED,
                null);
        return AppealResponse.from(appeal);
    }

    public AppealResponse updateOwn(UUID appellantMemberId, UUID appealId, AppealUpdateRequest request) {
        Appeal appeal = load(appealId);
        if (!appeal.getAppellant().getId().equals(appellantMemberId)) {
            throw ProblemException.forbidden("APPEAL_FORBIDDEN", "Appeal belongs to another member");
        }
        if (appeal.getStatus() != AppealStatus.PENDING) {
            throw ProblemException.conflict("APPEAL_NOT_PENDING", "Only pending appeals can be edited");
        }
        appeal.setAppealRationale(request.appealRationale().trim());
        return AppealResponse.from(appealRepository.saveAndFlush(appeal));
    }

    @Transactional(readOnly = true)
    public PageResponse<AppealResponse> search(AppealSearchRequest request) {
        return PageResponse.from(appealRepository.search(
                EnumValues.parseOptional(AppealStatus.class, request.status(), "INVALID_APPEAL_STATUS"),
                request.appellantMemberId(),
                request.moderationActionId(),
                PageQuery.of(request.page(), request.limit(), request.sortBy(), request.sortDirection(), SORT_FIELDS)
        ), AppealResponse::from);
    }

    @Transactional(readOnly = true)
    public AppealResponse get(UUID appealId) {
        return AppealResponse.from(load(appealId));
    }

    /**
     * Records an administrator's decision. Accepting reverts the appealed moderation action.
     */
    public AppealResponse decide(UUID administratorMemberId, UUID appealId, AppealDecisionRequest request) {
        Member administrator = actorLookupService.requireAdministrator(administratorMemberId).getMember();
        Appeal appeal = load(appealId);
        AppealStatus status = EnumValues.parse(AppealStatus.class, request.status(), "INVALID_APPEAL_STATUS");
        appeal.setStatus(status);
        if (request.resolutionNotes() != null) {
            appeal.setResolutionNotes(request.resolutionNotes());
        }
        appealRepository.saveAndFlush(appeal);

        ModerationAction action = appeal.getModerationAction();
        if (status == AppealStatus.ACCEPTED) {
            moderationActionService.revert(action);
            log.info("Appeal {} accepted; moderation action {} reverted", appeal.getId(), action.getId());
        }
        moderationLogService.record(administrator, action, appeal, null, ModerationLogService.EVENT_APPEAL_DECIDED,
                "status=" + EnumValues.wire(status));
        notificationService.notify(
                appeal.getAppellant().getUserAccount().getId(),
                NotificationService.EVENT_APPEAL_DECISION,
                "Your appeal was " + EnumValues.wire(status),
                appeal.getResolutionNotes() != null ? appeal.getResolutionNotes() : "No resolution notes."
        );
        return AppealResponse.from(appeal);
    }

    private Appeal load(UUID appealId) {
        return appealRepository.findActiveById(appealId)
                .orElseThrow(() -> ProblemException.notFound("APPEAL_NOT_FOUND", "Appeal not found"));
    }
}
