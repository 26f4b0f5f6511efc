package com.discussboard.backend.modules.moderation.application;

import java.util.Set;
import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageQuery;
import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.auth.application.ActorLookupService;
import com.discussboard.backend.modules.auth.domain.ActorType;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.moderation.domain.Appeal;
import com.discussboard.backend.modules.moderation.domain.ContentReport;
import com.discussboard.backend.modules.moderation.domain.ModerationAction;
import com.discussboard.backend.modules.moderation.domain.ModerationLog;
import com.discussboard.backend.modules.moderation.infrastructure.persistence.AppealRepository;
import com.discussboard.backend.modules.moderation.infrastructure.persistence.ContentReportRepository;
import com.discussboard.backend.modules.moderation.infrastructure.persistence.ModerationActionRepository;
import com.discussboard.backend.modules.moderation.infrastructure.persistence.ModerationLogRepository;
import com.discussboard.backend.modules.moderation.presentation.dto.ModerationLogRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.ModerationLogResponse;
import com.discussboard.backend.modules.moderation.presentation.dto.ModerationLogSearchRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.ModerationLogUpdateRequest;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class ModerationLogService {

    public static final String EVENT_ACTION_CREATED = "action_created";
    public static final String EVENT_ACTION_UPDATED = "action_updated";
    public static final String EVENT_REPORT_UPDATED = "report_updated";
    public static final String EVENT_APPEAL_SUBMITTED = "appeal_submitted";
    public static final String EVENT_APPEAL_DECIDED = "appeal_decided";

    private final ModerationLogRepository logRepository;
    private final ModerationActionRepository actionRepository;
    private final AppealRepository appealRepository;
    private final ContentReportRepository reportRepository;
    private final ActorLookupService actorLookupService;

    public ModerationLogService(
            ModerationLogRepository logRepository,
            ModerationActionRepository actionRepository,
            AppealRepository appealRepository,
            ContentReportRepository reportRepository,
            ActorLookupService actorLookupService
    ) {
        this.logRepository = logRepository;
        this.actionRepository = actionRepository;
        this.appealRepository = appealRepository;
        this.reportRepository = reportRepository;
        this.actorLookupService = actorLookupService;
    }

    public ModerationLog record(Member actor, ModerationAction action, Appeal appeal, ContentReport report,
                                String eventType, String eventDetails) {
        ModerationLog log = new ModerationLog();
        log.setActor(actor);
        log.setRelatedAction(action);
        log.setRelatedAppeal(appeal);
        log.setRelatedReport(report);
        log.setEventType(eventType);
        log.setEventDetails(eventDetails);
        return logRepository.save(log);
    }

    public ModerationLogResponse create(ActorType actorType, UUID actorMemberId, UUID actionId,
                                        ModerationLogRequest request) {
        Member actor = actorLookupService.requireStaff(actorType, actorMemberId);
        ModerationAction action = loadAction(actionId);
        Appeal appeal = request.relatedAppealId() == null ? null
                : appealRepository.findActiveById(request.relatedAppealId())
                        .orElseThrow(() -> ProblemException.notFound("APPEAL_NOT_FOUND", "Appeal not found"));
        ContentReport report = request.relatedReportId() == null ? null
                : reportRepository.findActiveById(request.relatedReportId())
                        .orElseThrow(() -> ProblemException.notFound("CONTENT_REPORT_NOT_FOUND",
                                "Content report not found"));
        return ModerationLogResponse.from(
                record(actor, action, appeal, report, request.eventType().trim(), request.eventDetails()));
    }

    @Transactional(readOnly = true)
    public PageResponse<ModerationLogResponse> search(UUID actionId, ModerationLogSearchRequest request) {
        loadAction(actionId);
        String eventType = request.eventType() == null || request.eventType().isBlank()
                ? null
                : request.eventType().trim();
        return PageResponse.from(logRepository.searchByAction(
                actionId,
                eventType,
                request.actorMemberId(),
                PageQuery.of(request.page(), request.limit(), "createdAt", request.sortDirection(),
                        Set.of("createdAt"))
        ), ModerationLogResponse::from);
    }

    @Transactional(readOnly = true)
    public ModerationLogResponse get(UUID actionId, UUID logId) {
        return ModerationLogResponse.from(loadLog(actionId, logId));
    }

    public ModerationLogResponse update(UUID administratorMemberId, UUID actionId, UUID logId,
                                        ModerationLogUpdateRequest request) {
        actorLookupService.requireAdministrator(administratorMemberId);
        ModerationLog log = loadLog(actionId, logId);
        if (request.eventType() != null && !request.eventType().isBlank()) {
            log.setEventType(request.eventType().trim());
        }
        if (request.eventDetails() != null) {
            log.setEventDetails(request.eventDetails());
        }
        return ModerationLogResponse.from(logRepository.saveAndFlush(log));
    }

    public void erase(UUID administratorMemberId, UUID actionId, UUID logId) {
        actorLookupService.requireAdministrator(administratorMemberId);
        logRepository.delete(loadLog(actionId, logId));
    }

    private ModerationAction loadAction(UUID actionId) {
        return actionRepository.findActiveById(actionId)
                .orElseThrow(() -> ProblemException.notFound("MODERATION_ACTION_NOT_FOUND",
                        "Moderation action not found"));
    }

    private ModerationLog loadLog(UUID actionId, UUID logId) {
        loadAction(actionId);
        return logRepository.findByIdAndActionId(logId, actionId)
                .orElseThrow(() -> ProblemException.notFound("MODERATION_LOG_NOT_FOUND",
                        "Moderation log not found for this action"));
    }
}
