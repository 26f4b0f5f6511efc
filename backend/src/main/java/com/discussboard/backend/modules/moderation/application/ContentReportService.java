package com.discussboard.backend.modules.moderation.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.global.common.paging.PageQuery;
import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.auth.application.ActorLookupService;
import com.discussboard.backend.modules.auth.domain.ActorType;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.comment.application.CommentService;
import com.discussboard.backend.modules.moderation.domain.ContentReport;
import com.discussboard.backend.modules.moderation.domain.ContentType;
import com.discussboard.backend.modules.moderation.domain.ReportStatus;
import com.discussboard.backend.modules.moderation.infrastructure.persistence.ContentReportRepository;
import com.discussboard.backend.modules.moderation.presentation.dto.ContentReportRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.ContentReportResponse;
import com.discussboard.backend.modules.moderation.presentation.dto.ContentReportSearchRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.ContentReportUpdateRequest;
import com.discussboard.backend.modules.post.application.PostService;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class ContentReportService {

    static final Set<String> SORT_FIELDS = Set.of("createdAt", "status", "reason");

    private final ContentReportRepository reportRepository;
    private final ActorLookupService actorLookupService;
    private final PostService postService;
    private final CommentService commentService;
    private final ModerationActionService moderationActionService;
    private final ModerationLogService moderationLogService;
    private final Clock clock;

    public ContentReportService(
            ContentReportRepository reportRepository,
            ActorLookupService actorLookupService,
            PostService postService,
            CommentService commentService,
            ModerationActionService moderationActionService,
            ModerationLogService moderationLogService,
            Clock clock
    ) {
        this.reportRepository = reportRepository;
        this.actorLookupService = actorLookupService;
        this.postService = postService;
        this.commentService = commentService;
        this.moderationActionService = moderationActionService;
        this.moderationLogService = moderationLogService;
        this.clock = clock;
    }

    public ContentReportResponse create(UUID reporterMemberId, ContentReportRequest request) {
        ContentType contentType = EnumValues.parse(ContentType.class, request.contentType(), "INVALID_CONTENT_TYPE");
        boolean postTarget = request.contentPostId() != null;
        boolean commentTarget = request.contentCommentId() != null;
        if (postTarget == commentTarget
                || (contentType == ContentType.POST && !postTarget)
                || (contentType == ContentType.COMMENT && !commentTarget)) {
            throw ProblemException.badRequest("INVALID_REPORT_TARGET",
                    "Exactly one of contentPostId and contentCommentId must match contentType");
        }

        Member reporter = actorLookupService.requireMember(reporterMemberId);
        ContentReport report = new ContentReport();
        report.setReporter(reporter);
        report.setContentType(contentType);
        report.setReason(request.reason().trim());
        report.setStatus(ReportStatus.PENDING);
        if (postTarget) {
            report.setContentPost(postService.loadActive(request.contentPostId()));
            if (reportRepository.existsActiveByReporterAndPost(reporterMemberId, request.contentPostId())) {
                throw duplicate();
            }
        } else {
            report.setContentComment(commentService.loadActive(request.contentCommentId()));
            if (reportRepository.existsActiveByReporterAndComment(reporterMemberId, request.contentCommentId())) {
                throw duplicate();
            }
        }
        return ContentReportResponse.from(reportRepository.save(report));
    }

    public void eraseOwn(UUID reporterMemberId, UUID reportId) {
        ContentReport report = load(reportId);
        if (!report.getReporter().getId().equals(reporterMemberId)) {
            throw ProblemException.forbidden("REPORT_FORBIDDEN", "Report belongs to another member");
        }
        if (report.getStatus() != ReportStatus.PENDING) {
            throw ProblemException.conflict("REPORT_NOT_PENDING", "Only pending reports can be withdrawn");
        }
        report.markDeleted(OffsetDateTime.now(clock));
        reportRepository.save(report);
    }

    @Transactional(readOnly = true)
    public PageResponse<ContentReportResponse> search(ContentReportSearchRequest request) {
        return PageResponse.from(reportRepository.search(
                request.reporterMemberId(),
                EnumValues.parseOptional(ContentType.class, request.contentType(), "INVALID_CONTENT_TYPE"),
                EnumValues.parseOptional(ReportStatus.class, request.status(), "INVALID_REPORT_STATUS"),
                PageQuery.likePattern(request.reason()),
                request.createdFrom(),
                request.createdTo(),
                PageQuery.of(request.page(), request.limit(), request.sortBy(), request.sortDirection(), SORT_FIELDS)
        ), ContentReportResponse::from);
    }

    @Transactional(readOnly = true)
    public ContentReportResponse get(UUID reportId) {
        return ContentReportResponse.from(load(reportId));
    }

    public ContentReportResponse update(ActorType actorType, UUID actorMemberId, UUID reportId,
                                        ContentReportUpdateRequest request) {
        Member actor = actorLookupService.requireStaff(actorType, actorMemberId);
        ContentReport report = load(reportId);
        ReportStatus status = EnumValues.parseOptional(ReportStatus.class, request.status(), "INVALID_REPORT_STATUS");
        if (status != null) {
            report.setStatus(status);
        }
        if (request.moderationActionId() != null) {
            report.setModerationAction(moderationActionService.loadActive(request.moderationActionId()));
        }
        reportRepository.saveAndFlush(report);
        moderationLogService.record(actor, report.getModerationAction(), null, report,
                ModerationLogService.EVENT_REPORT_UPDATED, "status=" + EnumValues.wire(report.getStatus()));
        return ContentReportResponse.from(report);
    }

    public void eraseAsModerator(UUID moderatorMemberId, UUID reportId) {
        actorLookupService.requireModerator(moderatorMemberId);
        ContentReport report = load(reportId);
        report.markDeleted(OffsetDateTime.now(clock));
        reportRepository.save(report);
    }

    private ContentReport load(UUID reportId) {
        return reportRepository.findActiveById(reportId)
                .orElseThrow(() -> ProblemException.notFound("CONTENT_REPORT_NOT_FOUND", "Content report not found"));
    }

    private static ProblemException duplicate() {
        return ProblemException.conflict("DUPLICATE_REPORT", "Member already reported this content");
    }
}
