package com.discussboard.backend.modules.moderation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.auth.application.ActorLookupService;
import com.discussboard.backend.modules.auth.domain.ActorType;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.comment.application.CommentService;
import com.discussboard.backend.modules.moderation.application.ContentReportService;
import com.discussboard.backend.modules.moderation.application.ModerationActionService;
import com.discussboard.backend.modules.moderation.application.ModerationLogService;
import com.discussboard.backend.modules.moderation.domain.ContentReport;
import com.discussboard.backend.modules.moderation.domain.ContentType;
import com.discussboard.backend.modules.moderation.domain.ReportStatus;
import com.discussboard.backend.modules.moderation.infrastructure.persistence.ContentReportRepository;
import com.discussboard.backend.modules.moderation.presentation.dto.ContentReportRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.ContentReportResponse;
import com.discussboard.backend.modules.moderation.presentation.dto.ContentReportUpdateRequest;
import com.discussboard.backend.modules.post.application.PostService;
import com.discussboard.backend.modules.post.domain.Post;
import com.discussboard.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ContentReportServiceTest {

    @Mock
    private ContentReportRepository reportRepository;
    @Mock
    private ActorLookupService actorLookupService;
    @Mock
    private PostService postService;
    @Mock
    private CommentService commentService;
    @Mock
    private ModerationActionService moderationActionService;
    @Mock
    private ModerationLogService moderationLogService;

    private ContentReportService reportService;
    private Member reporter;
    private Post post;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        reportService = new ContentReportService(reportRepository, actorLookupService, postService, commentService,
                moderationActionService, moderationLogService, clock);
        reporter = TestEntities.member("reporter");
        post = TestEntities.post(TestEntities.member("author"), "Questionable");

        lenient().when(actorLookupService.requireMember(reporter.getId())).thenReturn(reporter);
        lenient().when(postService.loadActive(post.getId())).thenReturn(post);
        lenient().when(reportRepository.save(any(ContentReport.class)))
                .thenAnswer(inv -> TestEntities.withId(inv.getArgument(0), UUID.randomUUID()));
    }

    private ContentReport report(ReportStatus status) {
        ContentReport report = TestEntities.withId(new ContentReport(), UUID.randomUUID());
        report.setReporter(reporter);
        report.setContentPost(post);
        report.setContentType(ContentType.POST);
        report.setReason("spam");
        report.setStatus(status);
        return report;
    }

    @Test
    void newReportStartsPending() {
        ContentReportResponse response = reportService.create(reporter.getId(),
                new ContentReportRequest("post", post.getId(), null, " spam "));

        assertThat(response.status()).isEqualTo("pending");
        assertThat(response.contentPostId()).isEqualTo(post.getId());
        assertThat(response.reason()).isEqualTo("spam");
    }

    @Test
    void targetMustMatchContentType() {
        assertThatThrownBy(() -> reportService.create(reporter.getId(),
                new ContentReportRequest("comment", post.getId(), null, "spam")))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("INVALID_REPORT_TARGET");
        assertThatThrownBy(() -> reportService.create(reporter.getId(),
                new ContentReportRequest("post", post.getId(), UUID.randomUUID(), "spam")))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("INVALID_REPORT_TARGET");
        verify(reportRepository, never()).save(any());
    }

    @Test
    void sameMemberCannotReportTwice() {
        when(reportRepository.existsActiveByReporterAndPost(reporter.getId(), post.getId())).thenReturn(true);

        assertThatThrownBy(() -> reportService.create(reporter.getId(),
                new ContentReportRequest("post", post.getId(), null, "spam")))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("DUPLICATE_REPORT");
    }

    @Test
    void onlyPendingReportsCanBeWithdrawn() {
        ContentReport report = report(ReportStatus.UNDER_REVIEW);
        when(reportRepository.findActiveById(report.getId())).thenReturn(Optional.of(report));

        assertThatThrownBy(() -> reportService.eraseOwn(reporter.getId(), report.getId()))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("REPORT_NOT_PENDING");
        assertThat(report.isDeleted()).isFalse();
    }

    @Test
    void staffUpdateChangesStatusAndLogs() {
        Member moderatorMember = TestEntities.member("mod");
        ContentReport report = report(ReportStatus.PENDING);
        when(actorLookupService.requireStaff(ActorType.MODERATOR, moderatorMember.getId())).thenReturn(moderatorMember);
        when(reportRepository.findActiveById(report.getId())).thenReturn(Optional.of(report));

        ContentReportResponse response = reportService.update(ActorType.MODERATOR, moderatorMember.getId(),
                report.getId(), new ContentReportUpdateRequest("resolved", null));

        assertThat(response.status()).isEqualTo("resolved");
        verify(moderationLogService).record(eq(moderatorMember), any(), any(), eq(report),
                eq(ModerationLogService.EVENT_REPORT_UPDATED), eq("status=resolved"));
    }
}
