package com.discussboard.backend.modules.moderation.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.modules.moderation.domain.ContentReport;

public record ContentReportResponse(
        UUID id,
        UUID reporterMemberId,
        UUID contentPostId,
        UUID contentCommentId,
        String contentType,
        String reason,
        String status,
        UUID moderationActionId,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static ContentReportResponse from(ContentReport report) {
        return new ContentReportResponse(
                report.getId(),
                report.getReporter().getId(),
                report.getContentPost() != null ? report.getContentPost().getId() : null,
                report.getContentComment() != null ? report.getContentComment().getId() : null,
                EnumValues.wire(report.getContentType()),
                report.getReason(),
                EnumValues.wire(report.getStatus()),
                report.getModerationAction() != null ? report.getModerationAction().getId() : null,
                report.getCreatedAt(),
                report.getUpdatedAt()
        );
    }
}
