package com.discussboard.backend.modules.moderation.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.modules.moderation.domain.ModerationLog;

public record ModerationLogResponse(
        UUID id,
        UUID actorMemberId,
        UUID relatedActionId,
        UUID relatedAppealId,
        UUID relatedReportId,
        String eventType,
        String eventDetails,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static ModerationLogResponse from(ModerationLog log) {
        return new ModerationLogResponse(
                log.getId(),
                log.getActor() != null ? log.getActor().getId() : null,
                log.getRelatedAction() != null ? log.getRelatedAction().getId() : null,
                log.getRelatedAppeal() != null ? log.getRelatedAppeal().getId() : null,
                log.getRelatedReport() != null ? log.getRelatedReport().getId() : null,
                log.getEventType(),
                log.getEventDetails(),
                log.getCreatedAt(),
                log.getUpdatedAt()
        );
    }
}
