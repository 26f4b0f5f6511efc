package com.discussboard.backend.modules.moderation.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.modules.moderation.domain.Appeal;

public record AppealResponse(
        UUID id,
        UUID moderationActionId,
        UUID appellantMemberId,
        String appealRationale,
        String status,
        String resolutionNotes,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static AppealResponse from(Appeal appeal) {
        return new AppealResponse(
                appeal.getId(),
                appeal.getModerationAction().getId(),
                appeal.getAppellant().getId(),
                appeal.getAppealRationale(),
                EnumValues.wire(appeal.getStatus()),
                appeal.getResolutionNotes(),
                appeal.getCreatedAt(),
                appeal.getUpdatedAt()
        );
    }
}
