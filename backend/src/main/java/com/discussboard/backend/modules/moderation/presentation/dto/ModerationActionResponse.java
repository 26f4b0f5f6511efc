package com.discussboard.backend.modules.moderation.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.modules.moderation.domain.ModerationAction;

public record ModerationActionResponse(
        UUID id,
        UUID moderatorId,
        UUID targetMemberId,
        UUID targetPostId,
        UUID targetCommentId,
        UUID appealId,
        String actionType,
        String actionReason,
        String decisionNarrative,
        String status,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static ModerationActionResponse from(ModerationAction action) {
        return new ModerationActionResponse(
                action.getId(),
                action.getModerator().getId(),
                action.getTargetMember() != null ? action.getTargetMember().getId() : null,
                action.getTargetPost() != null ? action.getTargetPost().getId() : null,
                action.getTargetComment() != null ? action.getTargetComment().getId() : null,
                action.getAppeal() != null ? action.getAppeal().getId() : null,
                EnumValues.wire(action.getActionType()),
                action.getActionReason(),
                action.getDecisionNarrative(),
                EnumValues.wire(action.getStatus()),
                action.getCreatedAt(),
                action.getUpdatedAt()
        );
    }
}
