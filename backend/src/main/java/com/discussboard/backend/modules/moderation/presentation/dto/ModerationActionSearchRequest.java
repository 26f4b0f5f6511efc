package com.discussboard.backend.modules.moderation.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ModerationActionSearchRequest(
        Integer page,
        Integer limit,
        UUID moderatorId,
        UUID targetMemberId,
        UUID targetPostId,
        UUID targetCommentId,
        String actionType,
        String status,
        OffsetDateTime createdFrom,
        OffsetDateTime createdTo,
        String sortBy,
        String sortDirection
) {
}
