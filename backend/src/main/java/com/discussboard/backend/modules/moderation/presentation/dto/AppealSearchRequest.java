package com.discussboard.backend.modules.moderation.presentation.dto;

import java.util.UUID;

public record AppealSearchRequest(
        Integer page,
        Integer limit,
        String status,
        UUID appellantMemberId,
        UUID moderationActionId,
        String sortBy,
        String sortDirection
) {
}
