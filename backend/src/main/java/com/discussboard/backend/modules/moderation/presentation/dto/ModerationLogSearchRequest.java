package com.discussboard.backend.modules.moderation.presentation.dto;

import java.util.UUID;

public record ModerationLogSearchRequest(
        Integer page,
        Integer limit,
        String eventType,
        UUID actorMemberId,
        String sortDirection
) {
}
