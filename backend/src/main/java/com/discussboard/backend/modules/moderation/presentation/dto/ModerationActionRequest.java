package com.discussboard.backend.modules.moderation.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ModerationActionRequest(
        UUID targetMemberId,
        UUID targetPostId,
        UUID targetCommentId,
        @NotBlank(message = "actionType is required") String actionType,
        @NotBlank(message = "actionReason is required") @Size(max = 1000) String actionReason,
        String decisionNarrative,
        String status
) {
}
