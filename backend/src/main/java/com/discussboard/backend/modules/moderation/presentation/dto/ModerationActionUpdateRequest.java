package com.discussboard.backend.modules.moderation.presentation.dto;

import jakarta.validation.constraints.Size;

public record ModerationActionUpdateRequest(
        @Size(max = 1000) String actionReason,
        String decisionNarrative,
        String status
) {
}
