package com.discussboard.backend.modules.moderation.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record AppealDecisionRequest(
        @NotBlank(message = "status is required") String status,
        String resolutionNotes
) {
}
