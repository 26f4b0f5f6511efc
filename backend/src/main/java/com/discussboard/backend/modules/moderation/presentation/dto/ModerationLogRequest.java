package com.discussboard.backend.modules.moderation.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ModerationLogRequest(
        @NotBlank(message = "eventType is required") @Size(max = 64) String eventType,
        String eventDetails,
        UUID relatedAppealId,
        UUID relatedReportId
) {
}
