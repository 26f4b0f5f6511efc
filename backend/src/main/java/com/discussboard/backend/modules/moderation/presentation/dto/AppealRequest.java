package com.discussboard.backend.modules.moderation.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record AppealRequest(
        @NotNull(message = "moderationActionId is required") UUID moderationActionId,
        @NotBlank(message = "appealRationale is required") String appealRationale
) {
}
