package com.discussboard.backend.modules.moderation.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record AppealUpdateRequest(@NotBlank(message = "appealRationale is required") String appealRationale) {
}
