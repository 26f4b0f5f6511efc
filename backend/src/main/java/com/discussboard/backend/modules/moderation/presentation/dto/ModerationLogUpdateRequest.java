package com.discussboard.backend.modules.moderation.presentation.dto;

import jakarta.validation.constraints.Size;

public record ModerationLogUpdateRequest(@Size(max = 64) String eventType, String eventDetails) {
}
