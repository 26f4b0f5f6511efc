package com.discussboard.backend.modules.moderation.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Exactly one of {@code contentPostId} and {@code contentCommentId} must be set, matching {@code contentType}.
 */
public record ContentReportRequest(
        @NotBlank(message = "contentType is required") String contentType,
        UUID contentPostId,
        UUID contentCommentId,
        @NotBlank(message = "reason is required") @Size(max = 500) String reason
) {
}
