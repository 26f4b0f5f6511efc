package com.discussboard.backend.modules.comment.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CommentReactionRequest(
        @NotNull(message = "commentId is required") UUID commentId,
        @NotBlank(message = "reactionType is required") String reactionType
) {
}
