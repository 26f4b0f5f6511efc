package com.discussboard.backend.modules.post.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record PostReactionRequest(
        @NotNull(message = "postId is required") UUID postId,
        @NotBlank(message = "reactionType is required") String reactionType
) {
}
