package com.discussboard.backend.modules.comment.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CommentCreateRequest(
        @NotBlank(message = "content is required") @Size(max = 10000) String content,
        UUID parentId
) {
}
