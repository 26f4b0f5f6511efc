package com.discussboard.backend.modules.comment.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CommentUpdateRequest(
        @NotBlank(message = "content is required") @Size(max = 10000) String content,
        @Size(max = 500) String editReason
) {
}
