package com.discussboard.backend.modules.post.presentation.dto;

import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record PostCreateRequest(
        @NotBlank(message = "title is required") @Size(max = 300) String title,
        @NotBlank(message = "body is required") @Size(max = 20000) String body,
        String businessStatus,
        List<UUID> tagIds
) {
}
