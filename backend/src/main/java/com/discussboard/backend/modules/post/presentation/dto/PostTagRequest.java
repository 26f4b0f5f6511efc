package com.discussboard.backend.modules.post.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record PostTagRequest(@NotNull(message = "tagId is required") UUID tagId) {
}
