package com.discussboard.backend.modules.platform.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.modules.platform.domain.ForbiddenWord;

public record ForbiddenWordResponse(
        UUID id,
        String expression,
        String description,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        OffsetDateTime deletedAt
) {

    public static ForbiddenWordResponse from(ForbiddenWord word) {
        return new ForbiddenWordResponse(
                word.getId(),
                word.getExpression(),
                word.getDescription(),
                word.getCreatedAt(),
                word.getUpdatedAt(),
                word.getDeletedAt()
        );
    }
}
