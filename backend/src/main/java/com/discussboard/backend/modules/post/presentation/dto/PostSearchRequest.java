package com.discussboard.backend.modules.post.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record PostSearchRequest(
        Integer page,
        Integer limit,
        String keyword,
        UUID authorId,
        String status,
        UUID tagId,
        OffsetDateTime createdFrom,
        OffsetDateTime createdTo,
        String sortBy,
        String sortDirection
) {
}
