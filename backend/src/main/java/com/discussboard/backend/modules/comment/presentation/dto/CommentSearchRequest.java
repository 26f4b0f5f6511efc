package com.discussboard.backend.modules.comment.presentation.dto;

import java.util.UUID;

public record CommentSearchRequest(
        Integer page,
        Integer limit,
        UUID authorId,
        UUID parentId,
        String keyword,
        String sortBy,
        String sortDirection
) {
}
