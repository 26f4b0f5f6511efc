package com.discussboard.backend.modules.comment.presentation.dto;

import java.util.UUID;

public record CommentReactionSearchRequest(
        Integer page,
        Integer limit,
        UUID commentId,
        String reactionType,
        String sortBy,
        String sortDirection
) {
}
