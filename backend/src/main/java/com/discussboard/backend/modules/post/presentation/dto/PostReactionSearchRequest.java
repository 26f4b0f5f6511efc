package com.discussboard.backend.modules.post.presentation.dto;

import java.util.UUID;

public record PostReactionSearchRequest(
        Integer page,
        Integer limit,
        UUID postId,
        String reactionType,
        String sortBy,
        String sortDirection
) {
}
