package com.discussboard.backend.modules.post.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.modules.post.domain.Post;

public record PostSummaryResponse(
        UUID id,
        UUID authorId,
        String authorNickname,
        String title,
        String businessStatus,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static PostSummaryResponse from(Post post) {
        return new PostSummaryResponse(
                post.getId(),
                post.getAuthor().getId(),
                post.getAuthor().getNickname(),
                post.getTitle(),
                EnumValues.wire(post.getBusinessStatus()),
                post.getCreatedAt(),
                post.getUpdatedAt()
        );
    }
}
