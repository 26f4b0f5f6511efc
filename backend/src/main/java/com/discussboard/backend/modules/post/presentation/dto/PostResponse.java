package com.discussboard.backend.modules.post.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.modules.post.domain.Post;

public record PostResponse(
        UUID id,
        UUID authorId,
        String authorNickname,
        String title,
        String body,
        String businessStatus,
        List<UUID> tagIds,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static PostResponse from(Post post, List<UUID> tagIds) {
        return new PostResponse(
                post.getId(),
                post.getAuthor().getId(),
                post.getAuthor().getNickname(),
                post.getTitle(),
                post.getBody(),
                EnumValues.wire(post.getBusinessStatus()),
                List.copyOf(tagIds),
                post.getCreatedAt(),
                post.getUpdatedAt()
        );
    }
}
