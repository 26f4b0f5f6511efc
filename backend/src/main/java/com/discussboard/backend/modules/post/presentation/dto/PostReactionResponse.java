package com.discussboard.backend.modules.post.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.modules.post.domain.PostReaction;

public record PostReactionResponse(
        UUID id,
        UUID memberId,
        UUID postId,
        String reactionType,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static PostReactionResponse from(PostReaction reaction) {
        return new PostReactionResponse(
                reaction.getId(),
                reaction.getMember().getId(),
                reaction.getPost().getId(),
                EnumValues.wire(reaction.getReactionType()),
                reaction.getCreatedAt(),
                reaction.getUpdatedAt()
        );
    }
}
