package com.discussboard.backend.modules.comment.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.modules.comment.domain.CommentReaction;

public record CommentReactionResponse(
        UUID id,
        UUID memberId,
        UUID commentId,
        String reactionType,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static CommentReactionResponse from(CommentReaction reaction) {
        return new CommentReactionResponse(
                reaction.getId(),
                reaction.getMember().getId(),
                reaction.getComment().getId(),
                EnumValues.wire(reaction.getReactionType()),
                reaction.getCreatedAt(),
                reaction.getUpdatedAt()
        );
    }
}
