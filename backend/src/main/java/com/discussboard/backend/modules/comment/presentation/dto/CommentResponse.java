package com.discussboard.backend.modules.comment.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.modules.comment.domain.Comment;

public record CommentResponse(
        UUID id,
        UUID postId,
        UUID authorMemberId,
        String authorNickname,
        UUID parentId,
        String content,
        int depth,
        boolean locked,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static CommentResponse from(Comment comment) {
        return new CommentResponse(
                comment.getId(),
                comment.getPost().getId(),
                comment.getAuthor().getId(),
                comment.getAuthor().getNickname(),
                comment.getParent() != null ? comment.getParent().getId() : null,
                comment.getContent(),
                comment.getDepth(),
                comment.isLocked(),
                comment.getCreatedAt(),
                comment.getUpdatedAt()
        );
    }
}
