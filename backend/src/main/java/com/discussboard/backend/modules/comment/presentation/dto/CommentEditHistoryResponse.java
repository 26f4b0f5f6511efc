package com.discussboard.backend.modules.comment.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.modules.comment.domain.CommentEditHistory;

public record CommentEditHistoryResponse(
        UUID id,
        UUID commentId,
        UUID editorMemberId,
        String previousContent,
        String editReason,
        OffsetDateTime createdAt
) {

    public static CommentEditHistoryResponse from(CommentEditHistory history) {
        return new CommentEditHistoryResponse(
                history.getId(),
                history.getComment().getId(),
                history.getEditor().getId(),
                history.getPreviousContent(),
                history.getEditReason(),
                history.getCreatedAt()
        );
    }
}
