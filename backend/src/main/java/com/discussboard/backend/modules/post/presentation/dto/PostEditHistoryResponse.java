package com.discussboard.backend.modules.post.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.modules.post.domain.PostEditHistory;

public record PostEditHistoryResponse(
        UUID id,
        UUID postId,
        UUID editorMemberId,
        String editedTitle,
        String editedBody,
        String editReason,
        OffsetDateTime createdAt
) {

    public static PostEditHistoryResponse from(PostEditHistory history) {
        return new PostEditHistoryResponse(
                history.getId(),
                history.getPost().getId(),
                history.getEditor().getId(),
                history.getEditedTitle(),
                history.getEditedBody(),
                history.getEditReason(),
                history.getCreatedAt()
        );
    }
}
