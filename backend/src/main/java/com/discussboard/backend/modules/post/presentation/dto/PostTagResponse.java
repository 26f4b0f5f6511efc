package com.discussboard.backend.modules.post.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.modules.post.domain.PostTag;

public record PostTagResponse(UUID id, UUID postId, UUID tagId, OffsetDateTime createdAt) {

    public static PostTagResponse from(PostTag tag) {
        return new PostTagResponse(tag.getId(), tag.getPost().getId(), tag.getTagId(), tag.getCreatedAt());
    }
}
