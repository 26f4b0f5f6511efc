package com.discussboard.backend.modules.post.domain;

public enum PostStatus {
    PUBLIC,
    PRIVATE,
    DRAFT,
    HIDDEN,
    ARCHIVED
}
