package com.discussboard.backend.modules.moderation.domain;

public enum ContentType {
    POST,
    COMMENT
}
