package com.discussboard.backend.modules.moderation.domain;

public enum ModerationActionStatus {
    ACTIVE,
    COMPLETED,
    REVERTED
}
