package com.discussboard.backend.modules.moderation.domain;

public enum ModerationActionType {
    WARN,
    REMOVE_CONTENT,
    EDIT_CONTENT,
    SUSPEND_USER,
    BAN_USER,
    RESTORE,
    INVALIDATE_REPORT
}
