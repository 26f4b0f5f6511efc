package com.discussboard.backend.modules.moderation.domain;

public enum AppealStatus {
    PENDING,
    REVIEWED,
    ACCEPTED,
    REJECTED;

    public boolean isOpen() {
        return this == PENDING || this == REVIEWED;
    }
}
