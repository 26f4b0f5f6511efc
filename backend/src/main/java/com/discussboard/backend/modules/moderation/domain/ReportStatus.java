package com.discussboard.backend.modules.moderation.domain;

public enum ReportStatus {
    PENDING,
    UNDER_REVIEW,
    RESOLVED,
    REJECTED
}
