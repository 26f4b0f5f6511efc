package com.discussboard.backend.modules.auth.domain;

/**
 * Lifecycle of moderator and administrator role records.
 */
public enum StaffStatus {
    ACTIVE,
    SUSPENDED,
    REVOKED
}
