package com.discussboard.backend.modules.auth.domain;

public enum AccountStatus {
    ACTIVE,
    PENDING,
    SUSPENDED,
    BANNED
}
