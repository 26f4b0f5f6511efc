package com.discussboard.backend.modules.auth.domain;

public enum MemberStatus {
    ACTIVE,
    SUSPENDED,
    BANNED
}
