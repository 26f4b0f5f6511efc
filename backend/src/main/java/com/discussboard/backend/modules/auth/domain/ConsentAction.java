package com.discussboard.backend.modules.auth.domain;

public enum ConsentAction {
    GRANTED,
    REVOKED
}
