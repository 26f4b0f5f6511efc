package com.discussboard.backend.modules.notification.domain;

public enum DeliveryStatus {
    PENDING,
    SENT,
    READ,
    FAILED
}
