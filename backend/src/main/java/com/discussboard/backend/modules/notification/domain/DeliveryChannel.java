package com.discussboard.backend.modules.notification.domain;

public enum DeliveryChannel {
    EMAIL,
    SMS,
    PUSH
}
