package com.discussboard.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

public record AuthorizationToken(
        String access,
        String refresh,
        OffsetDateTime expiredAt,
        OffsetDateTime refreshableUntil
) {
}
