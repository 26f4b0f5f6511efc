package com.discussboard.backend.modules.auth.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record ModeratorJoinRequest(
        @NotNull(message = "memberId is required") UUID memberId
) {
}
