package com.discussboard.backend.modules.member.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record MemberCreateRequest(
        @NotNull(message = "userAccountId is required") UUID userAccountId,
        @NotBlank(message = "nickname is required") @Size(max = 64) String nickname,
        String status
) {
}
