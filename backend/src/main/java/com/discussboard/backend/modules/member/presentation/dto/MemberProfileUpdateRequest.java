package com.discussboard.backend.modules.member.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record MemberProfileUpdateRequest(
        @NotBlank(message = "nickname is required") @Size(max = 64) String nickname
) {
}
