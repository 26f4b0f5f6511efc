package com.discussboard.backend.modules.member.presentation.dto;

import jakarta.validation.constraints.Size;

public record MemberUpdateRequest(@Size(max = 64) String nickname, String status) {
}
