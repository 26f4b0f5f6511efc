package com.discussboard.backend.modules.member.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record StaffUpdateRequest(@NotBlank(message = "status is required") String status) {
}
