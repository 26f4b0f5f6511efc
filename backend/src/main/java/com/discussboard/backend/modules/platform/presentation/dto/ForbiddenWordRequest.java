package com.discussboard.backend.modules.platform.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ForbiddenWordRequest(
        @NotBlank(message = "expression is required") @Size(max = 200) String expression,
        @Size(max = 500) String description
) {
}
