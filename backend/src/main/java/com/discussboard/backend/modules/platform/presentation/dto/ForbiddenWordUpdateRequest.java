package com.discussboard.backend.modules.platform.presentation.dto;

import jakarta.validation.constraints.Size;

public record ForbiddenWordUpdateRequest(
        @Size(max = 200) String expression,
        @Size(max = 500) String description
) {
}
