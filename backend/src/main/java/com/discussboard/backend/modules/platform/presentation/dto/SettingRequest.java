package com.discussboard.backend.modules.platform.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SettingRequest(
        @NotBlank(message = "configKey is required") @Size(max = 128) String configKey,
        @NotBlank(message = "configJson is required") String configJson,
        @Size(max = 500) String description
) {
}
