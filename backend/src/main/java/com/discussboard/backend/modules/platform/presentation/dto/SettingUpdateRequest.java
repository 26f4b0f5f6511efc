package com.discussboard.backend.modules.platform.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * Partial update; null fields are left unchanged.
 */
public record SettingUpdateRequest(
        @Size(max = 128) String configKey,
        String configJson,
        @Size(max = 500) String description
) {
}
