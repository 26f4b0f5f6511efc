package com.discussboard.backend.modules.platform.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.modules.platform.domain.Setting;

public record SettingResponse(
        UUID id,
        String configKey,
        String configJson,
        String description,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static SettingResponse from(Setting setting) {
        return new SettingResponse(
                setting.getId(),
                setting.getConfigKey(),
                setting.getConfigJson(),
                setting.getDescription(),
                setting.getCreatedAt(),
                setting.getUpdatedAt()
        );
    }
}
