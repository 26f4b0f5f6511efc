package com.discussboard.backend.modules.platform.presentation.dto;

public record SettingSearchRequest(Integer page, Integer limit, String configKey, String sortBy, String sortDirection) {
}
