package com.discussboard.backend.modules.platform.presentation.dto;

public record ForbiddenWordSearchRequest(Integer page, Integer limit, String expression, String sortBy,
                                         String sortDirection) {
}
