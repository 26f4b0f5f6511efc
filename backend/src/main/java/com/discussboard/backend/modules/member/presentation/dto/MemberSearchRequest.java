package com.discussboard.backend.modules.member.presentation.dto;

import java.time.OffsetDateTime;

public record MemberSearchRequest(
        Integer page,
        Integer limit,
        String nickname,
        String status,
        OffsetDateTime createdFrom,
        OffsetDateTime createdTo,
        String sortBy,
        String sortDirection
) {
}
