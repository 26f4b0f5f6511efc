package com.discussboard.backend.modules.member.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.modules.auth.domain.Member;

public record MemberResponse(
        UUID id,
        UUID userAccountId,
        String email,
        String nickname,
        String status,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        OffsetDateTime deletedAt
) {

    public static MemberResponse from(Member member) {
        return new MemberResponse(
                member.getId(),
                member.getUserAccount().getId(),
                member.getUserAccount().getEmail(),
                member.getNickname(),
                EnumValues.wire(member.getStatus()),
                member.getCreatedAt(),
                member.getUpdatedAt(),
                member.getDeletedAt()
        );
    }
}
