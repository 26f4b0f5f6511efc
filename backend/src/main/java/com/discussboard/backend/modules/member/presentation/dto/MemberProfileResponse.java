package com.discussboard.backend.modules.member.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.modules.auth.domain.Member;

public record MemberProfileResponse(UUID id, String nickname, String status, OffsetDateTime createdAt) {

    public static MemberProfileResponse from(Member member) {
        return new MemberProfileResponse(
                member.getId(),
                member.getNickname(),
                EnumValues.wire(member.getStatus()),
                member.getCreatedAt()
        );
    }
}
