package com.discussboard.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.modules.auth.domain.Moderator;

public record ModeratorResponse(
        UUID id,
        UUID memberId,
        String nickname,
        UUID assignedByAdministratorId,
        OffsetDateTime assignedAt,
        OffsetDateTime revokedAt,
        String status,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static ModeratorResponse from(Moderator moderator) {
        return new ModeratorResponse(
                moderator.getId(),
                moderator.getMember().getId(),
                moderator.getMember().getNickname(),
                moderator.getAssignedBy().getId(),
                moderator.getAssignedAt(),
                moderator.getRevokedAt(),
                EnumValues.wire(moderator.getStatus()),
                moderator.getCreatedAt(),
                moderator.getUpdatedAt()
        );
    }
}
