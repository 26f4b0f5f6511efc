package com.discussboard.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.modules.auth.domain.Administrator;

public record AdministratorResponse(
        UUID id,
        UUID memberId,
        String nickname,
        UUID escalatedByAdministratorId,
        OffsetDateTime escalatedAt,
        OffsetDateTime revokedAt,
        String status,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static AdministratorResponse from(Administrator administrator) {
        return new AdministratorResponse(
                administrator.getId(),
                administrator.getMember().getId(),
                administrator.getMember().getNickname(),
                administrator.getEscalatedBy() != null ? administrator.getEscalatedBy().getId() : null,
                administrator.getEscalatedAt(),
                administrator.getRevokedAt(),
                EnumValues.wire(administrator.getStatus()),
                administrator.getCreatedAt(),
                administrator.getUpdatedAt()
        );
    }
}
