package com.discussboard.backend.modules.member.presentation.dto;

import java.util.UUID;

/**
 * Filter for moderator and administrator listings. {@code assignedByAdministratorId} only applies to moderators.
 */
public record StaffSearchRequest(
        Integer page,
        Integer limit,
        String status,
        UUID memberId,
        UUID assignedByAdministratorId,
        String sortBy,
        String sortDirection
) {
}
