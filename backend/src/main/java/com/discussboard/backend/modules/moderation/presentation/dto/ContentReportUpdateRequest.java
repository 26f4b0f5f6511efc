package com.discussboard.backend.modules.moderation.presentation.dto;

import java.util.UUID;

public record ContentReportUpdateRequest(String status, UUID moderationActionId) {
}
