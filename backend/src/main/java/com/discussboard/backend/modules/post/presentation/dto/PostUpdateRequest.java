package com.discussboard.backend.modules.post.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * Partial update. Blank title or body are ignored.
 */
public record PostUpdateRequest(
        @Size(max = 300) String title,
        @Size(max = 20000) String body,
        String businessStatus,
        @Size(max = 500) String editReason
) {
}
