package com.discussboard.backend.modules.post.presentation.dto;

import java.util.UUID;

/**
 * Shared by post and comment edit-history listings.
 */
public record EditHistorySearchRequest(Integer page, Integer limit, UUID editorMemberId, String sortDirection) {
}
