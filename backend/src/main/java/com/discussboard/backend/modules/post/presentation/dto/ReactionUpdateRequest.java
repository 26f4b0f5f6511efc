package com.discussboard.backend.modules.post.presentation.dto;

/**
 * Omitting {@code reactionType} flips a like into a dislike and back.
 */
public record ReactionUpdateRequest(String reactionType) {
}
