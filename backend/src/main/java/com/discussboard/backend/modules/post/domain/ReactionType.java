package com.discussboard.backend.modules.post.domain;

/**
 * Reaction kinds shared by posts and comments.
 */
public enum ReactionType {
    LIKE,
    DISLIKE;

    public ReactionType opposite() {
        return this == LIKE ? DISLIKE : LIKE;
    }
}
