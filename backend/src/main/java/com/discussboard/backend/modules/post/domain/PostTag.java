package com.discussboard.backend.modules.post.domain;

import java.util.UUID;

import com.discussboard.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * Link between a post and an externally managed tag id.
 */
@Entity
@Table(
        name = "discuss_board_post_tags",
        uniqueConstraints = @UniqueConstraint(name = "ux_post_tags_post_tag", columnNames = {"post_id", "tag_id"})
)
public class PostTag extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "post_id", nullable = false)
    private Post post;

    @Column(name = "tag_id", nullable = false, columnDefinition = "uuid")
    private UUID tagId;

    protected PostTag() {
    }

    public PostTag(Post post, UUID tagId) {
        this.post = post;
        this.tagId = tagId;
    }

    public UUID getId() {
        return id;
    }

    public Post getPost() {
        return post;
    }

    public UUID getTagId() {
        return tagId;
    }
}
