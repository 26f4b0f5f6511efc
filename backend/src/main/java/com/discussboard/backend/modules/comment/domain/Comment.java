package com.discussboard.backend.modules.comment.domain;

import java.util.UUID;

import com.discussboard.backend.global.jpa.AbstractSoftDeletableEntity;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.post.domain.Post;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Threaded comment. Root comments have depth 0 and no parent.
 */
@Entity
@Table(name = "discuss_board_comments")
public class Comment extends AbstractSoftDeletableEntity {

    public static final int MAX_DEPTH = 5;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "post_id", nullable = false)
    private Post post;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "author_member_id", nullable = false)
    private Member author;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_id")
    private Comment parent;

    @Column(name = "content", nullable = false, columnDefinition = "text")
    private String content;

    @Column(name = "depth", nullable = false)
    private int depth;

    @Column(name = "is_locked", nullable = false)
    private boolean locked;

    public UUID getId() {
        return id;
    }

    public Post getPost() {
        return post;
    }

    public void setPost(Post post) {
        this.post = post;
    }

    public Member getAuthor() {
        return author;
    }

    public void setAuthor(Member author) {
        this.author = author;
    }

    public Comment getParent() {
        return parent;
    }

    public void setParent(Comment parent) {
        this.parent = parent;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public int getDepth() {
        return depth;
    }

    public void setDepth(int depth) {
        this.depth = depth;
    }

    public boolean isLocked() {
        return locked;
    }

    public void setLocked(boolean locked) {
        this.locked = locked;
    }

    public boolean isAuthoredBy(UUID memberId) {
        return author != null && author.getId().equals(memberId);
    }
}
