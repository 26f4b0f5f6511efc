package com.discussboard.backend.modules.moderation.domain;

import java.util.UUID;

import com.discussboard.backend.global.jpa.AbstractSoftDeletableEntity;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.comment.domain.Comment;
import com.discussboard.backend.modules.post.domain.Post;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A member's report against exactly one post or comment.
 */
@Entity
@Table(name = "discuss_board_content_reports")
public class ContentReport extends AbstractSoftDeletableEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "reporter_member_id", nullable = false)
    private Member reporter;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "content_post_id")
    private Post contentPost;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "content_comment_id")
    private Comment contentComment;

    @Enumerated(EnumType.STRING)
    @Column(name = "content_type", nullable = false, length = 16)
    private ContentType contentType;

    @Column(name = "reason", nullable = false, length = 500)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ReportStatus status = ReportStatus.PENDING;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "moderation_action_id")
    private ModerationAction moderationAction;

    public UUID getId() {
        return id;
    }

    public Member getReporter() {
        return reporter;
    }

    public void setReporter(Member reporter) {
        this.reporter = reporter;
    }

    public Post getContentPost() {
        return contentPost;
    }

    public void setContentPost(Post contentPost) {
        this.contentPost = contentPost;
    }

    public Comment getContentComment() {
        return contentComment;
    }

    public void setContentComment(Comment contentComment) {
        this.contentComment = contentComment;
    }

    public ContentType getContentType() {
        return contentType;
    }

    public void setContentType(ContentType contentType) {
        this.contentType = contentType;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public ReportStatus getStatus() {
        return status;
    }

    public void setStatus(ReportStatus status) {
        this.status = status;
    }

    public ModerationAction getModerationAction() {
        return moderationAction;
    }

    public void setModerationAction(ModerationAction moderationAction) {
        this.moderationAction = moderationAction;
    }
}
