package com.discussboard.backend.modules.comment.domain;

import java.util.UUID;

import com.discussboard.backend.global.jpa.AbstractTimestampedEntity;
import com.discussboard.backend.modules.auth.domain.Member;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "discuss_board_comment_edit_histories")
public class CommentEditHistory extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "comment_id", nullable = false)
    private Comment comment;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "editor_member_id", nullable = false)
    private Member editor;

    @Column(name = "previous_content", nullable = false, columnDefinition = "text")
    private String previousContent;

    @Column(name = "edit_reason", length = 500)
    private String editReason;

    public UUID getId() {
        return id;
    }

    public Comment getComment() {
        return comment;
    }

    public void setComment(Comment comment) {
        this.comment = comment;
    }

    public Member getEditor() {
        return editor;
    }

    public void setEditor(Member editor) {
        this.editor = editor;
    }

    public String getPreviousContent() {
        return previousContent;
    }

    public void setPreviousContent(String previousContent) {
        this.previousContent = previousContent;
    }

    public String getEditReason() {
        return editReason;
    }

    public void setEditReason(String editReason) {
        this.editReason = editReason;
    }
}
