package com.discussboard.backend.modules.post.domain;

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

/**
 * Snapshot of a post's title and body as they were before an edit.
 */
@Entity
@Table(name = "discuss_board_post_edit_histories")
public class PostEditHistory extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "post_id", nullable = false)
    private Post post;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "editor_member_id", nullable = false)
    private Member editor;

    @Column(name = "edited_title", nullable = false, length = 300)
    private String editedTitle;

    @Column(name = "edited_body", nullable = false, columnDefinition = "text")
    private String editedBody;

    @Column(name = "edit_reason", length = 500)
    private String editReason;

    public UUID getId() {
        return id;
    }

    public Post getPost() {
        return post;
    }

    public void setPost(Post post) {
        this.post = post;
    }

    public Member getEditor() {
        return editor;
    }

    public void setEditor(Member editor) {
        this.editor = editor;
    }

    public String getEditedTitle() {
        return editedTitle;
    }

    public void setEditedTitle(String editedTitle) {
        this.editedTitle = editedTitle;
    }

    public String getEditedBody() {
        return editedBody;
    }

    public void setEditedBody(String editedBody) {
        this.editedBody = editedBody;
    }

    public String getEditReason() {
        return editReason;
    }

    public void setEditReason(String editReason) {
        this.editReason = editReason;
    }
}
