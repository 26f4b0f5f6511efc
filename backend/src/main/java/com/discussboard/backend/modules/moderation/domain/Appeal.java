package com.discussboard.backend.modules.moderation.domain;

import java.util.UUID;

import com.discussboard.backend.global.jpa.AbstractSoftDeletableEntity;
import com.discussboard.backend.modules.auth.domain.Member;

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

@Entity
@Table(name = "discuss_board_appeals")
public class Appeal extends AbstractSoftDeletableEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "moderation_action_id", nullable = false)
    private ModerationAction moderationAction;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "appellant_member_id", nullable = false)
    private Member appellant;

    @Column(name = "appeal_rationale", nullable = false, columnDefinition = "text")
    private String appealRationale;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private AppealStatus status = AppealStatus.PENDING;

    @Column(name = "resolution_notes", columnDefinition = "text")
    private String resolutionNotes;

    public UUID getId() {
        return id;
    }

    public ModerationAction getModerationAction() {
        return moderationAction;
    }

    public void setModerationAction(ModerationAction moderationAction) {
        this.moderationAction = moderationAction;
    }

    public Member getAppellant() {
        return appellant;
    }

    public void setAppellant(Member appellant) {
        this.appellant = appellant;
    }

    public String getAppealRationale() {
        return appealRationale;
    }

    public void setAppealRationale(String appealRationale) {
        this.appealRationale = appealRationale;
    }

    public AppealStatus getStatus() {
        return status;
    }

    public void setStatus(AppealStatus status) {
        this.status = status;
    }

    public String getResolutionNotes() {
        return resolutionNotes;
    }

    public void setResolutionNotes(String resolutionNotes) {
        this.resolutionNotes = resolutionNotes;
    }
}
