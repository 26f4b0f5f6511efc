package com.discussboard.backend.modules.moderation.domain;

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
 * Append-mostly trail of moderation events. Rows are removed physically.
 */
@Entity
@Table(name = "discuss_board_moderation_logs")
public class ModerationLog extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "actor_member_id")
    private Member actor;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "related_action_id")
    private ModerationAction relatedAction;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "related_appeal_id")
    private Appeal relatedAppeal;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "related_report_id")
    private ContentReport relatedReport;

    @Column(name = "event_type", nullable = false, length = 64)
    private String eventType;

    @Column(name = "event_details", columnDefinition = "text")
    private String eventDetails;

    public UUID getId() {
        return id;
    }

    public Member getActor() {
        return actor;
    }

    public void setActor(Member actor) {
        this.actor = actor;
    }

    public ModerationAction getRelatedAction() {
        return relatedAction;
    }

    public void setRelatedAction(ModerationAction relatedAction) {
        this.relatedAction = relatedAction;
    }

    public Appeal getRelatedAppeal() {
        return relatedAppeal;
    }

    public void setRelatedAppeal(Appeal relatedAppeal) {
        this.relatedAppeal = relatedAppeal;
    }

    public ContentReport getRelatedReport() {
        return relatedReport;
    }

    public void setRelatedReport(ContentReport relatedReport) {
        this.relatedReport = relatedReport;
    }

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    public String getEventDetails() {
        return eventDetails;
    }

    public void setEventDetails(String eventDetails) {
        this.eventDetails = eventDetails;
    }
}
