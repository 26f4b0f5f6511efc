package com.discussboard.backend.modules.platform.domain;

import java.util.UUID;

import com.discussboard.backend.global.jpa.AbstractSoftDeletableEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Record of a call to an external partner (mail relay, push gateway, ...).
 */
@Entity
@Table(name = "discuss_board_integration_logs")
public class IntegrationLog extends AbstractSoftDeletableEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "user_account_id")
    private UUID userAccountId;

    @Column(name = "integration_type", nullable = false, length = 64)
    private String integrationType;

    @Column(name = "integration_partner", nullable = false, length = 128)
    private String integrationPartner;

    @Column(name = "payload", columnDefinition = "text")
    private String payload;

    @Column(name = "integration_status", nullable = false, length = 32)
    private String integrationStatus;

    @Column(name = "external_reference_id", length = 255)
    private String externalReferenceId;

    @Column(name = "triggered_event", length = 128)
    private String triggeredEvent;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    public UUID getId() {
        return id;
    }

    public UUID getUserAccountId() {
        return userAccountId;
    }

    public void setUserAccountId(UUID userAccountId) {
        this.userAccountId = userAccountId;
    }

    public String getIntegrationType() {
        return integrationType;
    }

    public void setIntegrationType(String integrationType) {
        this.integrationType = integrationType;
    }

    public String getIntegrationPartner() {
        return integrationPartner;
    }

    public void setIntegrationPartner(String integrationPartner) {
        this.integrationPartner = integrationPartner;
    }

    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
    }

    public String getIntegrationStatus() {
        return integrationStatus;
    }

    public void setIntegrationStatus(String integrationStatus) {
        this.integrationStatus = integrationStatus;
    }

    public String getExternalReferenceId() {
        return externalReferenceId;
    }

    public void setExternalReferenceId(String externalReferenceId) {
        this.externalReferenceId = externalReferenceId;
    }

    public String getTriggeredEvent() {
        return triggeredEvent;
    }

    public void setTriggeredEvent(String triggeredEvent) {
        this.triggeredEvent = triggeredEvent;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }
}
