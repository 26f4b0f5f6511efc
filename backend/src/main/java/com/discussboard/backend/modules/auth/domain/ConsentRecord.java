package com.discussboard.backend.modules.auth.domain;

import java.util.UUID;

import com.discussboard.backend.global.jpa.AbstractTimestampedEntity;

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
@Table(name = "discuss_board_consent_records")
public class ConsentRecord extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_account_id", nullable = false)
    private UserAccount userAccount;

    @Column(name = "policy_type", nullable = false, length = 64)
    private String policyType;

    @Column(name = "policy_version", nullable = false, length = 32)
    private String policyVersion;

    @Enumerated(EnumType.STRING)
    @Column(name = "consent_action", nullable = false, length = 16)
    private ConsentAction consentAction;

    public UUID getId() {
        return id;
    }

    public UserAccount getUserAccount() {
        return userAccount;
    }

    public void setUserAccount(UserAccount userAccount) {
        this.userAccount = userAccount;
    }

    public String getPolicyType() {
        return policyType;
    }

    public void setPolicyType(String policyType) {
        this.policyType = policyType;
    }

    public String getPolicyVersion() {
        return policyVersion;
    }

    public void setPolicyVersion(String policyVersion) {
        this.policyVersion = policyVersion;
    }

    public ConsentAction getConsentAction() {
        return consentAction;
    }

    public void setConsentAction(ConsentAction consentAction) {
        this.consentAction = consentAction;
    }
}
