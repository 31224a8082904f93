package com.cred.freestyle.rewards.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Prize owned by an account after a lottery draw or a blind-box opening.
 * Points prizes are credited at once and stored as REDEEMED.
 *
 * @author Rewards Team
 */
@Entity
@Table(name = "prize_grants", indexes = {
    @Index(name = "idx_grant_account_status", columnList = "account_id, status"),
    @Index(name = "idx_grant_allocation", columnList = "allocation_id", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrizeGrant {

    @Id
    @Column(name = "grant_id", nullable = false, length = 36)
    private String grantId;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    @Column(name = "allocation_id", nullable = false, length = 36)
    private String allocationId;

    @Column(name = "candidate_id", nullable = false, length = 36)
    private String candidateId;

    @Column(name = "prize_name", nullable = false)
    private String prizeName;

    @Enumerated(EnumType.STRING)
    @Column(name = "prize_type", nullable = false, length = 20)
    private PrizeType prizeType;

    @Column(name = "points_value", nullable = false)
    private Long pointsValue;

    @Column(name = "redemption_code", length = 32)
    private String redemptionCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private GrantStatus status;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "redeemed_at")
    private Instant redeemedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (grantId == null) {
            grantId = UUID.randomUUID().toString();
        }
        if (status == null) status = GrantStatus.PENDING;
        createdAt = Instant.now();
    }

    public enum GrantStatus {
        PENDING,
        REDEEMED
    }
}
