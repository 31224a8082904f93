package com.cred.freestyle.rewards.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A prize inside a {@link PrizePool}.
 * remaining_stock null means unbounded; a finite stock is only ever lowered
 * through the conditional decrement in PrizeCandidateRepository.
 *
 * @author Rewards Team
 */
@Entity
@Table(name = "prize_candidates", indexes = {
    @Index(name = "idx_candidate_pool_active", columnList = "pool_id, is_active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrizeCandidate {

    @Id
    @Column(name = "candidate_id", nullable = false, length = 36)
    private String candidateId;

    @Column(name = "pool_id", nullable = false, length = 64)
    private String poolId;

    @Column(name = "prize_code", nullable = false, length = 64)
    private String prizeCode;

    @Column(name = "name", nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "prize_type", nullable = false, length = 20)
    private PrizeType prizeType;

    /**
     * Points credited when prize_type is POINTS.
     */
    @Column(name = "points_value", nullable = false)
    private Long pointsValue;

    /**
     * Relative selection weight, >= 1.
     */
    @Column(name = "weight", nullable = false)
    private Integer weight;

    @Column(name = "remaining_stock")
    private Integer remainingStock;

    /**
     * Days a granted prize stays redeemable; null means no expiry.
     */
    @Column(name = "validity_days")
    private Integer validityDays;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (candidateId == null) {
            candidateId = UUID.randomUUID().toString();
        }
        if (pointsValue == null) pointsValue = 0L;
        if (isActive == null) isActive = true;
        createdAt = Instant.now();
    }

    public boolean isUnbounded() {
        return remainingStock == null;
    }

    public boolean isEligible() {
        return Boolean.TRUE.equals(isActive)
                && weight != null && weight > 0
                && (remainingStock == null || remainingStock > 0);
    }
}
