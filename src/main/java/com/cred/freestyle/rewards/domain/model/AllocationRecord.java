package com.cred.freestyle.rewards.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Immutable proof that one unit (or quantity) of stock went to an account.
 * Ledger entries for costs and payouts reference its id.
 *
 * @author Rewards Team
 */
@Entity
@Immutable
@Table(name = "allocation_records", indexes = {
    @Index(name = "idx_allocation_candidate", columnList = "candidate_id"),
    @Index(name = "idx_allocation_account_source", columnList = "account_id, allocation_type, source_ref")
})
@Getter
@ToString
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class AllocationRecord {

    @Id
    @Column(name = "allocation_id", nullable = false, updatable = false, length = 36)
    private String allocationId;

    @Column(name = "account_id", nullable = false, updatable = false, length = 64)
    private String accountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "allocation_type", nullable = false, updatable = false, length = 20)
    private AllocationType allocationType;

    /**
     * Prize pool for draws; the points-mall pool marker for exchanges.
     */
    @Column(name = "pool_id", nullable = false, updatable = false, length = 64)
    private String poolId;

    /**
     * Prize candidate id, or product id for exchanges.
     */
    @Column(name = "candidate_id", nullable = false, updatable = false, length = 36)
    private String candidateId;

    /**
     * Activity id, blind box id or product id that triggered the allocation.
     */
    @Column(name = "source_ref", nullable = false, updatable = false, length = 64)
    private String sourceRef;

    @Column(name = "candidate_name", nullable = false, updatable = false)
    private String candidateName;

    @Enumerated(EnumType.STRING)
    @Column(name = "prize_type", updatable = false, length = 20)
    private PrizeType prizeType;

    @Column(name = "quantity", nullable = false, updatable = false)
    private Integer quantity;

    @Column(name = "cost_paid", nullable = false, updatable = false)
    private Long costPaid;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public enum AllocationType {
        LOTTERY_DRAW,
        BLIND_BOX,
        EXCHANGE
    }
}
