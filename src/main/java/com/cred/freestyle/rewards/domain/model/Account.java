package com.cred.freestyle.rewards.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Points account, one row per user.
 * The balance is a projection of the ledger: it must always equal the
 * balance_after of the newest {@link LedgerEntry} for the account.
 * Only the ledger service writes to it, always under a row lock.
 *
 * @author Rewards Team
 */
@Entity
@Table(name = "accounts")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Account {

    @Id
    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    /**
     * Current spendable balance. Never negative.
     */
    @Column(name = "balance", nullable = false)
    private Long balance;

    /**
     * Cumulative points spent in the points mall, net of refunds.
     */
    @Column(name = "redeemed_total", nullable = false)
    private Long redeemedTotal;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (balance == null) balance = 0L;
        if (redeemedTotal == null) redeemedTotal = 0L;
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean canAfford(long points) {
        return balance != null && balance >= points;
    }
}
