package com.cred.freestyle.rewards.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Points-mall exchange of an account.
 *
 * @author Rewards Team
 */
@Entity
@Table(name = "product_exchanges", indexes = {
    @Index(name = "idx_exchange_account_product", columnList = "account_id, product_id"),
    @Index(name = "idx_exchange_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductExchange {

    @Id
    @Column(name = "exchange_id", nullable = false, length = 36)
    private String exchangeId;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    @Column(name = "product_id", nullable = false, length = 36)
    private String productId;

    @Column(name = "product_name", nullable = false)
    private String productName;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "points_used", nullable = false)
    private Long pointsUsed;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ExchangeStatus status;

    @Column(name = "allocation_id", length = 36)
    private String allocationId;

    @Column(name = "refunded_at")
    private Instant refundedAt;

    @Column(name = "notes")
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (exchangeId == null) {
            exchangeId = UUID.randomUUID().toString();
        }
        if (status == null) status = ExchangeStatus.PENDING;
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isRefundable() {
        return status == ExchangeStatus.PENDING || status == ExchangeStatus.ISSUED;
    }

    /**
     * Mark the exchange refunded.
     *
     * @throws IllegalStateException if the exchange is already used, refunded or cancelled
     */
    public void refund(String reason, Instant now) {
        if (!isRefundable()) {
            throw new IllegalStateException("Cannot refund exchange in status: " + status);
        }
        this.status = ExchangeStatus.REFUNDED;
        this.refundedAt = now;
        this.notes = reason;
    }

    public enum ExchangeStatus {
        PENDING,
        ISSUED,
        USED,
        EXPIRED,
        REFUNDED,
        CANCELLED;

        /**
         * Statuses that no longer count toward a per-user exchange cap.
         */
        public static Set<ExchangeStatus> released() {
            return EnumSet.of(REFUNDED, CANCELLED);
        }
    }
}
