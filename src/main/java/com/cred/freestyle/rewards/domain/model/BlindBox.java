package com.cred.freestyle.rewards.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Blind box issued for a completed recharge order.
 * Lifecycle: UNOPENED -> OPENED, or UNOPENED past expires_at (treated as EXPIRED).
 *
 * @author Rewards Team
 */
@Entity
@Table(name = "blind_boxes", indexes = {
    @Index(name = "idx_blind_box_order", columnList = "order_id", unique = true),
    @Index(name = "idx_blind_box_account_status", columnList = "account_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlindBox {

    @Id
    @Column(name = "box_id", nullable = false, length = 36)
    private String boxId;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    /**
     * Recharge order that earned the box. One box per order.
     */
    @Column(name = "order_id", nullable = false, unique = true, length = 64)
    private String orderId;

    @Column(name = "pool_id", nullable = false, length = 64)
    private String poolId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BoxStatus status;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "opened_at")
    private Instant openedAt;

    @Column(name = "allocation_id", length = 36)
    private String allocationId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (boxId == null) {
            boxId = UUID.randomUUID().toString();
        }
        if (status == null) status = BoxStatus.UNOPENED;
        createdAt = Instant.now();
    }

    public boolean isExpired(Instant now) {
        return status == BoxStatus.EXPIRED
                || (status == BoxStatus.UNOPENED && expiresAt != null && now.isAfter(expiresAt));
    }

    /**
     * Mark the box opened.
     *
     * @throws IllegalStateException if the box is not unopened
     */
    public void open(String allocationId, Instant now) {
        if (status != BoxStatus.UNOPENED) {
            throw new IllegalStateException("Cannot open blind box in status: " + status);
        }
        this.status = BoxStatus.OPENED;
        this.allocationId = allocationId;
        this.openedAt = now;
    }

    public enum BoxStatus {
        UNOPENED,
        OPENED,
        EXPIRED
    }
}
