package com.cred.freestyle.rewards.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Points-mall product bought with points.
 * total_quantity = -1 and max_exchange_per_user = -1 mean unlimited.
 *
 * @author Rewards Team
 */
@Entity
@Table(name = "points_products", indexes = {
    @Index(name = "idx_points_product_active", columnList = "is_active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PointsProduct {

    public static final int UNLIMITED = -1;

    @Id
    @Column(name = "product_id", nullable = false, length = 36)
    private String productId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "points_required", nullable = false)
    private Long pointsRequired;

    @Column(name = "total_quantity", nullable = false)
    private Integer totalQuantity;

    @Column(name = "stock_quantity", nullable = false)
    private Integer stockQuantity;

    @Column(name = "exchanged_quantity", nullable = false)
    private Integer exchangedQuantity;

    @Column(name = "max_exchange_per_user", nullable = false)
    private Integer maxExchangePerUser;

    /**
     * Balance an account must hold before it may exchange this product.
     */
    @Column(name = "min_points_balance", nullable = false)
    private Long minPointsBalance;

    @Column(name = "start_time")
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (productId == null) {
            productId = UUID.randomUUID().toString();
        }
        if (totalQuantity == null) totalQuantity = UNLIMITED;
        if (stockQuantity == null) stockQuantity = totalQuantity == UNLIMITED ? 0 : totalQuantity;
        if (exchangedQuantity == null) exchangedQuantity = 0;
        if (maxExchangePerUser == null) maxExchangePerUser = UNLIMITED;
        if (minPointsBalance == null) minPointsBalance = 0L;
        if (isActive == null) isActive = true;
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isUnlimitedStock() {
        return totalQuantity != null && totalQuantity == UNLIMITED;
    }

    public boolean hasPerUserCap() {
        return maxExchangePerUser != null && maxExchangePerUser != UNLIMITED;
    }

    public boolean isAvailable(Instant now) {
        return Boolean.TRUE.equals(isActive)
                && (startTime == null || !now.isBefore(startTime))
                && (endTime == null || !now.isAfter(endTime));
    }
}
