package com.cred.freestyle.rewards.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Named collection of {@link PrizeCandidate}s a draw selects from.
 *
 * @author Rewards Team
 */
@Entity
@Table(name = "prize_pools")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrizePool {

    @Id
    @Column(name = "pool_id", nullable = false, length = 64)
    private String poolId;

    @Column(name = "name", nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "pool_type", nullable = false, length = 20)
    private PoolType poolType;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    public enum PoolType {
        LOTTERY,
        BLIND_BOX
    }
}
