package com.cred.freestyle.rewards.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Lottery campaign: costs points per draw and draws from one prize pool.
 *
 * @author Rewards Team
 */
@Entity
@Table(name = "lottery_activities")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LotteryActivity {

    @Id
    @Column(name = "activity_id", nullable = false, length = 36)
    private String activityId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "pool_id", nullable = false, length = 64)
    private String poolId;

    @Column(name = "points_cost", nullable = false)
    private Long pointsCost;

    /**
     * Null means unlimited draws.
     */
    @Column(name = "max_draws_per_user")
    private Integer maxDrawsPerUser;

    @Column(name = "start_time")
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ActivityStatus status;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (activityId == null) {
            activityId = UUID.randomUUID().toString();
        }
        if (pointsCost == null) pointsCost = 0L;
        if (status == null) status = ActivityStatus.DRAFT;
        if (isActive == null) isActive = true;
        createdAt = Instant.now();
    }

    public boolean isOpen() {
        return status == ActivityStatus.ACTIVE && Boolean.TRUE.equals(isActive);
    }

    public boolean hasStarted(Instant now) {
        return startTime == null || !now.isBefore(startTime);
    }

    public boolean hasEnded(Instant now) {
        return endTime != null && now.isAfter(endTime);
    }

    public enum ActivityStatus {
        DRAFT,
        ACTIVE,
        PAUSED,
        ENDED
    }
}
