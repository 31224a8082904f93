package com.cred.freestyle.rewards.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Catalog definition of a point-earning task.
 * Read-only reference data for the reward services.
 *
 * @author Rewards Team
 */
@Entity
@Table(name = "tasks", indexes = {
    @Index(name = "idx_task_code", columnList = "task_code", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    @Id
    @Column(name = "task_id", nullable = false, length = 36)
    private String taskId;

    @Column(name = "task_code", nullable = false, unique = true, length = 64)
    private String taskCode;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "points_reward", nullable = false)
    private Long pointsReward;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_type", nullable = false, length = 20)
    private TaskType taskType;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive;

    /**
     * Null means unbounded.
     */
    @Column(name = "max_completions")
    private Integer maxCompletions;

    @Column(name = "cooldown_hours", nullable = false)
    private Integer cooldownHours;

    @Column(name = "start_date")
    private Instant startDate;

    @Column(name = "end_date")
    private Instant endDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (taskId == null) {
            taskId = UUID.randomUUID().toString();
        }
        if (isActive == null) isActive = true;
        if (cooldownHours == null) cooldownHours = 0;
        createdAt = Instant.now();
    }

    public boolean hasStarted(Instant now) {
        return startDate == null || !now.isBefore(startDate);
    }

    public boolean hasEnded(Instant now) {
        return endDate != null && now.isAfter(endDate);
    }

    public boolean isBounded() {
        return maxCompletions != null;
    }

    public enum TaskType {
        ONE_TIME,
        DAILY,
        WEEKLY,
        MONTHLY,
        REPEATABLE
    }
}
