package com.cred.freestyle.rewards.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Progress of one account on one task.
 *
 * @author Rewards Team
 */
@Entity
@Table(name = "task_completions", indexes = {
    @Index(name = "idx_task_completion_account_task", columnList = "account_id, task_id", unique = true),
    @Index(name = "idx_task_completion_account_status", columnList = "account_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskCompletion {

    @Id
    @Column(name = "completion_id", nullable = false, length = 36)
    private String completionId;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    @Column(name = "task_id", nullable = false, length = 36)
    private String taskId;

    @Column(name = "completion_count", nullable = false)
    private Integer completionCount;

    @Column(name = "last_completed_at")
    private Instant lastCompletedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private CompletionStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (completionId == null) {
            completionId = UUID.randomUUID().toString();
        }
        if (completionCount == null) completionCount = 0;
        if (status == null) status = CompletionStatus.IN_PROGRESS;
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isCompleted() {
        return status == CompletionStatus.COMPLETED;
    }

    public enum CompletionStatus {
        IN_PROGRESS,
        COMPLETED
    }
}
