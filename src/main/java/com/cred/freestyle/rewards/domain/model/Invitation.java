package com.cred.freestyle.rewards.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Invitation edge from inviter to invitee.
 * PENDING -> COMPLETED once the invitee qualifies; the reward is paid once, guarded by claimed_at.
 *
 * @author Rewards Team
 */
@Entity
@Table(name = "invitations", indexes = {
    @Index(name = "idx_invitation_invitee", columnList = "invitee_id", unique = true),
    @Index(name = "idx_invitation_inviter_status", columnList = "inviter_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Invitation {

    @Id
    @Column(name = "invitation_id", nullable = false, length = 36)
    private String invitationId;

    @Column(name = "inviter_id", nullable = false, length = 64)
    private String inviterId;

    @Column(name = "invitee_id", nullable = false, unique = true, length = 64)
    private String inviteeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private InvitationStatus status;

    @Column(name = "reward_points", nullable = false)
    private Long rewardPoints;

    @Column(name = "invitee_bonus_points", nullable = false)
    private Long inviteeBonusPoints;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (invitationId == null) {
            invitationId = UUID.randomUUID().toString();
        }
        if (status == null) status = InvitationStatus.PENDING;
        createdAt = Instant.now();
    }

    public boolean isClaimed() {
        return claimedAt != null;
    }

    /**
     * Move a pending edge to completed. No-op when already completed.
     *
     * @throws IllegalStateException if the edge has expired
     */
    public void complete(Instant now) {
        if (status == InvitationStatus.COMPLETED) {
            return;
        }
        if (status != InvitationStatus.PENDING) {
            throw new IllegalStateException("Cannot complete invitation in status: " + status);
        }
        this.status = InvitationStatus.COMPLETED;
        this.completedAt = now;
    }

    public enum InvitationStatus {
        PENDING,
        COMPLETED,
        EXPIRED
    }

    /**
     * How the invitee signed up; decides the inviter reward.
     */
    public enum Channel {
        STANDARD,
        PHONE
    }
}
