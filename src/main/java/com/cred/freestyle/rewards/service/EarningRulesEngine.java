package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.domain.model.Invitation;
import com.cred.freestyle.rewards.domain.model.Invitation.InvitationStatus;
import com.cred.freestyle.rewards.domain.model.SourceKind;
import com.cred.freestyle.rewards.domain.model.StreakState;
import com.cred.freestyle.rewards.domain.model.Task;
import com.cred.freestyle.rewards.domain.model.Task.TaskType;
import com.cred.freestyle.rewards.domain.model.TaskCompletion;
import com.cred.freestyle.rewards.domain.model.TaskCompletion.CompletionStatus;
import com.cred.freestyle.rewards.exception.RejectionReason;
import com.cred.freestyle.rewards.exception.RewardRejectedException;
import com.cred.freestyle.rewards.exception.TaskCooldownActiveException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Earning rules for check-ins, tasks and invitations.
 *
 * Stateless: every method works only on the state it is handed and either returns
 * the ledger effect to apply or throws a {@link RewardRejectedException}. It never
 * reads or writes storage.
 *
 * @author Rewards Team
 */
@Component
public class EarningRulesEngine {

    private final long checkInBasePoints;

    public EarningRulesEngine(@Value("${rewards.check-in.base-points:10}") long checkInBasePoints) {
        this.checkInBasePoints = checkInBasePoints;
    }

    /**
     * Check-in reward: base + (consecutive days - 1), uncapped.
     * The streak continues when the previous check-in was yesterday and restarts at 1 otherwise.
     *
     * @param accountId Account ID
     * @param streak Current streak state of the account
     * @param today Calendar day of the check-in
     * @return reward and next streak
     * @throws RewardRejectedException ALREADY_CHECKED_IN if the account already checked in today
     */
    public CheckInDecision decideCheckIn(String accountId, StreakState streak, LocalDate today) {
        LocalDate last = streak.getLastCheckInDate();
        if (last != null && !last.isBefore(today)) {
            throw RewardRejectedException.of(RejectionReason.ALREADY_CHECKED_IN,
                    "Account " + accountId + " already checked in on " + last,
                    "checkInDate", last, "consecutiveDays", streak.getConsecutiveDays(), "cycleDay", streak.cycleDay());
        }

        int consecutiveDays = streak.nextConsecutiveDays(today);
        long points = checkInBasePoints + (consecutiveDays - 1);
        EarningDecision reward = new EarningDecision(accountId, points, SourceKind.CHECK_IN, today.toString(),
                "Daily check-in, consecutive day " + consecutiveDays);
        return new CheckInDecision(reward, new StreakState(today, consecutiveDays));
    }

    /**
     * Task completion reward and the progress it leads to.
     * Checks run in order: inactive, not started, expired, one-time already done, cooldown, max completions.
     *
     * @param accountId Account ID
     * @param task Task definition
     * @param progress Account's progress on the task, or null if never attempted
     * @param now Current instant
     * @return reward and next progress
     */
    public TaskDecision decideTaskCompletion(String accountId, Task task, TaskCompletion progress, Instant now) {
        String code = task.getTaskCode();
        if (!Boolean.TRUE.equals(task.getIsActive())) {
            throw RewardRejectedException.of(RejectionReason.TASK_INACTIVE, "Task " + code + " is not active",
                    "taskCode", code);
        }
        if (!task.hasStarted(now)) {
            throw RewardRejectedException.of(RejectionReason.TASK_NOT_STARTED, "Task " + code + " has not started",
                    "taskCode", code, "startsAt", task.getStartDate());
        }
        if (task.hasEnded(now)) {
            throw RewardRejectedException.of(RejectionReason.TASK_EXPIRED, "Task " + code + " has ended",
                    "taskCode", code, "endedAt", task.getEndDate());
        }

        int count = progress == null ? 0 : progress.getCompletionCount();
        if (task.getTaskType() == TaskType.ONE_TIME && (count > 0 || (progress != null && progress.isCompleted()))) {
            throw RewardRejectedException.of(RejectionReason.TASK_MAX_COMPLETIONS_REACHED,
                    "One-time task " + code + " is already completed",
                    "taskCode", code, "completionCount", count, "maxCompletions", 1);
        }

        if (progress != null && progress.getLastCompletedAt() != null && task.getCooldownHours() > 0) {
            Instant availableAt = progress.getLastCompletedAt().plus(Duration.ofHours(task.getCooldownHours()));
            if (now.isBefore(availableAt)) {
                throw new TaskCooldownActiveException(code, Duration.between(now, availableAt));
            }
        }

        if (task.isBounded() && count >= task.getMaxCompletions()) {
            throw RewardRejectedException.of(RejectionReason.TASK_MAX_COMPLETIONS_REACHED,
                    "Task " + code + " reached its completion limit",
                    "taskCode", code, "completionCount", count, "maxCompletions", task.getMaxCompletions());
        }

        int nextCount = count + 1;
        CompletionStatus nextStatus = CompletionStatus.IN_PROGRESS;
        if (task.getTaskType() == TaskType.ONE_TIME || (task.isBounded() && nextCount >= task.getMaxCompletions())) {
            nextStatus = CompletionStatus.COMPLETED;
        }

        EarningDecision reward = new EarningDecision(accountId, task.getPointsReward(), SourceKind.TASK,
                task.getTaskId() + "#" + nextCount, "Task completed: " + task.getTitle());
        return new TaskDecision(reward, nextCount, nextStatus);
    }

    /**
     * Invitation payout for the inviter and the invitee's new-user bonus.
     *
     * @param callerId Account claiming the reward; must be the inviter
     * @param edge Invitation edge, read under lock
     * @return both ledger effects, keyed by the edge id
     */
    public InvitationPayout decideInvitationPayout(String callerId, Invitation edge) {
        String edgeId = edge.getInvitationId();
        if (!edge.getInviterId().equals(callerId)) {
            throw RewardRejectedException.of(RejectionReason.NOT_INVITER,
                    "Account " + callerId + " is not the inviter of invitation " + edgeId,
                    "invitationId", edgeId);
        }
        if (edge.isClaimed()) {
            throw RewardRejectedException.of(RejectionReason.DUPLICATE_SOURCE,
                    "Invitation reward " + edgeId + " was already claimed at " + edge.getClaimedAt(),
                    "invitationId", edgeId, "claimedAt", edge.getClaimedAt());
        }
        if (edge.getStatus() != InvitationStatus.COMPLETED) {
            throw RewardRejectedException.of(RejectionReason.INVITATION_NOT_COMPLETED,
                    "Invitation " + edgeId + " is " + edge.getStatus(),
                    "invitationId", edgeId, "status", edge.getStatus().name());
        }

        EarningDecision inviter = new EarningDecision(edge.getInviterId(), edge.getRewardPoints(),
                SourceKind.INVITATION, edgeId, "Invitation reward for " + edge.getInviteeId());
        EarningDecision invitee = null;
        if (edge.getInviteeBonusPoints() != null && edge.getInviteeBonusPoints() > 0) {
            invitee = new EarningDecision(edge.getInviteeId(), edge.getInviteeBonusPoints(),
                    SourceKind.NEW_USER_BONUS, edgeId, "New user bonus");
        }
        return new InvitationPayout(inviter, invitee);
    }
}
