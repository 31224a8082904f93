package com.cred.freestyle.rewards.exception;

import java.time.Duration;

/**
 * Exception thrown when a task is completed again before its cooldown has elapsed.
 *
 * @author Rewards Team
 */
public class TaskCooldownActiveException extends RewardRejectedException {

    private final String taskCode;
    private final Duration remaining;

    public TaskCooldownActiveException(String taskCode, Duration remaining) {
        super(RejectionReason.TASK_COOLDOWN_ACTIVE,
                String.format("Task %s is cooling down, %d hour(s) remaining", taskCode, roundUpHours(remaining)),
                details("remainingHours", roundUpHours(remaining), "remainingSeconds", remaining.getSeconds()));
        this.taskCode = taskCode;
        this.remaining = remaining;
    }

    private static long roundUpHours(Duration remaining) {
        long hours = remaining.toHours();
        return remaining.minusHours(hours).isZero() ? hours : hours + 1;
    }

    public String getTaskCode() {
        return taskCode;
    }

    public Duration getRemaining() {
        return remaining;
    }
}
