package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.domain.model.TaskCompletion.CompletionStatus;

/**
 * Accepted task completion: the reward plus the progress to store.
 */
public class TaskDecision {

    private final EarningDecision reward;
    private final int nextCompletionCount;
    private final CompletionStatus nextStatus;

    public TaskDecision(EarningDecision reward, int nextCompletionCount, CompletionStatus nextStatus) {
        this.reward = reward;
        this.nextCompletionCount = nextCompletionCount;
        this.nextStatus = nextStatus;
    }

    public EarningDecision getReward() {
        return reward;
    }

    public int getNextCompletionCount() {
        return nextCompletionCount;
    }

    public CompletionStatus getNextStatus() {
        return nextStatus;
    }
}
