package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.domain.model.StreakState;

/**
 * Accepted check-in: the reward and the streak it leads to.
 */
public class CheckInDecision {

    private final EarningDecision reward;
    private final StreakState nextStreak;

    public CheckInDecision(EarningDecision reward, StreakState nextStreak) {
        this.reward = reward;
        this.nextStreak = nextStreak;
    }

    public EarningDecision getReward() {
        return reward;
    }

    public StreakState getNextStreak() {
        return nextStreak;
    }
}
