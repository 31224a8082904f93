package com.cred.freestyle.rewards.service.result;

public enum RewardStatus {
    COMMITTED,
    REJECTED,
    FAILED
}
