package com.cred.freestyle.rewards.exception;

/**
 * Exception thrown when a prize pool has no candidate left to allocate,
 * either up front or after losing the stock race on every retry.
 *
 * @author Rewards Team
 */
public class PoolExhaustedException extends RewardRejectedException {

    private final String poolId;

    public PoolExhaustedException(String poolId, int attempts) {
        super(RejectionReason.POOL_EXHAUSTED,
                String.format("Prize pool %s is exhausted after %d attempt(s)", poolId, attempts),
                details("poolId", poolId, "attempts", attempts));
        this.poolId = poolId;
    }

    public String getPoolId() {
        return poolId;
    }
}
