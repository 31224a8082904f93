package com.cred.freestyle.rewards.domain.model;

/**
 * What caused a ledger entry.
 * At-most-once kinds are guarded by a unique dedupe key per (account, kind, ref),
 * so a retried request cannot pay twice.
 *
 * @author Rewards Team
 */
public enum SourceKind {
    CHECK_IN(true),
    TASK(false),
    INVITATION(true),
    NEW_USER_BONUS(true),
    ORDER_REWARD(true),
    LOTTERY_COST(false),
    LOTTERY_PAYOUT(true),
    BLIND_BOX_PAYOUT(true),
    EXCHANGE_COST(false),
    EXCHANGE_REFUND(true),
    ADMIN(true);

    private final boolean atMostOnce;

    SourceKind(boolean atMostOnce) {
        this.atMostOnce = atMostOnce;
    }

    public boolean isAtMostOnce() {
        return atMostOnce;
    }

    public String dedupeKey(String accountId, String sourceRef) {
        return atMostOnce ? accountId + "|" + name() + "|" + sourceRef : null;
    }
}
