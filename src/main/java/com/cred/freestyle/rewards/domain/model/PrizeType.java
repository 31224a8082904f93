package com.cred.freestyle.rewards.domain.model;

/**
 * Kind of prize a candidate pays out.
 *
 * @author Rewards Team
 */
public enum PrizeType {
    /** Credited to the ledger immediately. */
    POINTS,
    VIRTUAL,
    PHYSICAL,
    COUPON,
    /** Consolation outcome, grants nothing. */
    THANK_YOU;

    public boolean needsRedemptionCode() {
        return this != POINTS && this != THANK_YOU;
    }
}
