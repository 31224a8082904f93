package com.cred.freestyle.rewards.exception;

/**
 * Business reasons a reward operation can be refused.
 * Callers surface these as-is; they are never system faults.
 *
 * @author Rewards Team
 */
public enum RejectionReason {
    RESOURCE_NOT_FOUND,
    ALREADY_CHECKED_IN,
    TASK_INACTIVE,
    TASK_NOT_STARTED,
    TASK_EXPIRED,
    TASK_COOLDOWN_ACTIVE,
    TASK_MAX_COMPLETIONS_REACHED,
    INSUFFICIENT_BALANCE,
    POOL_EXHAUSTED,
    DUPLICATE_SOURCE,
    EXCHANGE_LIMIT_REACHED,
    OUT_OF_STOCK,
    ACTIVITY_INACTIVE,
    ACTIVITY_NOT_STARTED,
    ACTIVITY_ENDED,
    DRAW_LIMIT_REACHED,
    BLIND_BOX_NOT_OWNED,
    BLIND_BOX_ALREADY_OPENED,
    BLIND_BOX_EXPIRED,
    PRODUCT_UNAVAILABLE,
    INVALID_QUANTITY,
    INVALID_AMOUNT,
    EXCHANGE_NOT_REFUNDABLE,
    NOT_INVITER,
    INVITATION_NOT_COMPLETED,
    INVALID_INVITATION
}
