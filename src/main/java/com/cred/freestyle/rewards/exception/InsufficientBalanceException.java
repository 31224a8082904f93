package com.cred.freestyle.rewards.exception;

/**
 * Exception thrown when a debit would drive an account balance below zero
 * (or below a product's minimum balance requirement).
 *
 * @author Rewards Team
 */
public class InsufficientBalanceException extends RewardRejectedException {

    private final String accountId;
    private final long required;
    private final long available;

    public InsufficientBalanceException(String accountId, long required, long available) {
        super(RejectionReason.INSUFFICIENT_BALANCE,
                String.format("Account %s has insufficient points. Required: %d, Available: %d",
                        accountId, required, available),
                details("required", required, "available", available));
        this.accountId = accountId;
        this.required = required;
        this.available = available;
    }

    public String getAccountId() {
        return accountId;
    }

    public long getRequired() {
        return required;
    }

    public long getAvailable() {
        return available;
    }
}
