package com.cred.freestyle.rewards.exception;

/**
 * Exception thrown when an account's cached balance no longer matches its ledger.
 * This is a data fault, not a business rejection.
 *
 * @author Rewards Team
 */
public class LedgerCorruptionException extends RuntimeException {

    private final String accountId;
    private final long cachedBalance;
    private final long ledgerSum;

    public LedgerCorruptionException(String accountId, long cachedBalance, long ledgerSum) {
        super(String.format("Balance of account %s is %d but its ledger sums to %d",
                accountId, cachedBalance, ledgerSum));
        this.accountId = accountId;
        this.cachedBalance = cachedBalance;
        this.ledgerSum = ledgerSum;
    }

    public String getAccountId() {
        return accountId;
    }

    public long getCachedBalance() {
        return cachedBalance;
    }

    public long getLedgerSum() {
        return ledgerSum;
    }
}
