package com.cred.freestyle.rewards.service.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Comparison of an account's cached balance with its ledger.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public class ReconciliationReport {

    private final String accountId;
    private final long cachedBalance;
    private final long ledgerSum;

    /**
     * balance_after of the newest entry; 0 without entries.
     */
    private final long lastBalanceAfter;
    private final long entryCount;

    public boolean isConsistent() {
        return cachedBalance == ledgerSum && cachedBalance == lastBalanceAfter;
    }
}
