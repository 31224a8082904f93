package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.domain.model.SourceKind;

/**
 * Ledger effect an earning rule wants applied: who gets how many points, and why.
 * Pure value; nothing is written until a service appends it.
 *
 * @author Rewards Team
 */
public class EarningDecision {

    private final String accountId;
    private final long delta;
    private final SourceKind sourceKind;
    private final String sourceRef;
    private final String description;

    public EarningDecision(String accountId, long delta, SourceKind sourceKind, String sourceRef, String description) {
        this.accountId = accountId;
        this.delta = delta;
        this.sourceKind = sourceKind;
        this.sourceRef = sourceRef;
        this.description = description;
    }

    public String getAccountId() {
        return accountId;
    }

    public long getDelta() {
        return delta;
    }

    public SourceKind getSourceKind() {
        return sourceKind;
    }

    public String getSourceRef() {
        return sourceRef;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "EarningDecision{account=" + accountId + ", delta=" + delta + ", kind=" + sourceKind
                + ", ref=" + sourceRef + "}";
    }
}
