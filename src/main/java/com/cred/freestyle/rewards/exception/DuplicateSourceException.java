package com.cred.freestyle.rewards.exception;

import com.cred.freestyle.rewards.domain.model.SourceKind;

import java.time.Instant;

/**
 * Exception thrown when an at-most-once reward event has already been applied.
 *
 * @author Rewards Team
 */
public class DuplicateSourceException extends RewardRejectedException {

    private final String accountId;
    private final SourceKind sourceKind;
    private final String sourceRef;
    private final Instant appliedAt;

    public DuplicateSourceException(String accountId, SourceKind sourceKind, String sourceRef,
                                    Long existingEntryId, Instant appliedAt) {
        super(RejectionReason.DUPLICATE_SOURCE,
                String.format("%s %s was already applied to account %s", sourceKind, sourceRef, accountId),
                details("sourceKind", sourceKind.name(), "sourceRef", sourceRef,
                        "existingEntryId", existingEntryId, "appliedAt", appliedAt));
        this.accountId = accountId;
        this.sourceKind = sourceKind;
        this.sourceRef = sourceRef;
        this.appliedAt = appliedAt;
    }

    public String getAccountId() {
        return accountId;
    }

    public SourceKind getSourceKind() {
        return sourceKind;
    }

    public String getSourceRef() {
        return sourceRef;
    }

    public Instant getAppliedAt() {
        return appliedAt;
    }
}
