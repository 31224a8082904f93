package com.cred.freestyle.rewards.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Immutable record of one balance change.
 * balance_after = previous balance_after (or 0) + delta.
 * Refunds and corrections are new entries, never updates.
 *
 * @author Rewards Team
 */
@Entity
@Immutable
@Table(name = "ledger_entries", indexes = {
    @Index(name = "idx_ledger_account_created", columnList = "account_id, created_at"),
    @Index(name = "idx_ledger_source", columnList = "source_kind, source_ref"),
    @Index(name = "idx_ledger_dedupe_key", columnList = "dedupe_key", unique = true)
})
@Getter
@ToString
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class LedgerEntry {

    /**
     * Database sequence; monotonic per account because appends serialize on the account row.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "entry_id", nullable = false, updatable = false)
    private Long entryId;

    @Column(name = "account_id", nullable = false, updatable = false, length = 64)
    private String accountId;

    @Column(name = "delta", nullable = false, updatable = false)
    private Long delta;

    @Column(name = "balance_after", nullable = false, updatable = false)
    private Long balanceAfter;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_kind", nullable = false, updatable = false, length = 32)
    private SourceKind sourceKind;

    @Column(name = "source_ref", nullable = false, updatable = false, length = 128)
    private String sourceRef;

    /**
     * Set only for at-most-once source kinds; null otherwise.
     */
    @Column(name = "dedupe_key", updatable = false, length = 256)
    private String dedupeKey;

    @Column(name = "description", updatable = false, length = 255)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public boolean isCredit() {
        return delta != null && delta > 0;
    }
}
