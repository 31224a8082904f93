package com.cred.freestyle.rewards.repository;

import com.cred.freestyle.rewards.domain.model.LedgerEntry;
import com.cred.freestyle.rewards.domain.model.SourceKind;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.Set;

/**
 * Composable filters for ledger history queries.
 *
 * @author Rewards Team
 */
public final class LedgerEntrySpecifications {

    private LedgerEntrySpecifications() {
    }

    public static Specification<LedgerEntry> forAccount(String accountId) {
        return (root, query, cb) -> cb.equal(root.get("accountId"), accountId);
    }

    public static Specification<LedgerEntry> kindIn(Set<SourceKind> kinds) {
        return (root, query, cb) -> root.get("sourceKind").in(kinds);
    }

    public static Specification<LedgerEntry> createdAtOrAfter(Instant from) {
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.<Instant>get("createdAt"), from);
    }

    public static Specification<LedgerEntry> createdBefore(Instant to) {
        return (root, query, cb) -> cb.lessThan(root.<Instant>get("createdAt"), to);
    }

    public static Specification<LedgerEntry> credits() {
        return (root, query, cb) -> cb.greaterThan(root.<Long>get("delta"), 0L);
    }

    public static Specification<LedgerEntry> debits() {
        return (root, query, cb) -> cb.lessThan(root.<Long>get("delta"), 0L);
    }

    /**
     * Keyset condition for the page after (createdAt, entryId) in descending order.
     */
    public static Specification<LedgerEntry> before(Instant createdAt, Long entryId) {
        return (root, query, cb) -> cb.or(
                cb.lessThan(root.<Instant>get("createdAt"), createdAt),
                cb.and(
                        cb.equal(root.get("createdAt"), createdAt),
                        cb.lessThan(root.<Long>get("entryId"), entryId)));
    }
}
