package com.cred.freestyle.rewards.repository;

import com.cred.freestyle.rewards.domain.model.LedgerEntry;
import com.cred.freestyle.rewards.domain.model.SourceKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for ledger entries. Append-only: nothing here updates or deletes.
 * History queries use {@link LedgerEntrySpecifications}.
 *
 * @author Rewards Team
 */
@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, Long>, JpaSpecificationExecutor<LedgerEntry> {

    Optional<LedgerEntry> findByDedupeKey(String dedupeKey);

    Optional<LedgerEntry> findFirstByAccountIdOrderByEntryIdDesc(String accountId);

    List<LedgerEntry> findByAccountIdAndSourceKindAndSourceRef(String accountId, SourceKind sourceKind, String sourceRef);

    long countByAccountId(String accountId);

    /**
     * Sum of all deltas of an account. Null when the account has no entries.
     */
    @Query("SELECT SUM(e.delta) FROM LedgerEntry e WHERE e.accountId = :accountId")
    Long sumDeltaByAccountId(@Param("accountId") String accountId);

    /**
     * Points earned (positive deltas) since the given instant. Null when none.
     */
    @Query("SELECT SUM(e.delta) FROM LedgerEntry e " +
           "WHERE e.accountId = :accountId AND e.delta > 0 AND e.createdAt >= :since")
    Long sumCreditsSince(@Param("accountId") String accountId, @Param("since") Instant since);
}
