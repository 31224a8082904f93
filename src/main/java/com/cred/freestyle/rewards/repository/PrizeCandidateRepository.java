package com.cred.freestyle.rewards.repository;

import com.cred.freestyle.rewards.domain.model.PrizeCandidate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for prize candidates with the stock compare-and-decrement.
 *
 * @author Rewards Team
 */
@Repository
public interface PrizeCandidateRepository extends JpaRepository<PrizeCandidate, String> {

    /**
     * Candidates a draw may select: active, positive weight, stock unbounded or above zero.
     * Ordered by candidate id so a random value always maps to the same candidate.
     *
     * @param poolId Prize pool ID
     * @return Eligible candidates in ascending id order
     */
    @Query("SELECT c FROM PrizeCandidate c " +
           "WHERE c.poolId = :poolId AND c.isActive = true AND c.weight > 0 " +
           "AND (c.remainingStock IS NULL OR c.remainingStock > 0) " +
           "ORDER BY c.candidateId ASC")
    List<PrizeCandidate> findEligibleByPoolId(@Param("poolId") String poolId);

    List<PrizeCandidate> findByPoolIdOrderByCandidateIdAsc(String poolId);

    /**
     * Atomically take one unit of finite stock.
     * The condition is evaluated by the database against the committed row, so two
     * racing draws on the last unit cannot both succeed.
     *
     * @param candidateId Candidate ID
     * @return 1 if a unit was taken, 0 if the stock was already exhausted (or unbounded)
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE PrizeCandidate c SET c.remainingStock = c.remainingStock - 1 " +
           "WHERE c.candidateId = :candidateId AND c.remainingStock > 0")
    int decrementStock(@Param("candidateId") String candidateId);

    @Query("SELECT c.remainingStock FROM PrizeCandidate c WHERE c.candidateId = :candidateId")
    Integer findRemainingStock(@Param("candidateId") String candidateId);
}
