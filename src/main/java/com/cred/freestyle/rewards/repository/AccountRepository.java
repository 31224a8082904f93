package com.cred.freestyle.rewards.repository;

import com.cred.freestyle.rewards.domain.model.Account;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for points accounts.
 *
 * @author Rewards Team
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, String> {

    /**
     * Find an account and take a row-level write lock on it.
     * Every balance mutation goes through this, so concurrent operations on one
     * account serialize their read-modify-write.
     *
     * @param accountId Account ID
     * @return Optional containing the locked account if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000")})
    @Query("SELECT a FROM Account a WHERE a.accountId = :accountId")
    Optional<Account> findByIdForUpdate(@Param("accountId") String accountId);
}
