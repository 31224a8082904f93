package com.cred.freestyle.rewards.repository;

import com.cred.freestyle.rewards.domain.model.CheckInRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository for check-in history.
 *
 * @author Rewards Team
 */
@Repository
public interface CheckInRecordRepository extends JpaRepository<CheckInRecord, String> {

    /**
     * Latest check-in of an account; its streak fields are the account's streak state.
     */
    Optional<CheckInRecord> findFirstByAccountIdOrderByCheckInDateDesc(String accountId);

    boolean existsByAccountIdAndCheckInDate(String accountId, LocalDate checkInDate);

    List<CheckInRecord> findByAccountIdAndCheckInDateBetweenOrderByCheckInDateAsc(
            String accountId, LocalDate from, LocalDate to);

    long countByAccountId(String accountId);
}
