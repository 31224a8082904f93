package com.cred.freestyle.rewards.repository;

import com.cred.freestyle.rewards.domain.model.BlindBox;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for blind boxes.
 *
 * @author Rewards Team
 */
@Repository
public interface BlindBoxRepository extends JpaRepository<BlindBox, String> {

    Optional<BlindBox> findByOrderId(String orderId);

    List<BlindBox> findByAccountIdOrderByCreatedAtDesc(String accountId);

    /**
     * Find a blind box with a write lock so it can only be opened once.
     *
     * @param boxId Blind box ID
     * @return Optional containing the locked box if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM BlindBox b WHERE b.boxId = :boxId")
    Optional<BlindBox> findByIdForUpdate(@Param("boxId") String boxId);
}
