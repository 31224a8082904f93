package com.cred.freestyle.rewards.repository;

import com.cred.freestyle.rewards.domain.model.PrizeGrant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PrizeGrantRepository extends JpaRepository<PrizeGrant, String> {

    Optional<PrizeGrant> findByAllocationId(String allocationId);

    List<PrizeGrant> findByAccountIdOrderByCreatedAtDesc(String accountId);
}
