package com.cred.freestyle.rewards.repository;

import com.cred.freestyle.rewards.domain.model.PrizePool;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PrizePoolRepository extends JpaRepository<PrizePool, String> {
}
