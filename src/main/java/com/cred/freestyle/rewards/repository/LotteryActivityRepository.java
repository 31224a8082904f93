package com.cred.freestyle.rewards.repository;

import com.cred.freestyle.rewards.domain.model.LotteryActivity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LotteryActivityRepository extends JpaRepository<LotteryActivity, String> {
}
