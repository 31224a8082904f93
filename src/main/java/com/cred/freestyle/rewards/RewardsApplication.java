package com.cred.freestyle.rewards;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Rewards ledger service.
 *
 * Owns point balances and their ledger, earning rules (check-in streaks, tasks,
 * invitations) and inventory-gated prize allocation (lottery, blind boxes, points mall).
 * Callers go through {@link com.cred.freestyle.rewards.service.RewardCoordinator}.
 *
 * @author Rewards Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
public class RewardsApplication {

    public static void main(String[] args) {
        SpringApplication.run(RewardsApplication.class, args);
    }
}
