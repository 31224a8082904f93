package com.cred.freestyle.rewards.config;

import com.cred.freestyle.rewards.service.BlindBoxEligibilityPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneId;
import java.util.random.RandomGenerator;

/**
 * Core beans shared by the reward services.
 *
 * @author Rewards Team
 */
@Configuration
public class RewardsConfig {

    private static final Logger logger = LoggerFactory.getLogger(RewardsConfig.class);

    @Value("${rewards.zone:UTC}")
    private String zone;

    /**
     * Clock used for every timestamp and for deciding the check-in calendar day.
     *
     * @return system clock in the configured zone
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock rewardsClock() {
        logger.info("Rewards clock zone: {}", zone);
        return Clock.system(ZoneId.of(zone));
    }

    /**
     * Random source for weighted draws. Thread-safe.
     *
     * @return SecureRandom-backed generator
     */
    @Bean
    @ConditionalOnMissingBean
    public RandomGenerator drawRandom() {
        return new SecureRandom();
    }

    /**
     * Blind-box eligibility when no geofence collaborator is wired: every recharge qualifies.
     *
     * @return permissive policy
     */
    @Bean
    @ConditionalOnMissingBean
    public BlindBoxEligibilityPolicy blindBoxEligibilityPolicy() {
        return completion -> true;
    }
}
