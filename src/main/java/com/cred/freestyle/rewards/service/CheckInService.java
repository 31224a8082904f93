package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.domain.model.CheckInRecord;
import com.cred.freestyle.rewards.domain.model.LedgerEntry;
import com.cred.freestyle.rewards.domain.model.StreakState;
import com.cred.freestyle.rewards.repository.CheckInRecordRepository;
import com.cred.freestyle.rewards.service.result.CheckInReceipt;
import com.cred.freestyle.rewards.service.result.RequestState;
import com.cred.freestyle.rewards.service.result.RewardRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Daily check-in. The streak and the ledger entry are written in one transaction.
 *
 * @author Rewards Team
 */
@Service
public class CheckInService {

    private static final Logger logger = LoggerFactory.getLogger(CheckInService.class);

    private final CheckInRecordRepository checkInRecordRepository;
    private final LedgerService ledgerService;
    private final EarningRulesEngine rulesEngine;
    private final Clock clock;

    public CheckInService(
            CheckInRecordRepository checkInRecordRepository,
            LedgerService ledgerService,
            EarningRulesEngine rulesEngine,
            Clock clock
    ) {
        this.checkInRecordRepository = checkInRecordRepository;
        this.ledgerService = ledgerService;
        this.rulesEngine = rulesEngine;
        this.clock = clock;
    }

    /**
     * Check the account in for today.
     *
     * @param accountId Account ID
     * @param request Request being processed
     * @return points earned, streak and new balance
     */
    @Transactional
    public CheckInReceipt checkIn(String accountId, RewardRequest request) {
        LocalDate today = LocalDate.now(clock);

        // Lock first so the streak read below cannot race another check-in of the same account
        ledgerService.lockAccount(accountId);
        StreakState streak = currentStreak(accountId);
        CheckInDecision decision = rulesEngine.decideCheckIn(accountId, streak, today);

        request.advance(RequestState.COMMITTING);
        EarningDecision reward = decision.getReward();
        LedgerEntry entry = ledgerService.append(accountId, reward.getDelta(), reward.getSourceKind(),
                reward.getSourceRef(), reward.getDescription());

        StreakState next = decision.getNextStreak();
        checkInRecordRepository.save(CheckInRecord.builder()
                .accountId(accountId)
                .checkInDate(today)
                .consecutiveDays(next.getConsecutiveDays())
                .pointsEarned(reward.getDelta())
                .ledgerEntryId(entry.getEntryId())
                .build());

        logger.info("Check-in for account {} on {}: day {}, +{} points",
                   accountId, today, next.getConsecutiveDays(), reward.getDelta());

        return CheckInReceipt.builder()
                .checkInDate(today)
                .pointsEarned(reward.getDelta())
                .consecutiveDays(next.getConsecutiveDays())
                .cycleDay(next.cycleDay())
                .newBalance(entry.getBalanceAfter())
                .ledgerEntryId(entry.getEntryId())
                .build();
    }

    @Transactional(readOnly = true)
    public StreakState currentStreak(String accountId) {
        return checkInRecordRepository.findFirstByAccountIdOrderByCheckInDateDesc(accountId)
                .map(CheckInRecord::toStreakState)
                .orElse(StreakState.none());
    }
}
