package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.domain.model.Account;
import com.cred.freestyle.rewards.domain.model.AllocationRecord;
import com.cred.freestyle.rewards.domain.model.AllocationRecord.AllocationType;
import com.cred.freestyle.rewards.domain.model.LotteryActivity;
import com.cred.freestyle.rewards.domain.model.SourceKind;
import com.cred.freestyle.rewards.exception.InsufficientBalanceException;
import com.cred.freestyle.rewards.exception.RejectionReason;
import com.cred.freestyle.rewards.exception.ResourceNotFoundException;
import com.cred.freestyle.rewards.exception.RewardRejectedException;
import com.cred.freestyle.rewards.repository.AllocationRecordRepository;
import com.cred.freestyle.rewards.repository.LotteryActivityRepository;
import com.cred.freestyle.rewards.service.result.DrawReceipt;
import com.cred.freestyle.rewards.service.result.PrizeView;
import com.cred.freestyle.rewards.service.result.RequestState;
import com.cred.freestyle.rewards.service.result.RewardRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Lottery draws: pay the activity's cost, allocate a prize, pay the prize out.
 *
 * @author Rewards Team
 */
@Service
public class LotteryService {

    private static final Logger logger = LoggerFactory.getLogger(LotteryService.class);

    private final LotteryActivityRepository activityRepository;
    private final AllocationRecordRepository allocationRepository;
    private final LedgerService ledgerService;
    private final InventoryAllocator allocator;
    private final PrizeGrantService prizeGrantService;
    private final Clock clock;

    public LotteryService(
            LotteryActivityRepository activityRepository,
            AllocationRecordRepository allocationRepository,
            LedgerService ledgerService,
            InventoryAllocator allocator,
            PrizeGrantService prizeGrantService,
            Clock clock
    ) {
        this.activityRepository = activityRepository;
        this.allocationRepository = allocationRepository;
        this.ledgerService = ledgerService;
        this.allocator = allocator;
        this.prizeGrantService = prizeGrantService;
        this.clock = clock;
    }

    /**
     * Draw once in a lottery activity.
     *
     * Steps (one transaction):
     * 1. Validate activity window and status, per-user draw limit and balance
     * 2. Allocate a prize from the activity's pool
     * 3. Debit the draw cost
     * 4. Grant the prize (points prizes are credited)
     *
     * @param accountId Account ID
     * @param activityId Lottery activity ID
     * @param request Request being processed
     * @return prize, new balance and remaining draws
     */
    @Transactional
    public DrawReceipt draw(String accountId, String activityId, RewardRequest request) {
        LotteryActivity activity = activityRepository.findById(activityId)
                .orElseThrow(() -> new ResourceNotFoundException("LotteryActivity", activityId));
        Instant now = clock.instant();
        validateWindow(activity, now);

        Account account = ledgerService.lockAccount(accountId);

        long drawsUsed = allocationRepository.countByAccountIdAndAllocationTypeAndSourceRef(
                accountId, AllocationType.LOTTERY_DRAW, activityId);
        Integer maxDraws = activity.getMaxDrawsPerUser();
        if (maxDraws != null && drawsUsed >= maxDraws) {
            throw RewardRejectedException.of(RejectionReason.DRAW_LIMIT_REACHED,
                    "Account " + accountId + " has no draws left in activity " + activityId,
                    "maxDraws", maxDraws, "drawsUsed", drawsUsed);
        }

        long cost = activity.getPointsCost();
        if (!account.canAfford(cost)) {
            throw new InsufficientBalanceException(accountId, cost, account.getBalance());
        }

        request.advance(RequestState.ALLOCATING);
        AllocationRecord allocation = allocator.draw(activity.getPoolId(), accountId, cost,
                AllocationType.LOTTERY_DRAW, activityId);

        request.advance(RequestState.COMMITTING);
        // account is the managed instance append() updates, so its balance stays current
        if (cost > 0) {
            ledgerService.append(accountId, -cost, SourceKind.LOTTERY_COST, allocation.getAllocationId(),
                    "Lottery draw: " + activity.getName());
        }
        PrizeView prize = prizeGrantService.grant(allocation, SourceKind.LOTTERY_PAYOUT,
                "Lottery prize: " + allocation.getCandidateName());

        Integer remaining = maxDraws == null ? null : (int) (maxDraws - drawsUsed - 1);
        logger.info("Lottery draw by account {} in activity {}: {} (cost {}, remaining draws {})",
                   accountId, activityId, allocation.getCandidateName(), cost, remaining);

        return DrawReceipt.builder()
                .activityId(activityId)
                .prize(prize)
                .pointsSpent(cost)
                .newBalance(account.getBalance())
                .remainingDraws(remaining)
                .build();
    }

    private void validateWindow(LotteryActivity activity, Instant now) {
        String id = activity.getActivityId();
        if (!activity.isOpen()) {
            throw RewardRejectedException.of(RejectionReason.ACTIVITY_INACTIVE,
                    "Lottery activity " + id + " is not active",
                    "activityId", id, "status", activity.getStatus().name());
        }
        if (!activity.hasStarted(now)) {
            throw RewardRejectedException.of(RejectionReason.ACTIVITY_NOT_STARTED,
                    "Lottery activity " + id + " has not started",
                    "activityId", id, "startsAt", activity.getStartTime());
        }
        if (activity.hasEnded(now)) {
            throw RewardRejectedException.of(RejectionReason.ACTIVITY_ENDED,
                    "Lottery activity " + id + " has ended",
                    "activityId", id, "endedAt", activity.getEndTime());
        }
    }
}
