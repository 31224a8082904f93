package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.domain.model.AllocationRecord;
import com.cred.freestyle.rewards.domain.model.AllocationRecord.AllocationType;
import com.cred.freestyle.rewards.domain.model.BlindBox;
import com.cred.freestyle.rewards.domain.model.BlindBox.BoxStatus;
import com.cred.freestyle.rewards.domain.model.SourceKind;
import com.cred.freestyle.rewards.exception.RejectionReason;
import com.cred.freestyle.rewards.exception.ResourceNotFoundException;
import com.cred.freestyle.rewards.exception.RewardRejectedException;
import com.cred.freestyle.rewards.repository.BlindBoxRepository;
import com.cred.freestyle.rewards.service.result.BlindBoxReceipt;
import com.cred.freestyle.rewards.service.result.PrizeView;
import com.cred.freestyle.rewards.service.result.RechargeCompletion;
import com.cred.freestyle.rewards.service.result.RequestState;
import com.cred.freestyle.rewards.service.result.RewardRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Blind boxes: issued for eligible recharge orders, opened for free against the blind-box pool.
 *
 * @author Rewards Team
 */
@Service
public class BlindBoxService {

    private static final Logger logger = LoggerFactory.getLogger(BlindBoxService.class);

    private final BlindBoxRepository blindBoxRepository;
    private final InventoryAllocator allocator;
    private final PrizeGrantService prizeGrantService;
    private final BlindBoxEligibilityPolicy eligibilityPolicy;
    private final Clock clock;
    private final String poolId;
    private final int validityDays;

    public BlindBoxService(
            BlindBoxRepository blindBoxRepository,
            InventoryAllocator allocator,
            PrizeGrantService prizeGrantService,
            BlindBoxEligibilityPolicy eligibilityPolicy,
            Clock clock,
            @Value("${rewards.blind-box.pool-id:blind-box}") String poolId,
            @Value("${rewards.blind-box.validity-days:7}") int validityDays
    ) {
        this.blindBoxRepository = blindBoxRepository;
        this.allocator = allocator;
        this.prizeGrantService = prizeGrantService;
        this.eligibilityPolicy = eligibilityPolicy;
        this.clock = clock;
        this.poolId = poolId;
        this.validityDays = validityDays;
    }

    /**
     * Issue a blind box for a paid recharge order if the eligibility policy accepts it.
     * Repeated notifications for the same order return the box already issued.
     *
     * @param completion Recharge completion event
     * @return the issued box, or empty if the recharge does not qualify
     */
    @Transactional
    public Optional<BlindBox> recordRechargeCompleted(RechargeCompletion completion, RewardRequest request) {
        if (completion.getAmount() == null || completion.getAmount().compareTo(BigDecimal.ZERO) <= 0) {
            throw RewardRejectedException.of(RejectionReason.INVALID_AMOUNT,
                    "Recharge amount must be positive", "orderId", completion.getOrderId());
        }

        Optional<BlindBox> existing = blindBoxRepository.findByOrderId(completion.getOrderId());
        if (existing.isPresent()) {
            logger.debug("Blind box {} already issued for order {}", existing.get().getBoxId(), completion.getOrderId());
            return existing;
        }

        if (!eligibilityPolicy.isEligible(completion)) {
            logger.info("Recharge order {} of account {} is not eligible for a blind box",
                       completion.getOrderId(), completion.getAccountId());
            return Optional.empty();
        }

        request.advance(RequestState.COMMITTING);
        BlindBox box = blindBoxRepository.save(BlindBox.builder()
                .accountId(completion.getAccountId())
                .orderId(completion.getOrderId())
                .poolId(poolId)
                .status(BoxStatus.UNOPENED)
                .expiresAt(clock.instant().plus(Duration.ofDays(validityDays)))
                .build());

        logger.info("Issued blind box {} to account {} for order {}",
                   box.getBoxId(), completion.getAccountId(), completion.getOrderId());
        return Optional.of(box);
    }

    /**
     * Open a blind box: draw from its pool at no cost and grant the prize.
     *
     * @param accountId Account opening the box; must own it
     * @param boxId Blind box ID
     * @param request Request being processed
     * @return the prize
     */
    @Transactional
    public BlindBoxReceipt openBlindBox(String accountId, String boxId, RewardRequest request) {
        BlindBox box = blindBoxRepository.findByIdForUpdate(boxId)
                .orElseThrow(() -> new ResourceNotFoundException("BlindBox", boxId));
        Instant now = clock.instant();

        if (!box.getAccountId().equals(accountId)) {
            throw RewardRejectedException.of(RejectionReason.BLIND_BOX_NOT_OWNED,
                    "Blind box " + boxId + " does not belong to account " + accountId, "boxId", boxId);
        }
        if (box.getStatus() == BoxStatus.OPENED) {
            throw RewardRejectedException.of(RejectionReason.BLIND_BOX_ALREADY_OPENED,
                    "Blind box " + boxId + " is already opened", "boxId", boxId, "openedAt", box.getOpenedAt());
        }
        if (box.isExpired(now)) {
            throw RewardRejectedException.of(RejectionReason.BLIND_BOX_EXPIRED,
                    "Blind box " + boxId + " expired at " + box.getExpiresAt(),
                    "boxId", boxId, "expiresAt", box.getExpiresAt());
        }

        request.advance(RequestState.ALLOCATING);
        AllocationRecord allocation = allocator.draw(box.getPoolId(), accountId, 0L, AllocationType.BLIND_BOX, boxId);

        request.advance(RequestState.COMMITTING);
        PrizeView prize = prizeGrantService.grant(allocation, SourceKind.BLIND_BOX_PAYOUT,
                "Blind box prize: " + allocation.getCandidateName());
        box.open(allocation.getAllocationId(), now);
        blindBoxRepository.save(box);

        logger.info("Blind box {} opened by account {}: {}", boxId, accountId, prize.getName());
        return BlindBoxReceipt.builder()
                .boxId(boxId)
                .prize(prize)
                .build();
    }
}
