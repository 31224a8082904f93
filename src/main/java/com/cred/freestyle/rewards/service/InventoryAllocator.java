package com.cred.freestyle.rewards.service;

import com.cred.freestyle.rewards.domain.model.AllocationRecord;
import com.cred.freestyle.rewards.domain.model.AllocationRecord.AllocationType;
import com.cred.freestyle.rewards.domain.model.PointsProduct;
import com.cred.freestyle.rewards.domain.model.PrizeCandidate;
import com.cred.freestyle.rewards.exception.PoolExhaustedException;
import com.cred.freestyle.rewards.exception.RejectionReason;
import com.cred.freestyle.rewards.exception.RewardRejectedException;
import com.cred.freestyle.rewards.infrastructure.metrics.RewardsMetricsService;
import com.cred.freestyle.rewards.repository.AllocationRecordRepository;
import com.cred.freestyle.rewards.repository.PointsProductRepository;
import com.cred.freestyle.rewards.repository.PrizeCandidateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.random.RandomGenerator;

/**
 * Weighted-random allocation of finite stock.
 *
 * Algorithm for a pool draw:
 * 1. Load eligible candidates (active, stock unbounded or > 0), ordered by candidate id
 * 2. Build integer cumulative weights and roll one value in [0, total)
 * 3. Pick the first candidate whose boundary exceeds the roll
 * 4. Compare-and-decrement its stock in the database; on a lost race start over
 *
 * Weights of out-of-stock candidates are excluded before the total is computed.
 * Stock is only written here, and only through conditional updates.
 *
 * @author Rewards Team
 */
@Service
public class InventoryAllocator {

    private static final Logger logger = LoggerFactory.getLogger(InventoryAllocator.class);

    /**
     * Pool marker stored on allocation records of points-mall exchanges.
     */
    public static final String POINTS_MALL_POOL = "points-mall";

    private final PrizeCandidateRepository candidateRepository;
    private final PointsProductRepository productRepository;
    private final AllocationRecordRepository allocationRepository;
    private final RewardsMetricsService metricsService;
    private final RandomGenerator random;
    private final Clock clock;
    private final int maxAttempts;

    public InventoryAllocator(
            PrizeCandidateRepository candidateRepository,
            PointsProductRepository productRepository,
            AllocationRecordRepository allocationRepository,
            RewardsMetricsService metricsService,
            RandomGenerator random,
            Clock clock,
            @Value("${rewards.allocator.max-attempts:3}") int maxAttempts
    ) {
        this.candidateRepository = candidateRepository;
        this.productRepository = productRepository;
        this.allocationRepository = allocationRepository;
        this.metricsService = metricsService;
        this.random = random;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Draw one prize from a pool and take one unit of its stock.
     *
     * @param poolId Prize pool ID
     * @param accountId Account receiving the prize
     * @param entryCost Points the caller charges for the draw (recorded, not debited here)
     * @param type Lottery draw or blind box
     * @param sourceRef Activity or blind box ID
     * @return the persisted allocation record
     * @throws PoolExhaustedException if nothing is left, or every attempt lost the stock race
     */
    @Transactional
    public AllocationRecord draw(String poolId, String accountId, long entryCost, AllocationType type, String sourceRef) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            List<PrizeCandidate> eligible = eligibleInOrder(candidateRepository.findEligibleByPoolId(poolId));
            if (eligible.isEmpty()) {
                metricsService.recordStockOut(poolId);
                throw new PoolExhaustedException(poolId, attempt);
            }

            long totalWeight = totalWeight(eligible);
            long roll = random.nextLong(totalWeight);
            PrizeCandidate selected = select(eligible, roll);

            if (selected.isUnbounded() || candidateRepository.decrementStock(selected.getCandidateId()) == 1) {
                logger.debug("Pool {} roll {}/{} -> candidate {} on attempt {}",
                            poolId, roll, totalWeight, selected.getCandidateId(), attempt);
                return record(accountId, type, poolId, selected.getCandidateId(), sourceRef,
                        selected.getName(), selected, 1, entryCost);
            }

            metricsService.recordRaceLost(poolId);
            logger.warn("Lost stock race on candidate {} in pool {} (attempt {}/{})",
                       selected.getCandidateId(), poolId, attempt, maxAttempts);
        }

        metricsService.recordStockOut(poolId);
        throw new PoolExhaustedException(poolId, maxAttempts);
    }

    /**
     * Take {@code quantity} units of a points-mall product.
     *
     * @param product Product, as last read by the caller
     * @param accountId Account receiving the product
     * @param quantity Units, >= 1
     * @param cost Total points charged for the exchange
     * @return the persisted allocation record
     * @throws RewardRejectedException OUT_OF_STOCK if fewer than {@code quantity} units remain
     */
    @Transactional
    public AllocationRecord allocateProduct(PointsProduct product, String accountId, int quantity, long cost) {
        String productId = product.getProductId();
        int updated = product.isUnlimitedStock()
                ? productRepository.incrementExchanged(productId, quantity)
                : productRepository.decrementStock(productId, quantity);

        if (updated == 0) {
            Integer available = productRepository.findStockQuantity(productId);
            metricsService.recordStockOut(POINTS_MALL_POOL);
            throw RewardRejectedException.of(RejectionReason.OUT_OF_STOCK,
                    String.format("Product %s is out of stock. Requested: %d, Available: %d",
                            productId, quantity, available),
                    "productId", productId, "requested", quantity, "available", available);
        }

        return record(accountId, AllocationType.EXCHANGE, POINTS_MALL_POOL, productId, productId,
                product.getName(), null, quantity, cost);
    }

    private AllocationRecord record(String accountId, AllocationType type, String poolId, String candidateId,
                                    String sourceRef, String name, PrizeCandidate prize, int quantity, long cost) {
        AllocationRecord allocation = AllocationRecord.builder()
                .allocationId(UUID.randomUUID().toString())
                .accountId(accountId)
                .allocationType(type)
                .poolId(poolId)
                .candidateId(candidateId)
                .sourceRef(sourceRef)
                .candidateName(name)
                .prizeType(prize == null ? null : prize.getPrizeType())
                .quantity(quantity)
                .costPaid(cost)
                .createdAt(clock.instant())
                .build();
        allocationRepository.save(allocation);
        logger.info("Allocated {} x {} from {} to account {} (allocation {})",
                   quantity, candidateId, poolId, accountId, allocation.getAllocationId());
        return allocation;
    }

    static List<PrizeCandidate> eligibleInOrder(List<PrizeCandidate> candidates) {
        List<PrizeCandidate> eligible = new ArrayList<>();
        for (PrizeCandidate candidate : candidates) {
            if (candidate.isEligible()) {
                eligible.add(candidate);
            }
        }
        eligible.sort(Comparator.comparing(PrizeCandidate::getCandidateId));
        return eligible;
    }

    static long totalWeight(List<PrizeCandidate> eligible) {
        long total = 0;
        for (PrizeCandidate candidate : eligible) {
            total += candidate.getWeight();
        }
        return total;
    }

    /**
     * First candidate whose cumulative weight boundary exceeds {@code roll}.
     *
     * @param eligible Eligible candidates in draw order
     * @param roll Value in [0, total weight)
     */
    static PrizeCandidate select(List<PrizeCandidate> eligible, long roll) {
        long boundary = 0;
        for (PrizeCandidate candidate : eligible) {
            boundary += candidate.getWeight();
            if (roll < boundary) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Roll " + roll + " is outside total weight " + boundary);
    }
}
