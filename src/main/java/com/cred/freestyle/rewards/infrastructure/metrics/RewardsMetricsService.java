package com.cred.freestyle.rewards.infrastructure.metrics;

import com.cred.freestyle.rewards.domain.model.SourceKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for the reward engine.
 *
 * Key Metrics:
 * - Operation outcomes (committed / rejected / failed / retried) per operation
 * - Points credited and debited per source kind
 * - Allocator stock-outs and lost stock races per pool
 * - Operation latency
 *
 * @author Rewards Team
 */
@Service
public class RewardsMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(RewardsMetricsService.class);

    private final MeterRegistry meterRegistry;

    private static final String METRIC_PREFIX = "rewards.";
    private static final String OPERATION_PREFIX = METRIC_PREFIX + "operation.";
    private static final String POINTS_PREFIX = METRIC_PREFIX + "points.";
    private static final String ALLOCATOR_PREFIX = METRIC_PREFIX + "allocator.";

    public RewardsMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordCommitted(String operation) {
        Counter.builder(OPERATION_PREFIX + "committed")
                .tag("operation", operation)
                .description("Committed reward operations")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a business rejection.
     *
     * @param operation Operation name
     * @param reason Rejection reason (e.g., "ALREADY_CHECKED_IN", "POOL_EXHAUSTED")
     */
    public void recordRejected(String operation, String reason) {
        Counter.builder(OPERATION_PREFIX + "rejected")
                .tag("operation", operation)
                .tag("reason", reason)
                .description("Rejected reward operations")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded rejection for operation: {}, reason: {}", operation, reason);
    }

    public void recordFailed(String operation, String errorType) {
        Counter.builder(OPERATION_PREFIX + "failed")
                .tag("operation", operation)
                .tag("error_type", errorType)
                .description("Reward operations failed by a system fault")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded failure for operation: {}, type: {}", operation, errorType);
    }

    public void recordRetry(String operation) {
        Counter.builder(OPERATION_PREFIX + "retried")
                .tag("operation", operation)
                .description("Transient conflicts retried by the coordinator")
                .register(meterRegistry)
                .increment();
    }

    public void recordLatency(String operation, long durationMs) {
        Timer.builder(OPERATION_PREFIX + "latency")
                .tag("operation", operation)
                .description("Reward operation latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record points moved by one ledger entry.
     *
     * @param kind Source kind of the entry
     * @param delta Signed points delta
     */
    public void recordPoints(SourceKind kind, long delta) {
        String direction = delta >= 0 ? "credited" : "debited";
        Counter.builder(POINTS_PREFIX + direction)
                .tag("source_kind", kind.name())
                .description("Points moved through the ledger")
                .register(meterRegistry)
                .increment(Math.abs(delta));
    }

    public void recordStockOut(String poolId) {
        Counter.builder(ALLOCATOR_PREFIX + "stockout")
                .tag("pool_id", poolId)
                .description("Allocations refused because the pool had no stock")
                .register(meterRegistry)
                .increment();
        logger.info("Recorded stock out for pool: {}", poolId);
    }

    public void recordRaceLost(String poolId) {
        Counter.builder(ALLOCATOR_PREFIX + "race_lost")
                .tag("pool_id", poolId)
                .description("Conditional stock decrements that matched no row")
                .register(meterRegistry)
                .increment();
    }
}
