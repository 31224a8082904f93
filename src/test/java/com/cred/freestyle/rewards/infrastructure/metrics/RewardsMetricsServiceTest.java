package com.cred.freestyle.rewards.infrastructure.metrics;

import com.cred.freestyle.rewards.domain.model.SourceKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RewardsMetricsService Unit Tests")
class RewardsMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private RewardsMetricsService metricsService;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metricsService = new RewardsMetricsService(registry);
    }

    @Test
    @DisplayName("Points are split into credited and debited by source kind")
    void recordPoints_SplitsByDirection() {
        metricsService.recordPoints(SourceKind.CHECK_IN, 16L);
        metricsService.recordPoints(SourceKind.CHECK_IN, 10L);
        metricsService.recordPoints(SourceKind.LOTTERY_COST, -30L);

        assertThat(registry.get("rewards.points.credited").tag("source_kind", "CHECK_IN").counter().count())
                .isEqualTo(26.0);
        assertThat(registry.get("rewards.points.debited").tag("source_kind", "LOTTERY_COST").counter().count())
                .isEqualTo(30.0);
    }

    @Test
    @DisplayName("Outcomes are tagged by operation and reason")
    void recordOutcomes_Tagged() {
        metricsService.recordCommitted("draw");
        metricsService.recordRejected("draw", "POOL_EXHAUSTED");
        metricsService.recordRejected("draw", "POOL_EXHAUSTED");
        metricsService.recordFailed("check_in", "IllegalStateException");
        metricsService.recordLatency("draw", 12L);

        assertThat(registry.get("rewards.operation.committed").tag("operation", "draw").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("rewards.operation.rejected").tag("reason", "POOL_EXHAUSTED").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("rewards.operation.failed").tag("operation", "check_in").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("rewards.operation.latency").timer().totalTime(TimeUnit.MILLISECONDS)).isEqualTo(12.0);
    }

    @Test
    @DisplayName("Allocator meters are tagged by pool")
    void allocatorMeters_TaggedByPool() {
        metricsService.recordStockOut("blind-box");
        metricsService.recordRaceLost("blind-box");
        metricsService.recordRaceLost("blind-box");

        assertThat(registry.get("rewards.allocator.stockout").tag("pool_id", "blind-box").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("rewards.allocator.race_lost").tag("pool_id", "blind-box").counter().count()).isEqualTo(2.0);
    }
}
