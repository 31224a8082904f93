package com.cred.freestyle.rewards.domain.model;

import com.cred.freestyle.rewards.domain.model.ProductExchange.ExchangeStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ProductExchange and PointsProduct rules.
 */
@DisplayName("Points Mall Domain Model Tests")
class ProductExchangeTest {

    private static final Instant NOW = Instant.parse("2024-03-10T10:00:00Z");

    @ParameterizedTest
    @EnumSource(value = ExchangeStatus.class, names = {"PENDING", "ISSUED"})
    @DisplayName("Pending and issued exchanges can be refunded")
    void refund_AllowedStatuses(ExchangeStatus status) {
        ProductExchange exchange = ProductExchange.builder().status(status).build();

        exchange.refund("customer request", NOW);

        assertThat(exchange.getStatus()).isEqualTo(ExchangeStatus.REFUNDED);
        assertThat(exchange.getRefundedAt()).isEqualTo(NOW);
        assertThat(exchange.getNotes()).isEqualTo("customer request");
    }

    @ParameterizedTest
    @EnumSource(value = ExchangeStatus.class, names = {"USED", "EXPIRED", "REFUNDED", "CANCELLED"})
    @DisplayName("Used, expired, refunded and cancelled exchanges cannot be refunded")
    void refund_RejectedStatuses(ExchangeStatus status) {
        ProductExchange exchange = ProductExchange.builder().status(status).build();

        assertThat(exchange.isRefundable()).isFalse();
        assertThatThrownBy(() -> exchange.refund("late", NOW))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Product availability honours active flag and window")
    void product_IsAvailable() {
        PointsProduct product = PointsProduct.builder()
                .isActive(true)
                .startTime(NOW.minusSeconds(60))
                .endTime(NOW.plusSeconds(60))
                .build();

        assertThat(product.isAvailable(NOW)).isTrue();
        assertThat(product.isAvailable(NOW.minusSeconds(120))).isFalse();
        assertThat(product.isAvailable(NOW.plusSeconds(120))).isFalse();

        product.setIsActive(false);
        assertThat(product.isAvailable(NOW)).isFalse();
    }

    @Test
    @DisplayName("-1 marks unlimited stock and no per-user cap")
    void product_UnlimitedSentinels() {
        PointsProduct product = PointsProduct.builder()
                .totalQuantity(PointsProduct.UNLIMITED)
                .maxExchangePerUser(PointsProduct.UNLIMITED)
                .build();

        assertThat(product.isUnlimitedStock()).isTrue();
        assertThat(product.hasPerUserCap()).isFalse();

        product.setMaxExchangePerUser(2);
        assertThat(product.hasPerUserCap()).isTrue();
    }
}
