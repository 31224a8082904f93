package com.cred.freestyle.rewards.service.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Notification from the order system that a recharge order has been paid.
 * Latitude and longitude are optional and only consulted by the eligibility policy.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public class RechargeCompletion {

    private final String accountId;
    private final String orderId;
    private final BigDecimal amount;
    private final Double latitude;
    private final Double longitude;
}
