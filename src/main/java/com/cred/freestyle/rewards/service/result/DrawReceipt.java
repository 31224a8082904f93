package com.cred.freestyle.rewards.service.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
@AllArgsConstructor
public class DrawReceipt {

    private final String activityId;
    private final PrizeView prize;
    private final long pointsSpent;
    private final long newBalance;

    /**
     * Draws left for the account in this activity; null when unlimited.
     */
    private final Integer remainingDraws;
}
