package com.cred.freestyle.rewards.service.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Summary of an account's points activity. Period totals only count earned (positive) points.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public class PointsStats {

    private final String accountId;
    private final long balance;
    private final long redeemedTotal;
    private final int consecutiveCheckInDays;
    private final long totalCheckIns;
    private final long tasksCompleted;
    private final long pointsToday;
    private final long pointsThisWeek;
    private final long pointsThisMonth;
}
