package com.cred.freestyle.rewards.service.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * Result of a committed check-in.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public class CheckInReceipt {

    private final LocalDate checkInDate;
    private final long pointsEarned;
    private final int consecutiveDays;

    /**
     * Day of the 7-day display cycle, 1..7.
     */
    private final int cycleDay;
    private final long newBalance;
    private final Long ledgerEntryId;
}
