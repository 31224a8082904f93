package com.cred.freestyle.rewards.service.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.List;

@Getter
@Builder
@ToString
@AllArgsConstructor
public class MonthlyCheckInStats {

    private final int year;
    private final int month;
    private final int totalDays;
    private final int checkInDays;

    /**
     * Streak recorded on the last check-in of the month.
     */
    private final int consecutiveDays;
    private final long pointsEarned;
    private final List<LocalDate> checkInDates;
}
