package com.cred.freestyle.rewards.domain.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Check-in streak of an account, derived from its latest {@link CheckInRecord}.
 *
 * @author Rewards Team
 */
public final class StreakState {

    public static final int CYCLE_LENGTH = 7;

    private static final StreakState NONE = new StreakState(null, 0);

    private final LocalDate lastCheckInDate;
    private final int consecutiveDays;

    public StreakState(LocalDate lastCheckInDate, int consecutiveDays) {
        if (consecutiveDays < 0) {
            throw new IllegalArgumentException("consecutiveDays must be >= 0");
        }
        this.lastCheckInDate = lastCheckInDate;
        this.consecutiveDays = consecutiveDays;
    }

    public static StreakState none() {
        return NONE;
    }

    public LocalDate getLastCheckInDate() {
        return lastCheckInDate;
    }

    public int getConsecutiveDays() {
        return consecutiveDays;
    }

    public boolean hasCheckedInOn(LocalDate date) {
        return lastCheckInDate != null && lastCheckInDate.equals(date);
    }

    /**
     * Streak length after a check-in on {@code date}: continues from yesterday, otherwise restarts at 1.
     */
    public int nextConsecutiveDays(LocalDate date) {
        if (lastCheckInDate != null && lastCheckInDate.plusDays(1).equals(date)) {
            return consecutiveDays + 1;
        }
        return 1;
    }

    /**
     * Streak as seen on {@code today}: a streak whose last day is before yesterday is already broken.
     */
    public int liveConsecutiveDays(LocalDate today) {
        if (lastCheckInDate == null) {
            return 0;
        }
        if (lastCheckInDate.equals(today) || lastCheckInDate.plusDays(1).equals(today)) {
            return consecutiveDays;
        }
        return 0;
    }

    /**
     * Position in the 7-day display cycle, 1..7, or 0 with no streak.
     */
    public int cycleDay() {
        return cycleDay(consecutiveDays);
    }

    public static int cycleDay(int consecutiveDays) {
        if (consecutiveDays <= 0) {
            return 0;
        }
        return (consecutiveDays - 1) % CYCLE_LENGTH + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StreakState)) return false;
        StreakState that = (StreakState) o;
        return consecutiveDays == that.consecutiveDays && Objects.equals(lastCheckInDate, that.lastCheckInDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lastCheckInDate, consecutiveDays);
    }

    @Override
    public String toString() {
        return "StreakState{lastCheckInDate=" + lastCheckInDate + ", consecutiveDays=" + consecutiveDays + "}";
    }
}
