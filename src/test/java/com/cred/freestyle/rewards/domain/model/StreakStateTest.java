package com.cred.freestyle.rewards.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StreakState.
 */
@DisplayName("StreakState Domain Model Tests")
class StreakStateTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 10);

    @Test
    @DisplayName("A check-in the day after the last one continues the streak")
    void nextConsecutiveDays_ContinuesFromYesterday() {
        // Given
        StreakState streak = new StreakState(TODAY.minusDays(1), 4);

        // When / Then
        assertThat(streak.nextConsecutiveDays(TODAY)).isEqualTo(5);
    }

    @Test
    @DisplayName("A gap of one or more days restarts the streak at 1")
    void nextConsecutiveDays_RestartsAfterGap() {
        StreakState streak = new StreakState(TODAY.minusDays(2), 6);

        assertThat(streak.nextConsecutiveDays(TODAY)).isEqualTo(1);
    }

    @Test
    @DisplayName("No previous check-in starts at day 1")
    void nextConsecutiveDays_NoHistory() {
        assertThat(StreakState.none().nextConsecutiveDays(TODAY)).isEqualTo(1);
        assertThat(StreakState.none().getLastCheckInDate()).isNull();
    }

    @Test
    @DisplayName("Live streak survives until the end of the following day")
    void liveConsecutiveDays() {
        StreakState streak = new StreakState(TODAY, 3);

        assertThat(streak.liveConsecutiveDays(TODAY)).isEqualTo(3);
        assertThat(streak.liveConsecutiveDays(TODAY.plusDays(1))).isEqualTo(3);
        assertThat(streak.liveConsecutiveDays(TODAY.plusDays(2))).isZero();
        assertThat(StreakState.none().liveConsecutiveDays(TODAY)).isZero();
    }

    @Test
    @DisplayName("Cycle day wraps every seven days")
    void cycleDay_Wraps() {
        assertThat(StreakState.cycleDay(0)).isZero();
        assertThat(StreakState.cycleDay(1)).isEqualTo(1);
        assertThat(StreakState.cycleDay(7)).isEqualTo(7);
        assertThat(StreakState.cycleDay(8)).isEqualTo(1);
        assertThat(StreakState.cycleDay(15)).isEqualTo(1);
        assertThat(new StreakState(TODAY, 13).cycleDay()).isEqualTo(6);
    }

    @Test
    @DisplayName("Negative streak length is rejected")
    void negativeConsecutiveDays_Throws() {
        assertThatThrownBy(() -> new StreakState(TODAY, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
