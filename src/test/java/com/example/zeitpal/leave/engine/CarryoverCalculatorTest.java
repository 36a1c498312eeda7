package com.example.zeitpal.leave.engine;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.MonthDay;

import static org.assertj.core.api.Assertions.assertThat;

class CarryoverCalculatorTest {

    private static final MonthDay END_OF_MARCH = MonthDay.of(3, 31);

    @Test
    void beforeExpiry_isCappedAndActive() {
        CarryoverResult result = CarryoverCalculator.carryover(8, 5, END_OF_MARCH, LocalDate.of(2025, 3, 15));
        assertThat(result.amount()).isEqualTo(5.0);
        assertThat(result.expired()).isFalse();
        assertThat(result.daysUntilExpiry()).isEqualTo(16);
        assertThat(result.expiryDate()).isEqualTo(LocalDate.of(2025, 3, 31));
    }

    @Test
    void belowCap_carriesEverything() {
        assertThat(CarryoverCalculator.carryover(3, 5, END_OF_MARCH, LocalDate.of(2025, 1, 1)).amount())
                .isEqualTo(3.0);
    }

    @Test
    void afterExpiryDayInYear_rollsToNextOccurrence() {
        CarryoverResult result = CarryoverCalculator.carryover(8, 5, END_OF_MARCH, LocalDate.of(2025, 4, 1));
        assertThat(result.expired()).isFalse();
        assertThat(result.expiryDate()).isEqualTo(LocalDate.of(2026, 3, 31));
        assertThat(result.daysUntilExpiry()).isEqualTo(364);
    }

    @Test
    void onExpiryDay_nextOccurrenceIsFollowingYear() {
        CarryoverResult result = CarryoverCalculator.carryover(8, 5, END_OF_MARCH, LocalDate.of(2025, 3, 31));
        assertThat(result.expiryDate()).isEqualTo(LocalDate.of(2026, 3, 31));
        assertThat(result.daysUntilExpiry()).isEqualTo(365);
    }

    @Test
    void pinnedCycle_dayAfterExpiry_isExpired() {
        CarryoverResult result = CarryoverCalculator.carryover(8, 5, END_OF_MARCH, LocalDate.of(2025, 4, 1), 2025);
        assertThat(result.expired()).isTrue();
        assertThat(result.amount()).isZero();
        assertThat(result.daysUntilExpiry()).isZero();
    }

    @Test
    void pinnedCycle_onExpiryDay_isStillActive() {
        CarryoverResult result = CarryoverCalculator.carryover(8, 5, END_OF_MARCH, LocalDate.of(2025, 3, 31), 2025);
        assertThat(result.expired()).isFalse();
        assertThat(result.amount()).isEqualTo(5.0);
        assertThat(result.daysUntilExpiry()).isZero();
    }

    @Test
    void negativeRemainder_carriesNothing() {
        assertThat(CarryoverCalculator.carryover(-2, 5, END_OF_MARCH, LocalDate.of(2025, 1, 1)).amount()).isZero();
    }

    @Test
    void leapDayExpiry_fallsBackInCommonYears() {
        CarryoverResult result = CarryoverCalculator.carryover(4, 5, MonthDay.of(2, 29), LocalDate.of(2025, 1, 1));
        assertThat(result.expiryDate()).isEqualTo(LocalDate.of(2025, 2, 28));
        assertThat(result.daysUntilExpiry()).isEqualTo(58);
    }
}
