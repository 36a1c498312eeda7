package com.example.zeitpal.leave.engine;

import com.example.zeitpal.calendar.DateRange;
import com.example.zeitpal.calendar.HalfDayMarker;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Set;

import static com.example.zeitpal.calendar.HalfDayMarker.AFTERNOON;
import static com.example.zeitpal.calendar.HalfDayMarker.MORNING;
import static com.example.zeitpal.calendar.HalfDayMarker.NONE;
import static org.assertj.core.api.Assertions.assertThat;

class WorkDayCalculatorTest {

    private static DateRange range(String start, String end) {
        return DateRange.of(LocalDate.parse(start), LocalDate.parse(end));
    }

    @Test
    void newYearWeek_excludesHolidayAndWeekend() {
        double days = WorkDayCalculator.workDays(range("2024-01-01", "2024-01-07"),
                Set.of(LocalDate.parse("2024-01-01")), NONE, NONE);
        assertThat(days).isEqualTo(4.0);
    }

    @Test
    void singleHalfDay_countsHalf() {
        assertThat(WorkDayCalculator.workDays(range("2024-03-04", "2024-03-04"), Set.of(), MORNING, NONE))
                .isEqualTo(0.5);
        assertThat(WorkDayCalculator.workDays(range("2024-03-04", "2024-03-04"), Set.of(), NONE, AFTERNOON))
                .isEqualTo(0.5);
        assertThat(WorkDayCalculator.workDays(range("2024-03-04", "2024-03-04"), Set.of(), MORNING, AFTERNOON))
                .isEqualTo(0.5);
    }

    @Test
    void invertedRange_isZero() {
        assertThat(WorkDayCalculator.workDays(range("2024-03-08", "2024-03-04"), Set.of(), MORNING, MORNING))
                .isZero();
    }

    @Test
    void weekendOnly_isZeroRegardlessOfMarkers() {
        for (HalfDayMarker start : HalfDayMarker.values()) {
            for (HalfDayMarker end : HalfDayMarker.values()) {
                assertThat(WorkDayCalculator.workDays(range("2024-01-06", "2024-01-06"), Set.of(), start, end))
                        .isZero();
                assertThat(WorkDayCalculator.workDays(range("2024-01-06", "2024-01-07"), Set.of(), start, end))
                        .isZero();
            }
        }
    }

    @Test
    void multiDay_halvesOnlyMarkedBoundaries() {
        DateRange week = range("2024-03-04", "2024-03-08");
        assertThat(WorkDayCalculator.workDays(week, Set.of(), NONE, NONE)).isEqualTo(5.0);
        assertThat(WorkDayCalculator.workDays(week, Set.of(), AFTERNOON, NONE)).isEqualTo(4.5);
        assertThat(WorkDayCalculator.workDays(week, Set.of(), NONE, MORNING)).isEqualTo(4.5);
        assertThat(WorkDayCalculator.workDays(week, Set.of(), AFTERNOON, MORNING)).isEqualTo(4.0);
    }

    @Test
    void markerOnNonWorkingBoundary_hasNoEffect() {
        // 土曜開始・祝日終了
        DateRange range = range("2024-03-02", "2024-03-06");
        Set<LocalDate> holidays = Set.of(LocalDate.parse("2024-03-06"));
        assertThat(WorkDayCalculator.workDays(range, holidays, MORNING, AFTERNOON)).isEqualTo(2.0);
    }

    @Test
    void rangeAcrossYearBoundary_usesHolidaysOfBothYears() {
        DateRange range = range("2024-12-30", "2025-01-02");
        Set<LocalDate> holidays = Set.of(LocalDate.parse("2025-01-01"));
        assertThat(WorkDayCalculator.workDays(range, holidays)).isEqualTo(3.0);
    }

    @Test
    void spanOverload_matchesExplicitArguments() {
        LeaveRequestSpan span = new LeaveRequestSpan(range("2024-03-04", "2024-03-05"), null, AFTERNOON);
        assertThat(span.startHalfDay()).isEqualTo(NONE);
        assertThat(WorkDayCalculator.workDays(span, Set.of())).isEqualTo(1.5);
    }
}
