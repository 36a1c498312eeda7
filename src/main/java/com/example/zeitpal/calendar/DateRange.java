package com.example.zeitpal.calendar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Inclusive calendar-date range. A range whose start lies after its end is
 * degenerate: it is empty, not invalid.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("開始日と終了日は必須です");
        }
    }

    public static DateRange of(LocalDate start, LocalDate end) {
        return new DateRange(start, end);
    }

    public static DateRange singleDay(LocalDate date) {
        return new DateRange(date, date);
    }

    public boolean isDegenerate() {
        return start.isAfter(end);
    }

    public boolean isSingleDay() {
        return start.equals(end);
    }

    public boolean contains(LocalDate date) {
        return date != null && !isDegenerate() && !date.isBefore(start) && !date.isAfter(end);
    }

    /**
     * Every calendar day in the range, in order. Empty for a degenerate range.
     */
    public List<LocalDate> days() {
        if (isDegenerate()) {
            return Collections.emptyList();
        }
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate day = start; !day.isAfter(end); day = day.plusDays(1)) {
            days.add(day);
        }
        return days;
    }
}
