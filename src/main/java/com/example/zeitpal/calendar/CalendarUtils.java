package com.example.zeitpal.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Weekend and holiday lookups shared by the leave calculators.
 * Saturday and Sunday are weekend days regardless of locale.
 */
public final class CalendarUtils {

    private CalendarUtils() {
    }

    public static boolean isWeekend(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
    }

    public static boolean isHoliday(LocalDate date, Set<LocalDate> holidays) {
        return holidays != null && holidays.contains(date);
    }

    public static boolean isWorkingDay(LocalDate date, Set<LocalDate> holidays) {
        return !isWeekend(date) && !isHoliday(date, holidays);
    }

    /**
     * First working day strictly after {@code date}.
     */
    public static LocalDate nextWorkingDay(LocalDate date, Set<LocalDate> holidays) {
        LocalDate current = date.plusDays(1);
        while (!isWorkingDay(current, holidays)) {
            current = current.plusDays(1);
        }
        return current;
    }

    /**
     * Calendar years touched by the range, so callers can load one holiday set per year.
     */
    public static Set<Integer> yearsSpanned(DateRange range) {
        if (range.isDegenerate()) {
            return Collections.emptySet();
        }
        Set<Integer> years = new LinkedHashSet<>();
        for (int year = range.start().getYear(); year <= range.end().getYear(); year++) {
            years.add(year);
        }
        return years;
    }
}
