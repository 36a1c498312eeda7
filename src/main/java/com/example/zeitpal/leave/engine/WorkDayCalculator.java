package com.example.zeitpal.leave.engine;

import com.example.zeitpal.calendar.CalendarUtils;
import com.example.zeitpal.calendar.DateRange;
import com.example.zeitpal.calendar.HalfDayMarker;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Sizes a leave request in work days.
 * <p>
 * Weekend days and holidays count 0. A single-day request with any half-day
 * marker counts 0.5; on a longer request the markers halve only the first or
 * last day. A marker on a day that is already non-working has no effect.
 * An inverted range counts 0.
 */
public final class WorkDayCalculator {

    private WorkDayCalculator() {
    }

    public static double workDays(DateRange range,
                                  Set<LocalDate> holidays,
                                  HalfDayMarker startHalfDay,
                                  HalfDayMarker endHalfDay) {
        List<LocalDate> days = range.days();
        if (days.isEmpty()) {
            return 0;
        }
        boolean startHalf = HalfDayMarker.orNone(startHalfDay).isSet();
        boolean endHalf = HalfDayMarker.orNone(endHalfDay).isSet();
        boolean singleDay = days.size() == 1;

        double total = 0;
        for (int i = 0; i < days.size(); i++) {
            LocalDate day = days.get(i);
            if (!CalendarUtils.isWorkingDay(day, holidays)) {
                continue;
            }
            boolean first = i == 0;
            boolean last = i == days.size() - 1;
            if (singleDay) {
                total += (startHalf || endHalf) ? 0.5 : 1;
            } else if ((first && startHalf) || (last && endHalf)) {
                total += 0.5;
            } else {
                total += 1;
            }
        }
        return total;
    }

    public static double workDays(LeaveRequestSpan span, Set<LocalDate> holidays) {
        return workDays(span.range(), holidays, span.startHalfDay(), span.endHalfDay());
    }

    public static double workDays(DateRange range, Set<LocalDate> holidays) {
        return workDays(range, holidays, HalfDayMarker.NONE, HalfDayMarker.NONE);
    }
}
