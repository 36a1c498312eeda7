package com.example.zeitpal.leave.engine;

import com.example.zeitpal.calendar.DateRange;

import java.util.Collection;
import java.util.Optional;
import java.util.function.Function;

/**
 * Conflict checks between inclusive date ranges. Ranges touching on a boundary
 * day overlap; a one-day gap does not.
 */
public final class OverlapDetector {

    private OverlapDetector() {
    }

    public static boolean overlaps(DateRange a, DateRange b) {
        return !a.start().isAfter(b.end()) && !a.end().isBefore(b.start());
    }

    /**
     * First element of {@code existing} whose range overlaps {@code candidate}.
     */
    public static <T> Optional<T> firstConflict(DateRange candidate,
                                                Collection<T> existing,
                                                Function<T, DateRange> rangeOf) {
        return existing.stream()
                .filter(item -> overlaps(candidate, rangeOf.apply(item)))
                .findFirst();
    }
}
