package com.example.zeitpal.leave.engine;

import java.time.LocalDate;
import java.time.MonthDay;
import java.time.temporal.ChronoUnit;

/**
 * Computes how many unused days roll into the next period and when they lapse.
 * Pure: applying the result to a stored balance is the caller's job.
 */
public final class CarryoverCalculator {

    private CarryoverCalculator() {
    }

    /**
     * Carryover against the next occurrence of {@code expiry}: this calendar year when
     * the as-of month/day lies strictly before it, otherwise next year.
     */
    public static CarryoverResult carryover(double remainingDaysAtYearEnd,
                                            double maxCarryoverDays,
                                            MonthDay expiry,
                                            LocalDate asOfDate) {
        int expiryYear = MonthDay.from(asOfDate).isBefore(expiry)
                ? asOfDate.getYear()
                : asOfDate.getYear() + 1;
        return carryover(remainingDaysAtYearEnd, maxCarryoverDays, expiry, asOfDate, expiryYear);
    }

    /**
     * Carryover for a cycle whose expiry is {@code expiry} in {@code expiryYear}.
     * An as-of date after that day yields an expired result with amount 0.
     * 2/29 expiries fall back to 2/28 in common years.
     */
    public static CarryoverResult carryover(double remainingDaysAtYearEnd,
                                            double maxCarryoverDays,
                                            MonthDay expiry,
                                            LocalDate asOfDate,
                                            int expiryYear) {
        LocalDate expiryDate = expiry.atYear(expiryYear);
        long rawDays = ChronoUnit.DAYS.between(asOfDate, expiryDate);
        boolean expired = rawDays < 0;
        double capped = Math.max(0, Math.min(remainingDaysAtYearEnd, maxCarryoverDays));
        return new CarryoverResult(expired ? 0 : capped, Math.max(0, rawDays), expired, expiryDate);
    }
}
