package com.example.zeitpal.leave.engine;

import java.time.LocalDate;

/**
 * Annual entitlement adjusted for a partial first year and for part-time hours.
 * <p>
 * When both adjustments apply, the start-date pro-ration runs first and the
 * part-time ratio is applied to its rounded result. Each step rounds to the
 * nearest half day, so the two orders can differ by half a day; this order is
 * the only one used.
 */
public final class EntitlementCalculator {

    private static final int MONTHS_PER_YEAR = 12;

    private EntitlementCalculator() {
    }

    /**
     * Entitlement for {@code year} of an employee who started on {@code employmentStartDate}.
     * The start month counts as a full month worked.
     */
    public static double proRataEntitlement(LocalDate employmentStartDate, double annualDays, int year) {
        LocalDate yearStart = LocalDate.of(year, 1, 1);
        LocalDate yearEnd = LocalDate.of(year, 12, 31);
        if (employmentStartDate == null || employmentStartDate.isBefore(yearStart)) {
            return annualDays;
        }
        if (employmentStartDate.isAfter(yearEnd)) {
            return 0;
        }
        int monthsRemaining = MONTHS_PER_YEAR - (employmentStartDate.getMonthValue() - 1);
        return LeaveRounding.toHalfDay(annualDays / MONTHS_PER_YEAR * monthsRemaining);
    }

    /**
     * Scales a full-time entitlement by {@code weeklyHours / fullTimeHours}.
     * A non-positive full-time reference leaves the entitlement unchanged.
     */
    public static double partTimeProRata(double weeklyHours, double fullTimeDays, double fullTimeHours) {
        if (fullTimeHours <= 0) {
            return fullTimeDays;
        }
        return LeaveRounding.toHalfDay(fullTimeDays * weeklyHours / fullTimeHours);
    }

    /**
     * Entitlement for one employee and year under {@code policy}: start-date pro-ration,
     * then part-time scaling when {@code weeklyHours} is given.
     */
    public static double annualEntitlement(LocalDate employmentStartDate,
                                           Double weeklyHours,
                                           LeavePolicy policy,
                                           int year) {
        double byStartDate = proRataEntitlement(employmentStartDate, policy.annualEntitlementDays(), year);
        if (weeklyHours == null) {
            return byStartDate;
        }
        return partTimeProRata(weeklyHours, byStartDate, policy.fullTimeWeeklyHours());
    }
}
