package com.example.zeitpal.leave.engine;

/**
 * Statutory minimum leave and sick-certificate trigger, parameterised by jurisdiction.
 */
public final class StatutoryRules {

    private static final int SIX_DAY_WEEK = 6;

    private StatutoryRules() {
    }

    public static double minimumStatutoryLeave(double workDaysPerWeek, JurisdictionRule rule) {
        return LeaveRounding.toWholeDay(rule.minimumForSixDayWeek() / SIX_DAY_WEEK * workDaysPerWeek);
    }

    public static double minimumStatutoryLeave(double workDaysPerWeek) {
        return minimumStatutoryLeave(workDaysPerWeek, JurisdictionRule.GERMANY);
    }

    /**
     * A run exactly as long as the threshold does not yet need a certificate.
     */
    public static boolean requiresCertificate(double consecutiveSickDays, double thresholdDays) {
        return consecutiveSickDays > thresholdDays;
    }

    public static boolean requiresCertificate(double consecutiveSickDays, JurisdictionRule rule) {
        return requiresCertificate(consecutiveSickDays, rule.sickCertificateThresholdDays());
    }
}
