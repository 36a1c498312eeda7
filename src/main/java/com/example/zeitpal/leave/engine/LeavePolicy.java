package com.example.zeitpal.leave.engine;

import java.time.MonthDay;

/**
 * 組織の休暇ポリシー。計算エンジンには読み取り専用で渡される。
 */
public record LeavePolicy(double annualEntitlementDays,
                          boolean carryoverEnabled,
                          double carryoverMaxDays,
                          MonthDay carryoverExpiry,
                          double sickCertificateThresholdDays,
                          double fullTimeWeeklyHours) {

    public static final MonthDay DEFAULT_CARRYOVER_EXPIRY = MonthDay.of(3, 31);

    public static final LeavePolicy DEFAULT = new LeavePolicy(30, true, 5, DEFAULT_CARRYOVER_EXPIRY,
            JurisdictionRule.GERMANY.sickCertificateThresholdDays(), 40);

    public LeavePolicy {
        if (carryoverExpiry == null) {
            carryoverExpiry = DEFAULT_CARRYOVER_EXPIRY;
        }
    }

    /** 年間付与日数だけを差し替えたポリシー (種別ごとの付与日数用)。 */
    public LeavePolicy withAnnualEntitlementDays(double days) {
        return new LeavePolicy(days, carryoverEnabled, carryoverMaxDays, carryoverExpiry,
                sickCertificateThresholdDays, fullTimeWeeklyHours);
    }
}
