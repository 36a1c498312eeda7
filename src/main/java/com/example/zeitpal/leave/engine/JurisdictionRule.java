package com.example.zeitpal.leave.engine;

/**
 * 法域ごとの法定定数。
 *
 * @param minimumForSixDayWeek         週6日勤務時の法定最低年休日数
 * @param sickCertificateThresholdDays 診断書なしで連続取得できる病欠日数
 */
public record JurisdictionRule(String code, double minimumForSixDayWeek, double sickCertificateThresholdDays) {

    /** BUrlG: 24 days on a six-day week, certificate from the fourth sick day. */
    public static final JurisdictionRule GERMANY = new JurisdictionRule("DE", 24, 3);
}
