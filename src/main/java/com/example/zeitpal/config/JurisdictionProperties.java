package com.example.zeitpal.config;

import com.example.zeitpal.leave.engine.JurisdictionRule;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 国・地域ごとの法定休暇ルール。
 * <pre>
 * zeitpal.jurisdictions.DE.minimum-for-six-day-week=24
 * zeitpal.jurisdictions.DE.sick-certificate-threshold-days=3
 * </pre>
 * 国を追加する場合は設定を増やすだけでよく、計算ロジックには手を入れない。
 */
@ConfigurationProperties(prefix = "zeitpal")
public class JurisdictionProperties {

    private String defaultJurisdiction = "DE";

    private Map<String, Jurisdiction> jurisdictions = new LinkedHashMap<>();

    public String getDefaultJurisdiction() { return defaultJurisdiction; }
    public void setDefaultJurisdiction(String defaultJurisdiction) { this.defaultJurisdiction = defaultJurisdiction; }
    public Map<String, Jurisdiction> getJurisdictions() { return jurisdictions; }
    public void setJurisdictions(Map<String, Jurisdiction> jurisdictions) { this.jurisdictions = jurisdictions; }

    /**
     * Resolves the rule for a country code, falling back to the default jurisdiction
     * and finally to the built-in German rule when nothing is configured.
     */
    public JurisdictionRule ruleFor(String countryCode) {
        Jurisdiction found = find(countryCode);
        String code = countryCode;
        if (found == null) {
            found = find(defaultJurisdiction);
            code = defaultJurisdiction;
        }
        if (found == null) {
            return JurisdictionRule.GERMANY;
        }
        return new JurisdictionRule(code.trim().toUpperCase(Locale.ROOT), found.getMinimumForSixDayWeek(),
                found.getSickCertificateThresholdDays());
    }

    // キーの大文字小文字はバインド元に依存するため区別しない
    private Jurisdiction find(String code) {
        if (code == null) {
            return null;
        }
        return jurisdictions.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(code.trim()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }

    public static class Jurisdiction {
        private double minimumForSixDayWeek = 24;
        private double sickCertificateThresholdDays = 3;

        public double getMinimumForSixDayWeek() { return minimumForSixDayWeek; }
        public void setMinimumForSixDayWeek(double minimumForSixDayWeek) { this.minimumForSixDayWeek = minimumForSixDayWeek; }
        public double getSickCertificateThresholdDays() { return sickCertificateThresholdDays; }
        public void setSickCertificateThresholdDays(double sickCertificateThresholdDays) { this.sickCertificateThresholdDays = sickCertificateThresholdDays; }
    }
}
