package com.example.zeitpal.config;

import com.example.zeitpal.leave.engine.JurisdictionRule;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JurisdictionPropertiesTest {

    private static JurisdictionProperties.Jurisdiction jurisdiction(double minimum, double threshold) {
        JurisdictionProperties.Jurisdiction jurisdiction = new JurisdictionProperties.Jurisdiction();
        jurisdiction.setMinimumForSixDayWeek(minimum);
        jurisdiction.setSickCertificateThresholdDays(threshold);
        return jurisdiction;
    }

    @Test
    void ruleFor_matchesCountryCaseInsensitively() {
        JurisdictionProperties properties = new JurisdictionProperties();
        properties.setJurisdictions(Map.of("DE", jurisdiction(24, 3), "at", jurisdiction(30, 3)));

        assertThat(properties.ruleFor("AT")).isEqualTo(new JurisdictionRule("AT", 30, 3));
        assertThat(properties.ruleFor("de").minimumForSixDayWeek()).isEqualTo(24.0);
    }

    @Test
    void ruleFor_unknownCountry_usesDefaultJurisdiction() {
        JurisdictionProperties properties = new JurisdictionProperties();
        properties.setDefaultJurisdiction("CH");
        properties.setJurisdictions(Map.of("CH", jurisdiction(24, 2)));

        JurisdictionRule rule = properties.ruleFor("FR");
        assertThat(rule.code()).isEqualTo("CH");
        assertThat(rule.sickCertificateThresholdDays()).isEqualTo(2.0);
        assertThat(properties.ruleFor(null).code()).isEqualTo("CH");
    }

    @Test
    void ruleFor_nothingConfigured_fallsBackToGermany() {
        assertThat(new JurisdictionProperties().ruleFor("FR")).isEqualTo(JurisdictionRule.GERMANY);
    }
}
