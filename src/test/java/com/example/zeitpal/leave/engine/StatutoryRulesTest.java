package com.example.zeitpal.leave.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StatutoryRulesTest {

    @Test
    void minimumStatutoryLeave_germany() {
        assertThat(StatutoryRules.minimumStatutoryLeave(5)).isEqualTo(20.0);
        assertThat(StatutoryRules.minimumStatutoryLeave(6)).isEqualTo(24.0);
        assertThat(StatutoryRules.minimumStatutoryLeave(4)).isEqualTo(16.0);
    }

    @Test
    void minimumStatutoryLeave_usesJurisdictionConstant() {
        JurisdictionRule austria = new JurisdictionRule("AT", 30, 3);
        assertThat(StatutoryRules.minimumStatutoryLeave(5, austria)).isEqualTo(25.0);
        // 21 / 6 * 1 = 3.5 -> 4
        assertThat(StatutoryRules.minimumStatutoryLeave(1, new JurisdictionRule("XX", 21, 3))).isEqualTo(4.0);
    }

    @Test
    void requiresCertificate_strictlyAboveThreshold() {
        assertThat(StatutoryRules.requiresCertificate(3, 3)).isFalse();
        assertThat(StatutoryRules.requiresCertificate(4, 3)).isTrue();
        assertThat(StatutoryRules.requiresCertificate(4, JurisdictionRule.GERMANY)).isTrue();
    }
}
