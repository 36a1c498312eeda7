package com.example.zeitpal.organization;

import com.example.zeitpal.leave.engine.JurisdictionRule;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.MonthDay;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class OrganizationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private OrganizationRepository organizationRepository;

    private static String policy(double annualDays, int workDaysPerWeek, int expiryMonth, int expiryDay) {
        return """
            {
              "annualEntitlementDays": %s,
              "carryoverEnabled": true,
              "carryoverMaxDays": 10,
              "carryoverExpiryMonth": %d,
              "carryoverExpiryDay": %d,
              "sickCertificateThresholdDays": 1,
              "fullTimeWeeklyHours": 38.5,
              "workDaysPerWeek": %d
            }
            """.formatted(annualDays, expiryMonth, expiryDay, workDaysPerWeek);
    }

    @Test
    void updatePolicy_persistsPolicy() throws Exception {
        Organization organization = organizationRepository.save(new Organization("ポリシー更新", "DE", null));

        mockMvc.perform(put("/api/organizations/" + organization.getId() + "/policy")
                .contentType(MediaType.APPLICATION_JSON)
                .content(policy(28, 5, 6, 30)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.policy.annualEntitlementDays").value(28.0))
            .andExpect(jsonPath("$.meta.statutoryMinimumDays").value(20.0))
            .andExpect(jsonPath("$.meta.warning").doesNotExist());

        Organization saved = organizationRepository.findById(organization.getId()).orElseThrow();
        assertThat(saved.leavePolicy(JurisdictionRule.GERMANY).carryoverExpiry()).isEqualTo(MonthDay.of(6, 30));
        assertThat(saved.leavePolicy(JurisdictionRule.GERMANY).carryoverMaxDays()).isEqualTo(10.0);
        assertThat(saved.getSickCertificateThresholdDays()).isEqualTo(1.0);
    }

    @Test
    void updatePolicy_withoutThreshold_followsJurisdiction() throws Exception {
        Organization organization = organizationRepository.save(new Organization("Graz GmbH", "AT", null));
        String payload = """
            {
              "annualEntitlementDays": 25,
              "carryoverEnabled": false,
              "carryoverMaxDays": 0,
              "carryoverExpiryMonth": 3,
              "carryoverExpiryDay": 31,
              "fullTimeWeeklyHours": 40
            }
            """;

        mockMvc.perform(put("/api/organizations/" + organization.getId() + "/policy")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.policy.sickCertificateThresholdDays").value(3.0))
            .andExpect(jsonPath("$.meta.statutoryMinimumDays").value(25.0))
            .andExpect(jsonPath("$.meta.warning").doesNotExist());

        assertThat(organizationRepository.findById(organization.getId()).orElseThrow()
                .getSickCertificateThresholdDays()).isNull();
    }

    @Test
    void updatePolicy_belowStatutoryMinimum_warns() throws Exception {
        Organization organization = organizationRepository.save(new Organization("最低日数未満", "DE", null));

        mockMvc.perform(put("/api/organizations/" + organization.getId() + "/policy")
                .contentType(MediaType.APPLICATION_JSON)
                .content(policy(22, 6, 3, 31)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.meta.statutoryMinimumDays").value(24.0))
            .andExpect(jsonPath("$.meta.warning").exists());
    }

    @Test
    void updatePolicy_usesJurisdictionOfOrganization() throws Exception {
        Organization organization = organizationRepository.save(new Organization("Wien GmbH", "AT", null));

        mockMvc.perform(put("/api/organizations/" + organization.getId() + "/policy")
                .contentType(MediaType.APPLICATION_JSON)
                .content(policy(24, 5, 3, 31)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.meta.statutoryMinimumDays").value(25.0))
            .andExpect(jsonPath("$.meta.warning").exists());
    }

    @Test
    void updatePolicy_invalidExpiryDate_isBadRequest() throws Exception {
        Organization organization = organizationRepository.save(new Organization("期限不正", "DE", null));

        mockMvc.perform(put("/api/organizations/" + organization.getId() + "/policy")
                .contentType(MediaType.APPLICATION_JSON)
                .content(policy(30, 5, 2, 31)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false));
    }
}
