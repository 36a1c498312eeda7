package com.example.zeitpal.organization;

import com.example.zeitpal.leave.engine.JurisdictionRule;
import com.example.zeitpal.leave.engine.LeavePolicy;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;
import java.time.MonthDay;

/**
 * 組織。所在国・地域 (祝日カレンダーの選択に使う) と休暇ポリシーを持つ。
 */
@Entity
@Table(name = "organizations")
public class Organization {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    @NotBlank(message = "組織名は必須です")
    @Size(max = 100, message = "組織名は100文字以下で入力してください")
    private String name;

    @Column(name = "country_code", nullable = false, length = 8)
    private String countryCode = "DE";

    @Column(name = "region_code", length = 8)
    private String regionCode;

    @Column(name = "annual_entitlement_days")
    private Double annualEntitlementDays = 30.0;

    @Column(name = "carryover_enabled")
    private Boolean carryoverEnabled = true;

    @Column(name = "carryover_max_days")
    private Double carryoverMaxDays = 5.0;

    @Column(name = "carryover_expiry_month")
    private Integer carryoverExpiryMonth = 3;

    @Column(name = "carryover_expiry_day")
    private Integer carryoverExpiryDay = 31;

    // 未設定なら所在国の法定値に従う
    @Column(name = "sick_certificate_threshold_days")
    private Double sickCertificateThresholdDays;

    @Column(name = "full_time_weekly_hours")
    private Double fullTimeWeeklyHours = 40.0;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    protected Organization() {
    }

    public Organization(String name, String countryCode, String regionCode) {
        this.name = name;
        this.countryCode = countryCode;
        this.regionCode = regionCode;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    /**
     * 計算エンジンに渡す読み取り専用のポリシー。未設定の項目は既定値で、
     * 診断書要否の日数は所在国のルールで補う。
     */
    public LeavePolicy leavePolicy(JurisdictionRule jurisdiction) {
        LeavePolicy d = LeavePolicy.DEFAULT;
        MonthDay expiry = carryoverExpiryMonth == null || carryoverExpiryDay == null
                ? d.carryoverExpiry()
                : MonthDay.of(carryoverExpiryMonth, carryoverExpiryDay);
        return new LeavePolicy(
                annualEntitlementDays != null ? annualEntitlementDays : d.annualEntitlementDays(),
                carryoverEnabled != null ? carryoverEnabled : d.carryoverEnabled(),
                carryoverMaxDays != null ? carryoverMaxDays : d.carryoverMaxDays(),
                expiry,
                sickCertificateThresholdDays != null
                        ? sickCertificateThresholdDays
                        : jurisdiction.sickCertificateThresholdDays(),
                fullTimeWeeklyHours != null ? fullTimeWeeklyHours : d.fullTimeWeeklyHours());
    }

    public void applyPolicy(LeavePolicy policy) {
        this.annualEntitlementDays = policy.annualEntitlementDays();
        this.carryoverEnabled = policy.carryoverEnabled();
        this.carryoverMaxDays = policy.carryoverMaxDays();
        this.carryoverExpiryMonth = policy.carryoverExpiry().getMonthValue();
        this.carryoverExpiryDay = policy.carryoverExpiry().getDayOfMonth();
        this.fullTimeWeeklyHours = policy.fullTimeWeeklyHours();
    }

    public Long getId() { return id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getCountryCode() { return countryCode; }
    public void setCountryCode(String countryCode) { this.countryCode = countryCode; }
    public String getRegionCode() { return regionCode; }
    public void setRegionCode(String regionCode) { this.regionCode = regionCode; }
    public Double getSickCertificateThresholdDays() { return sickCertificateThresholdDays; }
    public void setSickCertificateThresholdDays(Double sickCertificateThresholdDays) { this.sickCertificateThresholdDays = sickCertificateThresholdDays; }
    public LocalDateTime getCreatedAt() { return createdAt; }
}
