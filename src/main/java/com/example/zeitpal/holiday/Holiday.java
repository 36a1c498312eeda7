package com.example.zeitpal.holiday;

import jakarta.persistence.*;

import java.time.LocalDate;
import java.util.Locale;

/**
 * 祝日。地域コードなしは全国祝日、ありは州・地域限定の祝日。
 * 組織IDを持つものはその組織独自の休業日。
 */
@Entity
@Table(name = "holidays",
        uniqueConstraints = @UniqueConstraint(columnNames = {"holiday_date", "country_code", "region_code", "organization_id"}))
public class Holiday {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "holiday_date", nullable = false)
    private LocalDate date;

    @Column(name = "name", nullable = false, length = 64)
    private String name;

    @Column(name = "country_code", nullable = false, length = 8)
    private String countryCode;

    @Column(name = "region_code", length = 8)
    private String regionCode;

    @Column(name = "organization_id")
    private Long organizationId;

    protected Holiday() {}

    public Holiday(LocalDate date, String name, String countryCode) {
        this(date, name, countryCode, null);
    }

    public Holiday(LocalDate date, String name, String countryCode, String regionCode) {
        this.date = date;
        this.name = normalizeName(name);
        this.countryCode = normalizeCode(countryCode);
        this.regionCode = normalizeCode(regionCode);
    }

    public Long getId() { return id; }
    public LocalDate getDate() { return date; }
    public void setDate(LocalDate date) { this.date = date; }
    public String getName() { return name; }
    public void setName(String name) { this.name = normalizeName(name); }
    public String getCountryCode() { return countryCode; }
    public void setCountryCode(String countryCode) { this.countryCode = normalizeCode(countryCode); }
    public String getRegionCode() { return regionCode; }
    public void setRegionCode(String regionCode) { this.regionCode = normalizeCode(regionCode); }
    public Long getOrganizationId() { return organizationId; }
    public void setOrganizationId(Long organizationId) { this.organizationId = organizationId; }

    @PrePersist
    @PreUpdate
    void ensureName() {
        this.name = normalizeName(this.name);
    }

    private String normalizeName(String value) {
        if (value == null || value.isBlank()) {
            return "Feiertag";
        }
        return value.trim();
    }

    static String normalizeCode(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toUpperCase(Locale.ROOT);
    }
}
