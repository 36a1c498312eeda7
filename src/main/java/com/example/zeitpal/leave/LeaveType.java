package com.example.zeitpal.leave;

import com.example.zeitpal.organization.Organization;
import jakarta.persistence.*;

import java.time.LocalDateTime;

/**
 * 休暇種別。organization が null のものはシステム既定で、全組織から参照できる。
 * 組織は同じコードの種別を登録して既定を上書きできる。
 */
@Entity
@Table(name = "leave_types",
        uniqueConstraints = @UniqueConstraint(columnNames = {"organization_id", "code"}))
public class LeaveType {

    public static final String VACATION = "VACATION";
    public static final String SICK = "SICK";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "organization_id")
    private Organization organization;

    @Column(nullable = false, length = 30)
    private String code;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "is_paid")
    private Boolean paid = true;

    // 年間付与日数を持ち、残高から差し引く種別
    @Column(name = "has_allowance")
    private Boolean hasAllowance = false;

    // null は組織ポリシーの年休日数
    @Column(name = "default_days_per_year")
    private Double defaultDaysPerYear;

    @Column(name = "allow_negative")
    private Boolean allowNegative = false;

    @Column(name = "allow_half_days")
    private Boolean allowHalfDays = true;

    @Column(name = "requires_document")
    private Boolean requiresDocument = false;

    // null は所在国の診断書要否日数
    @Column(name = "document_required_after_days")
    private Integer documentRequiredAfterDays;

    @Column(name = "allow_carryover")
    private Boolean allowCarryover = false;

    // null は組織ポリシーの繰越上限
    @Column(name = "max_carryover_days")
    private Double maxCarryoverDays;

    @Column(name = "sort_order")
    private Integer sortOrder = 0;

    @Column(name = "is_active")
    private Boolean active = true;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    protected LeaveType() {
    }

    public LeaveType(Organization organization, String code, String name) {
        this.organization = organization;
        this.code = normalizeCode(code);
        this.name = name;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public static String normalizeCode(String code) {
        return code == null ? null : code.trim().toUpperCase();
    }

    public boolean isSystemDefault() {
        return organization == null;
    }

    public boolean hasAllowance() { return Boolean.TRUE.equals(hasAllowance); }
    public boolean allowsNegative() { return Boolean.TRUE.equals(allowNegative); }
    public boolean allowsHalfDays() { return !Boolean.FALSE.equals(allowHalfDays); }
    public boolean requiresDocument() { return Boolean.TRUE.equals(requiresDocument); }
    public boolean allowsCarryover() { return Boolean.TRUE.equals(allowCarryover); }
    public boolean isActive() { return !Boolean.FALSE.equals(active); }

    public Long getId() { return id; }
    public Organization getOrganization() { return organization; }
    public String getCode() { return code; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Boolean getPaid() { return paid; }
    public void setPaid(Boolean paid) { this.paid = paid; }
    public void setHasAllowance(Boolean hasAllowance) { this.hasAllowance = hasAllowance; }
    public Double getDefaultDaysPerYear() { return defaultDaysPerYear; }
    public void setDefaultDaysPerYear(Double defaultDaysPerYear) { this.defaultDaysPerYear = defaultDaysPerYear; }
    public void setAllowNegative(Boolean allowNegative) { this.allowNegative = allowNegative; }
    public void setAllowHalfDays(Boolean allowHalfDays) { this.allowHalfDays = allowHalfDays; }
    public void setRequiresDocument(Boolean requiresDocument) { this.requiresDocument = requiresDocument; }
    public Integer getDocumentRequiredAfterDays() { return documentRequiredAfterDays; }
    public void setDocumentRequiredAfterDays(Integer documentRequiredAfterDays) { this.documentRequiredAfterDays = documentRequiredAfterDays; }
    public void setAllowCarryover(Boolean allowCarryover) { this.allowCarryover = allowCarryover; }
    public Double getMaxCarryoverDays() { return maxCarryoverDays; }
    public void setMaxCarryoverDays(Double maxCarryoverDays) { this.maxCarryoverDays = maxCarryoverDays; }
    public Integer getSortOrder() { return sortOrder; }
    public void setSortOrder(Integer sortOrder) { this.sortOrder = sortOrder; }
    public void setActive(Boolean active) { this.active = active; }
    public LocalDateTime getCreatedAt() { return createdAt; }
}
