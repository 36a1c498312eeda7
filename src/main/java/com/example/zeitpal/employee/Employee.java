package com.example.zeitpal.employee;

import com.example.zeitpal.organization.Organization;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "employees")
public class Employee {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    @NotBlank(message = "従業員名は必須です")
    @Size(min = 1, max = 50, message = "従業員名は1文字以上50文字以下で入力してください")
    private String name;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "organization_id", nullable = false)
    private Organization organization;

    @Column(name = "employment_start_date")
    private LocalDate employmentStartDate;

    // null はフルタイム扱い
    @Column(name = "weekly_hours")
    private Double weeklyHours;

    @Column(name = "work_days_per_week")
    private Integer workDaysPerWeek = 5;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    protected Employee() {
    }

    public Employee(String name, Organization organization, LocalDate employmentStartDate) {
        this.name = name;
        this.organization = organization;
        this.employmentStartDate = employmentStartDate;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public Long getId() { return id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Organization getOrganization() { return organization; }
    public void setOrganization(Organization organization) { this.organization = organization; }
    public LocalDate getEmploymentStartDate() { return employmentStartDate; }
    public void setEmploymentStartDate(LocalDate employmentStartDate) { this.employmentStartDate = employmentStartDate; }
    public Double getWeeklyHours() { return weeklyHours; }
    public void setWeeklyHours(Double weeklyHours) { this.weeklyHours = weeklyHours; }
    public Integer getWorkDaysPerWeek() { return workDaysPerWeek; }
    public void setWorkDaysPerWeek(Integer workDaysPerWeek) { this.workDaysPerWeek = workDaysPerWeek; }
    public LocalDateTime getCreatedAt() { return createdAt; }
}
