package com.example.zeitpal.leave;

import com.example.zeitpal.calendar.DateRange;
import com.example.zeitpal.calendar.HalfDayMarker;
import com.example.zeitpal.employee.Employee;
import com.example.zeitpal.leave.engine.LeaveRequestSpan;
import jakarta.persistence.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

@Entity
@Table(name = "leave_requests")
public class LeaveRequest {
    public enum Status { PENDING, APPROVED, REJECTED, WITHDRAWN, CANCELLED }

    /** 重複チェックの対象となる状態。 */
    public static final Set<Status> BLOCKING = EnumSet.of(Status.PENDING, Status.APPROVED);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "employee_id", nullable = false)
    private Employee employee;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "leave_type_id", nullable = false)
    private LeaveType leaveType;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "start_half_day", nullable = false)
    private HalfDayMarker startHalfDay = HalfDayMarker.NONE;

    @Enumerated(EnumType.STRING)
    @Column(name = "end_half_day", nullable = false)
    private HalfDayMarker endHalfDay = HalfDayMarker.NONE;

    @Column(name = "work_days", nullable = false)
    private Double workDays = 0.0;

    @Column(name = "reason", length = 500)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private Status status = Status.PENDING;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    protected LeaveRequest() {}

    public LeaveRequest(Employee employee, LeaveType leaveType, LeaveRequestSpan span, double workDays) {
        this.employee = employee;
        this.leaveType = leaveType;
        this.startDate = span.range().start();
        this.endDate = span.range().end();
        this.startHalfDay = span.startHalfDay();
        this.endHalfDay = span.endHalfDay();
        this.workDays = workDays;
    }

    @PrePersist
    protected void onCreate() { this.createdAt = LocalDateTime.now(); this.updatedAt = LocalDateTime.now(); }
    @PreUpdate
    protected void onUpdate() { this.updatedAt = LocalDateTime.now(); }

    public DateRange range() {
        return new DateRange(startDate, endDate);
    }

    public LeaveRequestSpan span() {
        return new LeaveRequestSpan(range(), startHalfDay, endHalfDay);
    }

    /** 残高を計上する年度 (開始日の年)。 */
    public int accountingYear() {
        return startDate.getYear();
    }

    public Long getId() { return id; }
    public Employee getEmployee() { return employee; }
    public LeaveType getLeaveType() { return leaveType; }
    public LocalDate getStartDate() { return startDate; }
    public LocalDate getEndDate() { return endDate; }
    public HalfDayMarker getStartHalfDay() { return startHalfDay; }
    public HalfDayMarker getEndHalfDay() { return endHalfDay; }
    public Double getWorkDays() { return workDays; }
    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }
    public Status getStatus() { return status; }
    public void setStatus(Status status) { this.status = status; }
    public LocalDateTime getCreatedAt() { return createdAt; }
}
