package com.example.zeitpal.leave;

import com.example.zeitpal.employee.Employee;
import com.example.zeitpal.leave.engine.BalanceAggregator;
import com.example.zeitpal.leave.engine.LeaveBalanceSnapshot;
import jakarta.persistence.*;

import java.time.LocalDateTime;

/**
 * 従業員 x 休暇種別 x 年度の休暇残高。単位は勤務日 (0.5 刻み)。
 * 残数は保持せず、{@link #remaining()} で都度算出する。
 */
@Entity
@Table(name = "leave_balances",
        uniqueConstraints = @UniqueConstraint(columnNames = {"employee_id", "leave_type_id", "accounting_year"}))
public class LeaveBalance {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "employee_id", nullable = false)
    private Employee employee;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "leave_type_id", nullable = false)
    private LeaveType leaveType;

    @Column(name = "accounting_year", nullable = false)
    private Integer year;

    @Column(name = "entitled")
    private Double entitled = 0.0;

    // 年度切替時に一度だけ設定する
    @Column(name = "carried_over")
    private Double carriedOver = 0.0;

    @Column(name = "adjustment")
    private Double adjustment = 0.0;

    @Column(name = "used")
    private Double used = 0.0;

    @Column(name = "pending")
    private Double pending = 0.0;

    @Version
    private Long version;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    protected LeaveBalance() {}

    public LeaveBalance(Employee employee, LeaveType leaveType, int year, double entitled, double carriedOver) {
        this.employee = employee;
        this.leaveType = leaveType;
        this.year = year;
        this.entitled = entitled;
        this.carriedOver = carriedOver;
    }

    @PrePersist
    @PreUpdate
    protected void touch() { this.updatedAt = LocalDateTime.now(); }

    public LeaveBalanceSnapshot snapshot() {
        return new LeaveBalanceSnapshot(nz(entitled), nz(carriedOver), nz(adjustment), nz(used), nz(pending));
    }

    public double remaining() {
        return BalanceAggregator.remaining(snapshot());
    }

    public void addPending(double days) { this.pending = nz(pending) + days; }
    public void addUsed(double days) { this.used = nz(used) + days; }

    /** 申請中から取得済みへ移す (承認時)。 */
    public void movePendingToUsed(double days) {
        addPending(-days);
        addUsed(days);
    }

    public void adjust(double days) { this.adjustment = nz(adjustment) + days; }

    private static double nz(Double value) { return value == null ? 0 : value; }

    public Long getId() { return id; }
    public Employee getEmployee() { return employee; }
    public LeaveType getLeaveType() { return leaveType; }
    public Integer getYear() { return year; }
    public Double getEntitled() { return entitled; }
    public Double getCarriedOver() { return carriedOver; }
    public Double getAdjustment() { return adjustment; }
    public Double getUsed() { return used; }
    public Double getPending() { return pending; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }
}
