package com.example.zeitpal.leave;

import com.example.zeitpal.employee.Employee;
import com.example.zeitpal.employee.EmployeeRepository;
import com.example.zeitpal.exception.BusinessException;
import com.example.zeitpal.leave.engine.CarryoverResult;
import com.example.zeitpal.leave.engine.LeavePolicy;
import com.example.zeitpal.organization.Organization;
import com.example.zeitpal.organization.OrganizationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Transactional
class LeaveYearServiceTest {

    @Autowired
    private LeaveYearService yearService;

    @Autowired
    private LeaveBalanceRepository balanceRepository;

    @Autowired
    private LeaveRequestRepository requestRepository;

    @Autowired
    private EmployeeRepository employeeRepository;

    @Autowired
    private OrganizationRepository organizationRepository;

    @Autowired
    private LeaveRequestService requestService;

    @Autowired
    private LeaveTypeService leaveTypeService;

    private Organization organization;

    @BeforeEach
    void setUp() {
        requestRepository.deleteAll();
        balanceRepository.deleteAll();
        employeeRepository.deleteAll();
        organization = organizationRepository.save(new Organization("Jahreswechsel AG", "DE", null));
    }

    private Employee employee(String name, LocalDate start, Double weeklyHours) {
        Employee employee = new Employee(name, organization, start);
        employee.setWeeklyHours(weeklyHours);
        return employeeRepository.save(employee);
    }

    private Optional<LeaveBalance> vacationBalance(Employee employee, int year) {
        return balance(employee, LeaveType.VACATION, year);
    }

    private Optional<LeaveBalance> balance(Employee employee, String leaveType, int year) {
        LeaveType type = leaveTypeService.resolve(organization, leaveType);
        return balanceRepository.findByEmployeeAndLeaveTypeAndYear(employee, type, year);
    }

    @Test
    void onboard_midYearStart_isProRated() {
        Employee employee = employee("七月入社", LocalDate.of(2024, 7, 1), null);
        assertThat(yearService.onboard(employee.getId(), 2024).balances().get(0).getEntitled()).isEqualTo(15.0);
    }

    @Test
    void onboard_partTime_isScaledByHours() {
        Employee employee = employee("短時間勤務", LocalDate.of(2021, 1, 1), 20.0);
        assertThat(yearService.onboard(employee.getId(), 2024).balances().get(0).getEntitled()).isEqualTo(15.0);
    }

    @Test
    void onboard_twice_isConflict() {
        Employee employee = employee("二重登録", LocalDate.of(2021, 1, 1), null);
        yearService.onboard(employee.getId(), 2024);

        assertThatThrownBy(() -> yearService.onboard(employee.getId(), 2024))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(BusinessException.CONFLICT);
    }

    @Test
    void rollover_carriesCappedRemainderOnce() {
        Employee withRemainder = employee("残あり", LocalDate.of(2021, 1, 1), null);
        Employee withoutBalance = employee("残高なし", LocalDate.of(2021, 1, 1), null);
        Employee alreadyRolled = employee("作成済み", LocalDate.of(2021, 1, 1), null);

        yearService.onboard(withRemainder.getId(), 2024);
        yearService.adjust(withRemainder.getId(), LeaveType.VACATION, 2024, -22);
        yearService.onboard(alreadyRolled.getId(), 2025);

        LeaveYearService.RolloverSummary summary = yearService.rollover(2024);

        assertThat(summary.toYear()).isEqualTo(2025);
        assertThat(summary.created()).isEqualTo(2);
        assertThat(summary.skipped()).isEqualTo(1);
        assertThat(summary.totalCarriedOver()).isEqualTo(5.0);

        LeaveBalance carried = vacationBalance(withRemainder, 2025).orElseThrow();
        assertThat(carried.getCarriedOver()).isEqualTo(5.0);
        assertThat(carried.getEntitled()).isEqualTo(30.0);
        assertThat(carried.remaining()).isEqualTo(35.0);
        assertThat(vacationBalance(withoutBalance, 2025).orElseThrow().getCarriedOver())
                .isZero();
        assertThat(vacationBalance(alreadyRolled, 2025).orElseThrow().getCarriedOver())
                .isZero();

        LeaveYearService.RolloverSummary again = yearService.rollover(2024);
        assertThat(again.created()).isZero();
        assertThat(vacationBalance(withRemainder, 2025).orElseThrow().getCarriedOver())
                .isEqualTo(5.0);
    }

    @Test
    void rollover_disabledCarryover_carriesNothing() {
        organization.applyPolicy(new LeavePolicy(30, false, 5, MonthDay.of(3, 31), 3, 40));
        organizationRepository.save(organization);
        Employee employee = employee("繰越なし", LocalDate.of(2021, 1, 1), null);
        yearService.onboard(employee.getId(), 2024);

        yearService.rollover(2024);

        assertThat(vacationBalance(employee, 2025).orElseThrow().getCarriedOver()).isZero();
    }

    @Test
    void carryoverStatus_expiresAfterPolicyDate() {
        Employee employee = employee("期限確認", LocalDate.of(2021, 1, 1), null);
        yearService.onboard(employee.getId(), 2024);
        yearService.rollover(2024);

        CarryoverResult beforeExpiry = yearService.carryoverStatus(employee.getId(), LeaveType.VACATION, 2025, LocalDate.of(2025, 3, 1));
        assertThat(beforeExpiry.amount()).isEqualTo(5.0);
        assertThat(beforeExpiry.daysUntilExpiry()).isEqualTo(30);
        assertThat(beforeExpiry.expired()).isFalse();

        CarryoverResult afterExpiry = yearService.carryoverStatus(employee.getId(), LeaveType.VACATION, 2025, LocalDate.of(2025, 4, 1));
        assertThat(afterExpiry.expired()).isTrue();
        assertThat(afterExpiry.amount()).isZero();
    }

    @Test
    void adjust_withoutBalance_isNotFound() {
        Employee employee = employee("未登録", LocalDate.of(2021, 1, 1), null);
        assertThatThrownBy(() -> yearService.adjust(employee.getId(), null, 2030, 1))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(BusinessException.NOT_FOUND);
    }

    @Test
    void onboard_warnsPerEmployeeWorkWeekBelowStatutoryMinimum() {
        organization.applyPolicy(new LeavePolicy(22, true, 5, MonthDay.of(3, 31), 3, 40));
        organizationRepository.save(organization);
        Employee fiveDays = employee("週5日勤務", LocalDate.of(2021, 1, 1), null);
        Employee sixDays = employee("週6日勤務", LocalDate.of(2021, 1, 1), null);
        sixDays.setWorkDaysPerWeek(6);
        employeeRepository.save(sixDays);

        LeaveYearService.OnboardResult five = yearService.onboard(fiveDays.getId(), 2024);
        LeaveYearService.OnboardResult six = yearService.onboard(sixDays.getId(), 2024);

        assertThat(five.statutoryMinimumDays()).isEqualTo(20.0);
        assertThat(five.belowStatutoryMinimum()).isFalse();
        assertThat(six.statutoryMinimumDays()).isEqualTo(24.0);
        assertThat(six.belowStatutoryMinimum()).isTrue();
        assertThat(six.balances()).extracting(LeaveBalance::getEntitled).containsExactly(22.0);
    }

    @Test
    void rollover_pendingDaysRejectedLaterAreStillCarried() {
        Employee employee = employee("申請中あり", LocalDate.of(2021, 1, 1), null);
        yearService.onboard(employee.getId(), 2024);
        yearService.adjust(employee.getId(), LeaveType.VACATION, 2024, -27);
        LeaveRequest pending = requestService.submit(new LeaveRequestService.LeaveCommand(employee.getId(), null,
                LocalDate.of(2024, 12, 2), LocalDate.of(2024, 12, 3), null, null, null)).request();

        yearService.rollover(2024);
        requestService.reject(pending.getId());

        assertThat(vacationBalance(employee, 2024).orElseThrow().remaining()).isEqualTo(3.0);
        assertThat(vacationBalance(employee, 2025).orElseThrow().getCarriedOver()).isEqualTo(3.0);
    }

    @Test
    void rollover_usesLeaveTypeCarryoverCap() {
        LeaveType education = new LeaveType(null, "BILDUNG", "Bildungsurlaub");
        education.setHasAllowance(true);
        education.setDefaultDaysPerYear(5.0);
        education.setAllowCarryover(true);
        education.setMaxCarryoverDays(2.0);
        leaveTypeService.create(organization.getId(), education);
        LeaveType noCarry = new LeaveType(null, "SABBATICAL", "Sabbatical");
        noCarry.setHasAllowance(true);
        noCarry.setDefaultDaysPerYear(4.0);
        leaveTypeService.create(organization.getId(), noCarry);
        Employee employee = employee("種別別繰越", LocalDate.of(2021, 1, 1), null);
        yearService.onboard(employee.getId(), 2024);

        LeaveYearService.RolloverSummary summary = yearService.rollover(2024);

        assertThat(summary.created()).isEqualTo(3);
        assertThat(balance(employee, "BILDUNG", 2025).orElseThrow().getCarriedOver()).isEqualTo(2.0);
        assertThat(balance(employee, "BILDUNG", 2025).orElseThrow().getEntitled()).isEqualTo(5.0);
        assertThat(balance(employee, "SABBATICAL", 2025).orElseThrow().getCarriedOver()).isZero();
        assertThat(vacationBalance(employee, 2025).orElseThrow().getCarriedOver()).isEqualTo(5.0);
    }
}
