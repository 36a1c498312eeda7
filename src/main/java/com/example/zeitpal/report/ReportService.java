package com.example.zeitpal.report;

import com.example.zeitpal.employee.Employee;
import com.example.zeitpal.employee.EmployeeRepository;
import com.example.zeitpal.leave.LeaveBalance;
import com.example.zeitpal.leave.LeaveBalanceRepository;
import com.example.zeitpal.leave.engine.BalanceAggregator;
import com.example.zeitpal.leave.engine.LeaveBalanceSnapshot;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
public class ReportService {

    private final EmployeeRepository employeeRepository;
    private final LeaveBalanceRepository balanceRepository;

    public ReportService(EmployeeRepository employeeRepository, LeaveBalanceRepository balanceRepository) {
        this.employeeRepository = employeeRepository;
        this.balanceRepository = balanceRepository;
    }

    /**
     * 年度の従業員 x 休暇種別の残高一覧。残高未登録の従業員は種別なし・全項目0の1行で出力する。
     */
    @Transactional(readOnly = true)
    public List<EmployeeBalanceRow> employeeBalances(int year) {
        Map<Long, List<LeaveBalance>> byEmployee = balanceRepository.findByYear(year).stream()
                .collect(Collectors.groupingBy(b -> b.getEmployee().getId()));
        return employeeRepository.findAll().stream()
                .sorted(Comparator.comparing(Employee::getName))
                .flatMap(employee -> {
                    List<LeaveBalance> balances = byEmployee.getOrDefault(employee.getId(), List.of());
                    if (balances.isEmpty()) {
                        return Stream.of(row(employee, null, year, LeaveBalanceSnapshot.EMPTY));
                    }
                    return balances.stream()
                            .sorted(Comparator.comparing((LeaveBalance b) -> b.getLeaveType().getSortOrder(),
                                    Comparator.nullsLast(Comparator.naturalOrder())))
                            .map(b -> row(employee, b.getLeaveType().getCode(), year, b.snapshot()));
                })
                .toList();
    }

    private static EmployeeBalanceRow row(Employee employee, String leaveType, int year, LeaveBalanceSnapshot snapshot) {
        return new EmployeeBalanceRow(employee.getId(), employee.getName(), leaveType, year,
                snapshot.entitled(), snapshot.carriedOver(), snapshot.adjustment(),
                snapshot.used(), snapshot.pending(), BalanceAggregator.remaining(snapshot));
    }

    public record EmployeeBalanceRow(Long employeeId, String employeeName, String leaveType, int year, double entitled,
                                     double carriedOver, double adjustment, double used, double pending,
                                     double remaining) {
    }
}
