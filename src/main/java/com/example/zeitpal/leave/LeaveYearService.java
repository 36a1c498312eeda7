package com.example.zeitpal.leave;

import com.example.zeitpal.config.JurisdictionProperties;
import com.example.zeitpal.employee.Employee;
import com.example.zeitpal.employee.EmployeeRepository;
import com.example.zeitpal.exception.BusinessException;
import com.example.zeitpal.leave.engine.BalanceAggregator;
import com.example.zeitpal.leave.engine.CarryoverCalculator;
import com.example.zeitpal.leave.engine.CarryoverResult;
import com.example.zeitpal.leave.engine.EntitlementCalculator;
import com.example.zeitpal.leave.engine.JurisdictionRule;
import com.example.zeitpal.leave.engine.LeavePolicy;
import com.example.zeitpal.leave.engine.StatutoryRules;
import com.example.zeitpal.organization.Organization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 入社時・年度切替時の残高作成。残高は年間付与のある休暇種別ごとに作る。
 * 付与日数は入社月按分 → 短時間勤務按分の順で算出する。
 */
@Service
@Transactional
public class LeaveYearService {

    private static final Logger logger = LoggerFactory.getLogger(LeaveYearService.class);

    private static final int DEFAULT_WORK_DAYS_PER_WEEK = 5;

    private final EmployeeRepository employeeRepository;
    private final LeaveBalanceRepository balanceRepository;
    private final LeaveTypeService leaveTypeService;
    private final JurisdictionProperties jurisdictionProperties;

    public LeaveYearService(EmployeeRepository employeeRepository,
                            LeaveBalanceRepository balanceRepository,
                            LeaveTypeService leaveTypeService,
                            JurisdictionProperties jurisdictionProperties) {
        this.employeeRepository = employeeRepository;
        this.balanceRepository = balanceRepository;
        this.leaveTypeService = leaveTypeService;
        this.jurisdictionProperties = jurisdictionProperties;
    }

    /**
     * 入社時の残高作成。既に当年度の残高がある種別があればエラー。
     * 年休日数が従業員の週勤務日数に対する法定最低日数を下回る場合は警告を返す。
     */
    public OnboardResult onboard(Long employeeId, int year) {
        Employee employee = findEmployee(employeeId);
        List<LeaveType> types = leaveTypeService.allowanceTypes(employee.getOrganization());
        for (LeaveType type : types) {
            if (balanceRepository.existsByEmployeeAndLeaveTypeAndYear(employee, type, year)) {
                throw new BusinessException(BusinessException.CONFLICT,
                        year + "年度の " + type.getCode() + " 残高は既に登録されています", employeeId, year);
            }
        }
        List<LeaveBalance> balances = new ArrayList<>();
        for (LeaveType type : types) {
            double entitled = entitlementFor(employee, type, year);
            balances.add(balanceRepository.save(new LeaveBalance(employee, type, year, entitled, 0)));
            logger.info("入社時残高を作成しました: 従業員={}, 種別={}, 年度={}, 付与={}",
                    employee.getName(), type.getCode(), year, entitled);
        }

        Organization organization = employee.getOrganization();
        JurisdictionRule rule = jurisdictionProperties.ruleFor(organization.getCountryCode());
        int workDaysPerWeek = employee.getWorkDaysPerWeek() == null
                ? DEFAULT_WORK_DAYS_PER_WEEK : employee.getWorkDaysPerWeek();
        double minimum = StatutoryRules.minimumStatutoryLeave(workDaysPerWeek, rule);
        double fullYear = EntitlementCalculator.annualEntitlement(null, employee.getWeeklyHours(),
                vacationPolicy(organization, rule, types), year);
        boolean belowMinimum = fullYear < minimum;
        if (belowMinimum) {
            logger.warn("従業員{}の年休日数{}が法定最低日数{} (週{}日勤務) を下回っています",
                    employee.getName(), fullYear, minimum, workDaysPerWeek);
        }
        return new OnboardResult(balances, minimum, belowMinimum);
    }

    /**
     * {@code fromYear} の残数を翌年度へ繰り越し、翌年度の残高を作成する。
     * 翌年度の残高が既にある従業員・種別はスキップする (繰越は年度ごとに一度だけ)。
     * 繰越の判定は翌年度1月1日時点、期限は翌年度のポリシー期限日。
     * 繰越元は申請中を含めない残数なので、切替後に却下された申請の日数は翌年度に影響しない。
     */
    public RolloverSummary rollover(int fromYear) {
        int toYear = fromYear + 1;
        LocalDate asOf = LocalDate.of(toYear, 1, 1);
        int created = 0;
        int skipped = 0;
        double totalCarried = 0;

        List<Employee> employees = employeeRepository.findAll();
        for (Employee employee : employees) {
            Organization organization = employee.getOrganization();
            LeavePolicy policy = organization.leavePolicy(jurisdictionProperties.ruleFor(organization.getCountryCode()));
            for (LeaveType type : leaveTypeService.allowanceTypes(organization)) {
                if (balanceRepository.existsByEmployeeAndLeaveTypeAndYear(employee, type, toYear)) {
                    skipped++;
                    continue;
                }
                double settled = balanceRepository.findByEmployeeAndLeaveTypeAndYear(employee, type, fromYear)
                        .map(b -> BalanceAggregator.settled(b.snapshot()))
                        .orElse(0.0);
                double carried = 0;
                if (policy.carryoverEnabled() && type.allowsCarryover()) {
                    double cap = type.getMaxCarryoverDays() != null ? type.getMaxCarryoverDays() : policy.carryoverMaxDays();
                    CarryoverResult result = CarryoverCalculator.carryover(settled, cap,
                            policy.carryoverExpiry(), asOf, toYear);
                    carried = result.amount();
                }
                double entitled = entitlementFor(employee, type, toYear);
                balanceRepository.save(new LeaveBalance(employee, type, toYear, entitled, carried));
                created++;
                totalCarried += carried;
                logger.debug("年度切替: 従業員={}, 種別={}, {}年残={}, 繰越={}, {}年付与={}",
                        employee.getName(), type.getCode(), fromYear, settled, carried, toYear, entitled);
            }
        }
        logger.info("年度切替を実行しました: {}→{}, 作成={}, スキップ={}, 繰越合計={}",
                fromYear, toYear, created, skipped, totalCarried);
        return new RolloverSummary(fromYear, toYear, created, skipped, totalCarried);
    }

    /**
     * 当年度に繰り越された日数の期限状況 (表示用)。残高は変更しない。
     */
    @Transactional(readOnly = true)
    public CarryoverResult carryoverStatus(Long employeeId, String leaveTypeCode, int year, LocalDate asOf) {
        LeaveBalance balance = balanceOf(employeeId, leaveTypeCode, year);
        Organization organization = balance.getEmployee().getOrganization();
        LeavePolicy policy = organization.leavePolicy(jurisdictionProperties.ruleFor(organization.getCountryCode()));
        return CarryoverCalculator.carryover(balance.getCarriedOver(), balance.getCarriedOver(),
                policy.carryoverExpiry(), asOf, year);
    }

    /**
     * 手動調整 (加算・減算)。
     */
    public LeaveBalance adjust(Long employeeId, String leaveTypeCode, int year, double days) {
        LeaveBalance balance = balanceOf(employeeId, leaveTypeCode, year);
        balance.adjust(days);
        logger.info("残高を手動調整しました: 従業員={}, 種別={}, 年度={}, 調整={}",
                balance.getEmployee().getName(), balance.getLeaveType().getCode(), year, days);
        return balanceRepository.save(balance);
    }

    /**
     * 種別コードは未指定なら VACATION。
     */
    @Transactional(readOnly = true)
    public LeaveBalance balanceOf(Long employeeId, String leaveTypeCode, int year) {
        Employee employee = findEmployee(employeeId);
        LeaveType type = leaveTypeService.resolve(employee.getOrganization(), leaveTypeCode);
        return balanceRepository.findByEmployeeAndLeaveTypeAndYear(employee, type, year)
                .orElseThrow(() -> BusinessException.notFound(
                        year + "年度の " + type.getCode() + " 残高が登録されていません"));
    }

    private double entitlementFor(Employee employee, LeaveType type, int year) {
        Organization organization = employee.getOrganization();
        LeavePolicy policy = organization.leavePolicy(jurisdictionProperties.ruleFor(organization.getCountryCode()));
        if (type.getDefaultDaysPerYear() != null) {
            policy = policy.withAnnualEntitlementDays(type.getDefaultDaysPerYear());
        }
        return EntitlementCalculator.annualEntitlement(employee.getEmploymentStartDate(),
                employee.getWeeklyHours(), policy, year);
    }

    // 法定最低日数と比べるのは年休 (VACATION) の付与日数
    private static LeavePolicy vacationPolicy(Organization organization, JurisdictionRule rule, List<LeaveType> types) {
        LeavePolicy policy = organization.leavePolicy(rule);
        return types.stream()
                .filter(t -> LeaveType.VACATION.equals(t.getCode()) && t.getDefaultDaysPerYear() != null)
                .findFirst()
                .map(t -> policy.withAnnualEntitlementDays(t.getDefaultDaysPerYear()))
                .orElse(policy);
    }

    private Employee findEmployee(Long employeeId) {
        return employeeRepository.findById(employeeId)
                .orElseThrow(() -> BusinessException.notFound("従業員が見つかりません: " + employeeId));
    }

    public record OnboardResult(List<LeaveBalance> balances, double statutoryMinimumDays,
                                boolean belowStatutoryMinimum) {
    }

    public record RolloverSummary(int fromYear, int toYear, int created, int skipped, double totalCarriedOver) {
    }
}
