package com.example.zeitpal.leave;

import com.example.zeitpal.calendar.DateRange;
import com.example.zeitpal.calendar.HalfDayMarker;
import com.example.zeitpal.config.JurisdictionProperties;
import com.example.zeitpal.employee.Employee;
import com.example.zeitpal.employee.EmployeeRepository;
import com.example.zeitpal.exception.BusinessException;
import com.example.zeitpal.holiday.HolidayCalendarService;
import com.example.zeitpal.leave.engine.BalanceAggregator;
import com.example.zeitpal.leave.engine.JurisdictionRule;
import com.example.zeitpal.leave.engine.LeaveBalanceSnapshot;
import com.example.zeitpal.leave.engine.LeaveRequestSpan;
import com.example.zeitpal.leave.engine.OverlapDetector;
import com.example.zeitpal.leave.engine.StatutoryRules;
import com.example.zeitpal.leave.engine.WorkDayCalculator;
import com.example.zeitpal.organization.Organization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 休暇申請の受付と状態遷移。
 * <p>
 * 日数の算出・重複判定・残数の算出は計算エンジンに委ね、ここでは
 * 祝日・ポリシー・休暇種別・既存申請の取得と残高の更新だけを行う。
 * 年間付与のある種別だけが残高を持ち、申請年度 (開始日の年) の同じ種別の残高に計上する。
 */
@Service
@Transactional
public class LeaveRequestService {

    private static final Logger logger = LoggerFactory.getLogger(LeaveRequestService.class);

    private final LeaveRequestRepository requestRepository;
    private final LeaveBalanceRepository balanceRepository;
    private final EmployeeRepository employeeRepository;
    private final HolidayCalendarService holidayCalendarService;
    private final LeaveTypeService leaveTypeService;
    private final JurisdictionProperties jurisdictionProperties;

    public LeaveRequestService(LeaveRequestRepository requestRepository,
                               LeaveBalanceRepository balanceRepository,
                               EmployeeRepository employeeRepository,
                               HolidayCalendarService holidayCalendarService,
                               LeaveTypeService leaveTypeService,
                               JurisdictionProperties jurisdictionProperties) {
        this.requestRepository = requestRepository;
        this.balanceRepository = balanceRepository;
        this.employeeRepository = employeeRepository;
        this.holidayCalendarService = holidayCalendarService;
        this.leaveTypeService = leaveTypeService;
        this.jurisdictionProperties = jurisdictionProperties;
    }

    /**
     * 保存せずに日数・診断書要否・重複・申請後残数を返す。入力途中の呼び出しを想定し、
     * 開始日と終了日が逆転していてもエラーにせず 0 日として扱う。
     */
    @Transactional(readOnly = true)
    public LeavePreview preview(LeaveCommand command) {
        Employee employee = findEmployee(command.employeeId());
        LeaveType leaveType = leaveTypeService.resolve(employee.getOrganization(), command.leaveTypeCode());
        return evaluate(employee, leaveType, command);
    }

    /**
     * 申請を受け付けて PENDING で保存し、残高の申請中日数に加算する。
     * 残高不足は拒否するが、マイナス残高を許可する種別では受け付ける。
     */
    public Submission submit(LeaveCommand command) {
        if (command.endDate().isBefore(command.startDate())) {
            throw new BusinessException("INVALID_RANGE", "終了日は開始日以降を指定してください");
        }
        Employee employee = findEmployee(command.employeeId());
        LeaveType leaveType = leaveTypeService.resolve(employee.getOrganization(), command.leaveTypeCode());
        if (!leaveType.allowsHalfDays() && (command.span().startHalfDay().isSet() || command.span().endHalfDay().isSet())) {
            throw new BusinessException("HALF_DAY_NOT_ALLOWED",
                    "休暇種別 " + leaveType.getCode() + " は半休で申請できません");
        }
        LeavePreview preview = evaluate(employee, leaveType, command);

        if (preview.workDays() <= 0) {
            throw new BusinessException("NO_WORK_DAYS", "指定期間に勤務日がありません");
        }
        if (preview.conflictingRequestId() != null) {
            throw new BusinessException(BusinessException.CONFLICT,
                    "この期間には既に休暇申請があります (ID=" + preview.conflictingRequestId() + ")",
                    preview.conflictingRequestId());
        }
        LeaveBalance balance = null;
        if (leaveType.hasAllowance()) {
            balance = requireBalance(employee, leaveType, command.startDate().getYear());
            if (!leaveType.allowsNegative() && !BalanceAggregator.covers(balance.snapshot(), preview.workDays())) {
                throw new BusinessException(BusinessException.INSUFFICIENT_BALANCE,
                        leaveType.getCode() + " の残数が不足しています (申請 " + preview.workDays() + "日 / 残 " + balance.remaining() + "日)");
            }
        }

        LeaveRequest request = new LeaveRequest(employee, leaveType, command.span(), preview.workDays());
        request.setReason(command.reason());
        LeaveRequest saved = requestRepository.save(request);

        if (balance != null) {
            balance.addPending(saved.getWorkDays());
            balanceRepository.save(balance);
        }
        logger.info("休暇申請を受け付けました: ID={}, 従業員={}, 種別={}, 期間={}〜{}, 日数={}",
                saved.getId(), employee.getName(), leaveType.getCode(), saved.getStartDate(), saved.getEndDate(),
                saved.getWorkDays());
        if (preview.certificateRequired()) {
            logger.info("休暇申請 ID={} は診断書の提出が必要です", saved.getId());
        }
        return new Submission(saved, preview.certificateRequired());
    }

    /**
     * 承認: 申請中日数を取得済みへ移す。
     */
    public LeaveRequest approve(Long requestId) {
        LeaveRequest request = findRequest(requestId);
        requireStatus(request, LeaveRequest.Status.PENDING, "承認できるのは申請中の休暇のみです");
        if (request.getLeaveType().hasAllowance()) {
            LeaveBalance balance = requireBalance(request.getEmployee(), request.getLeaveType(), request.accountingYear());
            balance.movePendingToUsed(request.getWorkDays());
            balanceRepository.save(balance);
        }
        request.setStatus(LeaveRequest.Status.APPROVED);
        logger.info("休暇申請を承認しました: ID={}", requestId);
        return requestRepository.save(request);
    }

    /**
     * 却下: 申請中日数を戻す。
     */
    public LeaveRequest reject(Long requestId) {
        return releasePending(requestId, LeaveRequest.Status.REJECTED, "却下できるのは申請中の休暇のみです");
    }

    /**
     * 取り下げ (申請者本人): 申請中日数を戻す。
     */
    public LeaveRequest withdraw(Long requestId) {
        return releasePending(requestId, LeaveRequest.Status.WITHDRAWN, "取り下げできるのは申請中の休暇のみです");
    }

    /**
     * 承認済み休暇の取消: 取得済み日数を戻す。
     */
    public LeaveRequest cancel(Long requestId) {
        LeaveRequest request = findRequest(requestId);
        requireStatus(request, LeaveRequest.Status.APPROVED, "取消できるのは承認済みの休暇のみです");
        if (request.getLeaveType().hasAllowance()) {
            LeaveBalance balance = requireBalance(request.getEmployee(), request.getLeaveType(), request.accountingYear());
            balance.addUsed(-request.getWorkDays());
            balanceRepository.save(balance);
        }
        request.setStatus(LeaveRequest.Status.CANCELLED);
        logger.info("承認済み休暇を取り消しました: ID={}", requestId);
        return requestRepository.save(request);
    }

    @Transactional(readOnly = true)
    public List<LeaveRequest> findByEmployee(Long employeeId) {
        return requestRepository.findByEmployeeOrderByStartDateDesc(findEmployee(employeeId));
    }

    @Transactional(readOnly = true)
    public List<LeaveRequest> findPending() {
        return requestRepository.findByStatusOrderByStartDateAsc(LeaveRequest.Status.PENDING);
    }

    private LeaveRequest releasePending(Long requestId, LeaveRequest.Status target, String invalidStateMessage) {
        LeaveRequest request = findRequest(requestId);
        requireStatus(request, LeaveRequest.Status.PENDING, invalidStateMessage);
        if (request.getLeaveType().hasAllowance()) {
            LeaveBalance balance = requireBalance(request.getEmployee(), request.getLeaveType(), request.accountingYear());
            balance.addPending(-request.getWorkDays());
            balanceRepository.save(balance);
        }
        request.setStatus(target);
        logger.info("休暇申請を{}にしました: ID={}", target, requestId);
        return requestRepository.save(request);
    }

    private LeavePreview evaluate(Employee employee, LeaveType leaveType, LeaveCommand command) {
        LeaveRequestSpan span = command.span();
        DateRange range = span.range();
        Organization organization = employee.getOrganization();
        Set<LocalDate> holidays = holidayCalendarService.holidaysBetween(
                organization.getCountryCode(), organization.getRegionCode(), organization.getId(), range);
        double workDays = WorkDayCalculator.workDays(span, holidays);

        boolean certificateRequired = leaveType.requiresDocument()
                && requiresCertificate(range.days().size(), leaveType, organization);

        List<LeaveRequest> blocking = requestRepository
                .findByEmployeeAndStatusInOrderByStartDateAsc(employee, LeaveRequest.BLOCKING);
        Long conflictingId = range.isDegenerate() ? null : OverlapDetector
                .firstConflict(range, blocking, LeaveRequest::range)
                .map(LeaveRequest::getId)
                .orElse(null);

        Double remainingBefore = null;
        Double remainingAfter = null;
        if (leaveType.hasAllowance()) {
            LeaveBalanceSnapshot snapshot = balanceRepository
                    .findByEmployeeAndLeaveTypeAndYear(employee, leaveType, range.start().getYear())
                    .map(LeaveBalance::snapshot)
                    .orElse(LeaveBalanceSnapshot.EMPTY);
            remainingBefore = BalanceAggregator.remaining(snapshot);
            remainingAfter = remainingBefore - workDays;
        }
        return new LeavePreview(workDays, certificateRequired, conflictingId, remainingBefore, remainingAfter);
    }

    /**
     * 診断書要否の日数は 種別の設定 → 組織ポリシー → 所在国の法定値 の順で決まる。
     */
    private boolean requiresCertificate(int calendarDays, LeaveType leaveType, Organization organization) {
        if (leaveType.getDocumentRequiredAfterDays() != null) {
            return StatutoryRules.requiresCertificate(calendarDays, leaveType.getDocumentRequiredAfterDays());
        }
        JurisdictionRule rule = jurisdictionProperties.ruleFor(organization.getCountryCode());
        if (organization.getSickCertificateThresholdDays() == null) {
            return StatutoryRules.requiresCertificate(calendarDays, rule);
        }
        return StatutoryRules.requiresCertificate(calendarDays, organization.leavePolicy(rule).sickCertificateThresholdDays());
    }

    private Employee findEmployee(Long employeeId) {
        return employeeRepository.findById(employeeId)
                .orElseThrow(() -> BusinessException.notFound("従業員が見つかりません: " + employeeId));
    }

    private LeaveRequest findRequest(Long requestId) {
        return requestRepository.findById(requestId)
                .orElseThrow(() -> BusinessException.notFound("休暇申請が見つかりません: " + requestId));
    }

    private LeaveBalance requireBalance(Employee employee, LeaveType leaveType, int year) {
        Optional<LeaveBalance> balance = balanceRepository.findByEmployeeAndLeaveTypeAndYear(employee, leaveType, year);
        return balance.orElseThrow(() -> new BusinessException(BusinessException.INSUFFICIENT_BALANCE,
                year + "年度の " + leaveType.getCode() + " 残高が登録されていません"));
    }

    private static void requireStatus(LeaveRequest request, LeaveRequest.Status expected, String message) {
        if (request.getStatus() != expected) {
            throw new BusinessException(BusinessException.INVALID_STATE, message);
        }
    }

    /**
     * 申請内容。種別コードは未指定なら VACATION、半休区分は未指定なら NONE。
     */
    public record LeaveCommand(Long employeeId,
                               String leaveTypeCode,
                               LocalDate startDate,
                               LocalDate endDate,
                               HalfDayMarker startHalfDay,
                               HalfDayMarker endHalfDay,
                               String reason) {

        public LeaveCommand {
            leaveTypeCode = LeaveType.normalizeCode(leaveTypeCode == null ? LeaveType.VACATION : leaveTypeCode);
        }

        LeaveRequestSpan span() {
            return new LeaveRequestSpan(new DateRange(startDate, endDate), startHalfDay, endHalfDay);
        }
    }

    public record Submission(LeaveRequest request, boolean certificateRequired) {
    }

    /**
     * @param remainingBefore 年間付与のない種別では null
     * @param remainingAfter  申請が承認された場合の残数。年間付与のない種別では null
     */
    public record LeavePreview(double workDays,
                               boolean certificateRequired,
                               Long conflictingRequestId,
                               Double remainingBefore,
                               Double remainingAfter) {
    }
}
