package com.example.zeitpal.leave;

import com.example.zeitpal.calendar.HalfDayMarker;
import com.example.zeitpal.common.ApiResponse;
import com.example.zeitpal.leave.engine.CarryoverResult;
import com.example.zeitpal.leave.engine.LeaveBalanceSnapshot;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/leave")
public class LeaveController {

    private final LeaveRequestService requestService;
    private final LeaveYearService yearService;

    public LeaveController(LeaveRequestService requestService, LeaveYearService yearService) {
        this.requestService = requestService;
        this.yearService = yearService;
    }

    @PostMapping("/requests/preview")
    public ResponseEntity<ApiResponse<LeaveRequestService.LeavePreview>> preview(@Valid @RequestBody LeaveRequestBody body) {
        return ResponseEntity.ok(ApiResponse.success("日数を計算しました", requestService.preview(body.toCommand())));
    }

    @PostMapping("/requests")
    public ResponseEntity<ApiResponse<LeaveRequestDto>> submit(@Valid @RequestBody LeaveRequestBody body) {
        LeaveRequestService.Submission submission = requestService.submit(body.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("休暇を申請しました",
                LeaveRequestDto.from(submission.request()),
                Map.of("certificateRequired", submission.certificateRequired())));
    }

    @GetMapping("/requests")
    public ResponseEntity<ApiResponse<List<LeaveRequestDto>>> list(@RequestParam Long employeeId) {
        List<LeaveRequestDto> requests = requestService.findByEmployee(employeeId).stream()
                .map(LeaveRequestDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("休暇申請一覧を取得しました", requests));
    }

    @GetMapping("/requests/pending")
    public ResponseEntity<ApiResponse<List<LeaveRequestDto>>> pending() {
        List<LeaveRequestDto> requests = requestService.findPending().stream()
                .map(LeaveRequestDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("承認待ちの休暇申請を取得しました", requests));
    }

    @PostMapping("/requests/{id}/approve")
    public ResponseEntity<ApiResponse<LeaveRequestDto>> approve(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("休暇申請を承認しました", LeaveRequestDto.from(requestService.approve(id))));
    }

    @PostMapping("/requests/{id}/reject")
    public ResponseEntity<ApiResponse<LeaveRequestDto>> reject(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("休暇申請を却下しました", LeaveRequestDto.from(requestService.reject(id))));
    }

    @PostMapping("/requests/{id}/withdraw")
    public ResponseEntity<ApiResponse<LeaveRequestDto>> withdraw(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("休暇申請を取り下げました", LeaveRequestDto.from(requestService.withdraw(id))));
    }

    @PostMapping("/requests/{id}/cancel")
    public ResponseEntity<ApiResponse<LeaveRequestDto>> cancel(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("休暇を取り消しました", LeaveRequestDto.from(requestService.cancel(id))));
    }

    @GetMapping("/balance/{employeeId}")
    public ResponseEntity<ApiResponse<BalanceDto>> getBalance(@PathVariable Long employeeId, @RequestParam int year,
                                                             @RequestParam(required = false) String leaveType) {
        return ResponseEntity.ok(ApiResponse.success("残数を取得しました",
                BalanceDto.from(yearService.balanceOf(employeeId, leaveType, year))));
    }

    @PostMapping("/balance/onboard")
    public ResponseEntity<ApiResponse<List<BalanceDto>>> onboard(@Valid @RequestBody OnboardRequest request) {
        LeaveYearService.OnboardResult result = yearService.onboard(request.employeeId(), request.year());
        List<BalanceDto> balances = result.balances().stream().map(BalanceDto::from).toList();
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("statutoryMinimumDays", result.statutoryMinimumDays());
        if (result.belowStatutoryMinimum()) {
            meta.put("warning", "年休日数が法定最低日数 (" + result.statutoryMinimumDays() + "日) を下回っています");
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("休暇残高を作成しました", balances, meta));
    }

    @PostMapping("/balance/adjust")
    public ResponseEntity<ApiResponse<BalanceDto>> adjust(@Valid @RequestBody AdjustRequest request) {
        LeaveBalance saved = yearService.adjust(request.employeeId(), request.leaveType(), request.year(), request.days());
        return ResponseEntity.ok(ApiResponse.success("休暇残高を調整しました", BalanceDto.from(saved)));
    }

    @PostMapping("/year-end/{fromYear}")
    public ResponseEntity<ApiResponse<LeaveYearService.RolloverSummary>> rollover(@PathVariable int fromYear) {
        return ResponseEntity.ok(ApiResponse.success("年度切替を実行しました", yearService.rollover(fromYear)));
    }

    @GetMapping("/carryover/{employeeId}")
    public ResponseEntity<ApiResponse<CarryoverResult>> carryover(@PathVariable Long employeeId,
                                                                  @RequestParam int year,
                                                                  @RequestParam(required = false) String leaveType,
                                                                  @RequestParam(required = false)
                                                                  @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        LocalDate date = asOf == null ? LocalDate.now() : asOf;
        return ResponseEntity.ok(ApiResponse.success("繰越状況を取得しました", yearService.carryoverStatus(employeeId, leaveType, year, date)));
    }

    public record LeaveRequestBody(
            @NotNull(message = "従業員IDは必須です") Long employeeId,
            String leaveType,
            @NotNull(message = "開始日は必須です") LocalDate startDate,
            @NotNull(message = "終了日は必須です") LocalDate endDate,
            HalfDayMarker startHalfDay,
            HalfDayMarker endHalfDay,
            @Size(max = 500, message = "理由は500文字以下で入力してください") String reason) {

        LeaveRequestService.LeaveCommand toCommand() {
            return new LeaveRequestService.LeaveCommand(employeeId, leaveType, startDate, endDate, startHalfDay, endHalfDay, reason);
        }
    }

    public record OnboardRequest(@NotNull(message = "従業員IDは必須です") Long employeeId, int year) {}

    public record AdjustRequest(@NotNull(message = "従業員IDは必須です") Long employeeId, String leaveType, int year,
                                double days) {}

    public record LeaveRequestDto(Long id, Long employeeId, String leaveType, LocalDate startDate, LocalDate endDate,
                                  HalfDayMarker startHalfDay, HalfDayMarker endHalfDay, double workDays,
                                  LeaveRequest.Status status, String reason) {
        static LeaveRequestDto from(LeaveRequest request) {
            return new LeaveRequestDto(request.getId(), request.getEmployee().getId(), request.getLeaveType().getCode(),
                    request.getStartDate(), request.getEndDate(), request.getStartHalfDay(), request.getEndHalfDay(),
                    request.getWorkDays(), request.getStatus(), request.getReason());
        }
    }

    public record BalanceDto(Long employeeId, String leaveType, int year, double entitled, double carriedOver, double adjustment,
                             double used, double pending, double remaining) {
        static BalanceDto from(LeaveBalance balance) {
            LeaveBalanceSnapshot snapshot = balance.snapshot();
            return new BalanceDto(balance.getEmployee().getId(), balance.getLeaveType().getCode(), balance.getYear(), snapshot.entitled(),
                    snapshot.carriedOver(), snapshot.adjustment(), snapshot.used(), snapshot.pending(),
                    balance.remaining());
        }
    }
}
