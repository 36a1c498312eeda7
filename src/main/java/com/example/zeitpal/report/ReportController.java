package com.example.zeitpal.report;

import com.example.zeitpal.common.ApiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/reports")
public class ReportController {

    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping("/employee-balances")
    public ResponseEntity<ApiResponse<List<ReportService.EmployeeBalanceRow>>> employeeBalances(@RequestParam int year) {
        List<ReportService.EmployeeBalanceRow> rows = reportService.employeeBalances(year);
        long overdrawn = rows.stream().filter(r -> r.remaining() < 0).count();
        return ResponseEntity.ok(ApiResponse.success("従業員別残高を取得しました", rows,
                Map.of("count", rows.size(), "overdrawn", overdrawn)));
    }
}
