package com.example.zeitpal.organization;

import com.example.zeitpal.common.ApiResponse;
import com.example.zeitpal.config.JurisdictionProperties;
import com.example.zeitpal.leave.engine.JurisdictionRule;
import com.example.zeitpal.leave.engine.LeavePolicy;
import com.example.zeitpal.leave.engine.StatutoryRules;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.*;

import java.time.DateTimeException;
import java.time.MonthDay;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/organizations")
public class OrganizationController {

    private static final Logger logger = LoggerFactory.getLogger(OrganizationController.class);

    private static final int DEFAULT_WORK_DAYS_PER_WEEK = 5;

    private final OrganizationRepository organizationRepository;
    private final JurisdictionProperties jurisdictionProperties;

    public OrganizationController(OrganizationRepository organizationRepository,
                                  JurisdictionProperties jurisdictionProperties) {
        this.organizationRepository = organizationRepository;
        this.jurisdictionProperties = jurisdictionProperties;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<OrganizationDto>> create(@Valid @RequestBody OrganizationRequest request) {
        if (organizationRepository.findByName(request.name().trim()).isPresent()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.failure("同名の組織が既に存在します"));
        }
        Organization saved = organizationRepository.save(
                new Organization(request.name().trim(), request.countryCode().trim(), blankToNull(request.regionCode())));
        logger.info("組織を作成しました id={} country={}", saved.getId(), saved.getCountryCode());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("組織を作成しました", toDto(saved)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<OrganizationDto>> get(@PathVariable Long id) {
        Optional<Organization> organization = organizationRepository.findById(id);
        return organization
                .map(value -> ResponseEntity.ok(ApiResponse.success("組織を取得しました", toDto(value))))
                .orElse(ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.failure("組織が見つかりません")));
    }

    /**
     * 休暇ポリシーを更新する。年休日数が法定最低日数を下回る場合も保存はするが、
     * meta に警告を載せて返す。診断書要否の日数を省略すると所在国の法定値に従う。
     */
    @PutMapping("/{id}/policy")
    @Transactional
    public ResponseEntity<ApiResponse<OrganizationDto>> updatePolicy(@PathVariable Long id,
                                                                     @Valid @RequestBody PolicyRequest request) {
        Optional<Organization> found = organizationRepository.findById(id);
        if (found.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.failure("組織が見つかりません"));
        }
        MonthDay expiry;
        try {
            expiry = MonthDay.of(request.carryoverExpiryMonth(), request.carryoverExpiryDay());
        } catch (DateTimeException e) {
            return ResponseEntity.badRequest().body(ApiResponse.failure("繰越期限の日付が不正です"));
        }
        Organization organization = found.get();
        JurisdictionRule rule = jurisdictionProperties.ruleFor(organization.getCountryCode());
        double threshold = request.sickCertificateThresholdDays() != null
                ? request.sickCertificateThresholdDays() : rule.sickCertificateThresholdDays();
        LeavePolicy policy = new LeavePolicy(request.annualEntitlementDays(), request.carryoverEnabled(),
                request.carryoverMaxDays(), expiry, threshold, request.fullTimeWeeklyHours());
        organization.applyPolicy(policy);
        organization.setSickCertificateThresholdDays(request.sickCertificateThresholdDays());
        Organization saved = organizationRepository.save(organization);

        int workDaysPerWeek = request.workDaysPerWeek() == null ? DEFAULT_WORK_DAYS_PER_WEEK : request.workDaysPerWeek();
        double minimum = StatutoryRules.minimumStatutoryLeave(workDaysPerWeek, rule);
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("statutoryMinimumDays", minimum);
        if (policy.annualEntitlementDays() < minimum) {
            meta.put("warning", "年休日数が法定最低日数 (" + minimum + "日) を下回っています");
            logger.warn("組織{}の年休日数{}が法定最低日数{}を下回っています", id, policy.annualEntitlementDays(), minimum);
        }
        return ResponseEntity.ok(ApiResponse.success("休暇ポリシーを更新しました", toDto(saved), meta));
    }

    private OrganizationDto toDto(Organization organization) {
        return new OrganizationDto(organization.getId(), organization.getName(), organization.getCountryCode(),
                organization.getRegionCode(),
                organization.leavePolicy(jurisdictionProperties.ruleFor(organization.getCountryCode())));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public record OrganizationRequest(
            @NotBlank(message = "組織名は必須です") String name,
            @NotBlank(message = "国コードは必須です") String countryCode,
            String regionCode) {
    }

    public record PolicyRequest(
            @NotNull @DecimalMin(value = "0", message = "年休日数は0以上である必要があります") Double annualEntitlementDays,
            boolean carryoverEnabled,
            @NotNull @DecimalMin(value = "0", message = "繰越上限は0以上である必要があります") Double carryoverMaxDays,
            @Min(value = 1, message = "繰越期限(月)は1〜12で指定してください") @Max(value = 12, message = "繰越期限(月)は1〜12で指定してください") int carryoverExpiryMonth,
            @Min(value = 1, message = "繰越期限(日)は1〜31で指定してください") @Max(value = 31, message = "繰越期限(日)は1〜31で指定してください") int carryoverExpiryDay,
            @DecimalMin(value = "0", message = "診断書要否の日数は0以上である必要があります") Double sickCertificateThresholdDays,
            @NotNull @DecimalMin(value = "1", message = "フルタイム週所定時間は1以上である必要があります") Double fullTimeWeeklyHours,
            // 法定最低日数の判定に使う標準の週勤務日数。省略時は5日
            @Min(value = 1, message = "週勤務日数は1〜7で指定してください") @Max(value = 7, message = "週勤務日数は1〜7で指定してください") Integer workDaysPerWeek) {
    }

    public record OrganizationDto(Long id, String name, String countryCode, String regionCode, LeavePolicy policy) {
    }
}
