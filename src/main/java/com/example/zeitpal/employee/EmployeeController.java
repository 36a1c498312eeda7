package com.example.zeitpal.employee;

import com.example.zeitpal.common.ApiResponse;
import com.example.zeitpal.organization.Organization;
import com.example.zeitpal.organization.OrganizationRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api/employees")
public class EmployeeController {

    private static final Logger logger = LoggerFactory.getLogger(EmployeeController.class);

    private final EmployeeRepository employeeRepository;
    private final OrganizationRepository organizationRepository;

    public EmployeeController(EmployeeRepository employeeRepository, OrganizationRepository organizationRepository) {
        this.employeeRepository = employeeRepository;
        this.organizationRepository = organizationRepository;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<EmployeeDto>>> getAllEmployees() {
        List<EmployeeDto> employees = employeeRepository.findAll().stream().map(EmployeeDto::from).toList();
        return ResponseEntity.ok(ApiResponse.success("従業員一覧を取得しました", employees));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<EmployeeDto>> getEmployee(@PathVariable Long id) {
        Optional<Employee> employee = employeeRepository.findById(id);
        return employee
                .map(value -> ResponseEntity.ok(ApiResponse.success("従業員を取得しました", EmployeeDto.from(value))))
                .orElse(ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResponse.failure("従業員が見つかりません")));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<EmployeeDto>> createEmployee(@Valid @RequestBody EmployeeRequest request) {
        String name = request.name().trim();
        if (employeeRepository.findByName(name).isPresent()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.failure("同名の従業員が既に存在します"));
        }
        Optional<Organization> organization = organizationRepository.findById(request.organizationId());
        if (organization.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.failure("組織が見つかりません"));
        }
        Employee employee = new Employee(name, organization.get(), request.employmentStartDate());
        employee.setWeeklyHours(request.weeklyHours());
        if (request.workDaysPerWeek() != null) {
            employee.setWorkDaysPerWeek(request.workDaysPerWeek());
        }
        Employee saved = employeeRepository.save(employee);
        logger.info("従業員を作成しました id={} start={}", saved.getId(), saved.getEmploymentStartDate());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("従業員を作成しました", EmployeeDto.from(saved)));
    }

    public record EmployeeRequest(
            @NotBlank(message = "従業員名は必須です")
            @Size(max = 50, message = "従業員名は1文字以上50文字以下で入力してください") String name,
            @NotNull(message = "組織IDは必須です") Long organizationId,
            @NotNull(message = "入社日は必須です") LocalDate employmentStartDate,
            @DecimalMin(value = "0.5", message = "週所定時間は0.5以上である必要があります")
            @DecimalMax(value = "80", message = "週所定時間は80以下である必要があります") Double weeklyHours,
            @Min(value = 1, message = "週勤務日数は1以上である必要があります")
            @Max(value = 7, message = "週勤務日数は7以下である必要があります") Integer workDaysPerWeek) {
    }

    public record EmployeeDto(Long id, String name, Long organizationId, LocalDate employmentStartDate,
                              Double weeklyHours, Integer workDaysPerWeek) {
        static EmployeeDto from(Employee employee) {
            return new EmployeeDto(employee.getId(), employee.getName(), employee.getOrganization().getId(),
                    employee.getEmploymentStartDate(), employee.getWeeklyHours(), employee.getWorkDaysPerWeek());
        }
    }
}
