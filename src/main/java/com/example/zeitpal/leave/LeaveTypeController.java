package com.example.zeitpal.leave;

import com.example.zeitpal.common.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/leave-types")
public class LeaveTypeController {

    private final LeaveTypeService leaveTypeService;

    public LeaveTypeController(LeaveTypeService leaveTypeService) {
        this.leaveTypeService = leaveTypeService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<LeaveTypeDto>>> list(@RequestParam Long organizationId) {
        List<LeaveTypeDto> types = leaveTypeService.listFor(organizationId).stream()
                .map(LeaveTypeDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("休暇種別一覧を取得しました", types));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<LeaveTypeDto>> create(@Valid @RequestBody LeaveTypeRequest request) {
        LeaveType saved = leaveTypeService.create(request.organizationId(), request.toDraft());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("休暇種別を登録しました", LeaveTypeDto.from(saved)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ApiResponse<LeaveTypeDto>> setActive(@PathVariable Long id,
                                                               @Valid @RequestBody ActiveRequest request) {
        LeaveType saved = leaveTypeService.setActive(id, request.active());
        return ResponseEntity.ok(ApiResponse.success("休暇種別を更新しました", LeaveTypeDto.from(saved)));
    }

    public record LeaveTypeRequest(
            @NotNull(message = "組織IDは必須です") Long organizationId,
            @NotBlank(message = "種別コードは必須です") @Size(max = 30, message = "種別コードは30文字以下で入力してください") String code,
            @NotBlank(message = "種別名は必須です") @Size(max = 100, message = "種別名は100文字以下で入力してください") String name,
            Boolean paid,
            boolean hasAllowance,
            @DecimalMin(value = "0", message = "年間付与日数は0以上である必要があります") Double defaultDaysPerYear,
            boolean allowNegative,
            Boolean allowHalfDays,
            boolean requiresDocument,
            @Min(value = 0, message = "診断書要否の日数は0以上である必要があります") Integer documentRequiredAfterDays,
            boolean allowCarryover,
            @DecimalMin(value = "0", message = "繰越上限は0以上である必要があります") Double maxCarryoverDays,
            Integer sortOrder) {

        LeaveType toDraft() {
            LeaveType draft = new LeaveType(null, code, name.trim());
            draft.setPaid(paid == null || paid);
            draft.setHasAllowance(hasAllowance);
            draft.setDefaultDaysPerYear(defaultDaysPerYear);
            draft.setAllowNegative(allowNegative);
            draft.setAllowHalfDays(allowHalfDays == null || allowHalfDays);
            draft.setRequiresDocument(requiresDocument);
            draft.setDocumentRequiredAfterDays(documentRequiredAfterDays);
            draft.setAllowCarryover(allowCarryover);
            draft.setMaxCarryoverDays(maxCarryoverDays);
            draft.setSortOrder(sortOrder == null ? 100 : sortOrder);
            return draft;
        }
    }

    public record ActiveRequest(@NotNull(message = "有効・無効の指定は必須です") Boolean active) {}

    public record LeaveTypeDto(Long id, Long organizationId, String code, String name, boolean paid,
                               boolean hasAllowance, Double defaultDaysPerYear, boolean allowNegative,
                               boolean allowHalfDays, boolean requiresDocument, Integer documentRequiredAfterDays,
                               boolean allowCarryover, Double maxCarryoverDays, boolean active) {
        static LeaveTypeDto from(LeaveType type) {
            return new LeaveTypeDto(type.getId(),
                    type.isSystemDefault() ? null : type.getOrganization().getId(),
                    type.getCode(), type.getName(), !Boolean.FALSE.equals(type.getPaid()), type.hasAllowance(),
                    type.getDefaultDaysPerYear(), type.allowsNegative(), type.allowsHalfDays(),
                    type.requiresDocument(), type.getDocumentRequiredAfterDays(), type.allowsCarryover(),
                    type.getMaxCarryoverDays(), type.isActive());
        }
    }
}
