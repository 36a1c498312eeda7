package com.example.zeitpal.holiday;

import com.example.zeitpal.common.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/holidays")
public class HolidayController {

    private final HolidayCalendarService holidayCalendarService;

    public HolidayController(HolidayCalendarService holidayCalendarService) {
        this.holidayCalendarService = holidayCalendarService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<HolidayDto>>> list(@RequestParam(required = false) String country,
                                                              @RequestParam(required = false) Integer year) {
        List<HolidayDto> holidays = holidayCalendarService.list(country, year).stream()
                .map(HolidayDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("祝日一覧を取得しました", holidays));
    }

    @GetMapping("/dates")
    public ResponseEntity<ApiResponse<List<LocalDate>>> dates(@RequestParam String country,
                                                              @RequestParam(required = false) String region,
                                                              @RequestParam int year) {
        List<LocalDate> dates = holidayCalendarService.holidaysFor(country, region, year).stream()
                .sorted()
                .toList();
        return ResponseEntity.ok(ApiResponse.success("休業日を取得しました", dates));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<HolidayDto>> create(@Valid @RequestBody HolidayRequest request) {
        Holiday holiday = new Holiday(request.date(), request.name(), request.countryCode(), request.regionCode());
        holiday.setOrganizationId(request.organizationId());
        Holiday saved = holidayCalendarService.save(holiday);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("祝日を登録しました", HolidayDto.from(saved)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<HolidayDto>> update(@PathVariable Long id,
                                                          @Valid @RequestBody HolidayRequest request) {
        Holiday holiday = holidayCalendarService.get(id);
        holiday.setDate(request.date());
        holiday.setName(request.name());
        holiday.setCountryCode(request.countryCode());
        holiday.setRegionCode(request.regionCode());
        holiday.setOrganizationId(request.organizationId());
        Holiday saved = holidayCalendarService.save(holiday);
        return ResponseEntity.ok(ApiResponse.success("祝日を更新しました", HolidayDto.from(saved)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable Long id) {
        holidayCalendarService.delete(id);
        return ResponseEntity.ok(ApiResponse.success("祝日を削除しました", null));
    }

    public record HolidayRequest(
            @NotNull(message = "日付は必須です") LocalDate date,
            @Size(max = 64, message = "名称は64文字以下で入力してください") String name,
            @NotBlank(message = "国コードは必須です") String countryCode,
            String regionCode,
            Long organizationId) {
    }

    public record HolidayDto(Long id, LocalDate date, String name, String countryCode, String regionCode,
                             Long organizationId) {
        static HolidayDto from(Holiday holiday) {
            return new HolidayDto(holiday.getId(), holiday.getDate(), holiday.getName(),
                    holiday.getCountryCode(), holiday.getRegionCode(), holiday.getOrganizationId());
        }
    }
}
