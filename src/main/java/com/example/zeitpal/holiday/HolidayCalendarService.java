package com.example.zeitpal.holiday;

import com.example.zeitpal.calendar.CalendarUtils;
import com.example.zeitpal.calendar.DateRange;
import com.example.zeitpal.config.CacheConfig;
import com.example.zeitpal.exception.BusinessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 祝日カレンダー。国・地域・年単位で休業日の集合を返す。
 */
@Service
public class HolidayCalendarService {

    private static final Logger logger = LoggerFactory.getLogger(HolidayCalendarService.class);

    private final HolidayRepository holidayRepository;
    // 年単位のキャッシュを経由させるためのプロキシ
    private final HolidayCalendarService self;

    public HolidayCalendarService(HolidayRepository holidayRepository, @Lazy HolidayCalendarService self) {
        this.holidayRepository = holidayRepository;
        this.self = self;
    }

    @Transactional(readOnly = true)
    @Cacheable(cacheNames = CacheConfig.HOLIDAYS, key = "{#countryCode, #regionCode, #year}")
    public Set<LocalDate> holidaysFor(String countryCode, String regionCode, int year) {
        return load(countryCode, regionCode, null, year);
    }

    @Transactional(readOnly = true)
    @Cacheable(cacheNames = CacheConfig.HOLIDAYS, key = "{#countryCode, #regionCode, #organizationId, #year}")
    public Set<LocalDate> holidaysFor(String countryCode, String regionCode, Long organizationId, int year) {
        return load(countryCode, regionCode, organizationId, year);
    }

    /**
     * Holidays inside the range, taken from the cached calendar of every year it touches.
     */
    @Transactional(readOnly = true)
    public Set<LocalDate> holidaysBetween(String countryCode, String regionCode, Long organizationId, DateRange range) {
        Set<LocalDate> holidays = new HashSet<>();
        for (Integer year : CalendarUtils.yearsSpanned(range)) {
            self.holidaysFor(countryCode, regionCode, organizationId, year).stream()
                    .filter(range::contains)
                    .forEach(holidays::add);
        }
        return Set.copyOf(holidays);
    }

    private Set<LocalDate> load(String countryCode, String regionCode, Long organizationId, int year) {
        String country = Holiday.normalizeCode(countryCode);
        if (country == null) {
            return Set.of();
        }
        List<LocalDate> dates = holidayRepository.findApplicableDates(country, Holiday.normalizeCode(regionCode),
                organizationId, LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
        logger.debug("祝日を読み込みました country={} region={} year={} count={}",
                country, regionCode, year, dates.size());
        return Set.copyOf(dates);
    }

    @Transactional(readOnly = true)
    public List<Holiday> list(String countryCode, Integer year) {
        String country = Holiday.normalizeCode(countryCode);
        if (country == null) {
            return holidayRepository.findAllByOrderByDateAsc().stream()
                    .filter(h -> year == null || h.getDate().getYear() == year)
                    .toList();
        }
        if (year == null) {
            return holidayRepository.findByCountryCodeOrderByDateAsc(country);
        }
        return holidayRepository.findByCountryCodeAndDateBetweenOrderByDateAsc(country,
                LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
    }

    @Transactional
    @CacheEvict(cacheNames = CacheConfig.HOLIDAYS, allEntries = true)
    public Holiday save(Holiday holiday) {
        boolean duplicate = holidayRepository
                .findByCountryCodeAndDateBetweenOrderByDateAsc(holiday.getCountryCode(), holiday.getDate(), holiday.getDate())
                .stream()
                .anyMatch(existing -> !existing.getId().equals(holiday.getId())
                        && Objects.equals(existing.getRegionCode(), holiday.getRegionCode())
                        && Objects.equals(existing.getOrganizationId(), holiday.getOrganizationId()));
        if (duplicate) {
            throw new BusinessException(BusinessException.CONFLICT, "同じ日付の祝日が既に登録されています");
        }
        Holiday saved = holidayRepository.save(holiday);
        logger.info("祝日を登録しました {} {} ({}{})", saved.getDate(), saved.getName(), saved.getCountryCode(),
                saved.getRegionCode() == null ? "" : "-" + saved.getRegionCode());
        return saved;
    }

    @Transactional
    @CacheEvict(cacheNames = CacheConfig.HOLIDAYS, allEntries = true)
    public void delete(Long id) {
        if (!holidayRepository.existsById(id)) {
            throw BusinessException.notFound("祝日が見つかりません (ID=" + id + ")");
        }
        holidayRepository.deleteById(id);
        logger.info("祝日を削除しました ID={}", id);
    }

    @Transactional(readOnly = true)
    public Holiday get(Long id) {
        return holidayRepository.findById(id)
                .orElseThrow(() -> BusinessException.notFound("祝日が見つかりません (ID=" + id + ")"));
    }
}
