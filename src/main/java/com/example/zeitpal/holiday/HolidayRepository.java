package com.example.zeitpal.holiday;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface HolidayRepository extends JpaRepository<Holiday, Long> {

    List<Holiday> findByCountryCodeAndDateBetweenOrderByDateAsc(String countryCode, LocalDate start, LocalDate end);

    List<Holiday> findByCountryCodeOrderByDateAsc(String countryCode);

    List<Holiday> findAllByOrderByDateAsc();

    /**
     * 全国祝日 + 指定地域の祝日 (+ 指定組織の独自休業日)。
     */
    @Query("select distinct h.date from Holiday h " +
            "where h.countryCode = :country " +
            "and (h.regionCode is null or h.regionCode = :region) " +
            "and (h.organizationId is null or h.organizationId = :organizationId) " +
            "and h.date between :start and :end")
    List<LocalDate> findApplicableDates(@Param("country") String countryCode,
                                        @Param("region") String regionCode,
                                        @Param("organizationId") Long organizationId,
                                        @Param("start") LocalDate start,
                                        @Param("end") LocalDate end);
}
