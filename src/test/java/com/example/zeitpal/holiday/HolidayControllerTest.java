package com.example.zeitpal.holiday;

import com.example.zeitpal.config.CacheConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Objects;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class HolidayControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private HolidayRepository holidayRepository;

    @Autowired
    private CacheManager cacheManager;

    @BeforeEach
    void setUp() {
        holidayRepository.deleteAll();
        Objects.requireNonNull(cacheManager.getCache(CacheConfig.HOLIDAYS)).clear();
    }

    @Test
    void create_thenListDatesForRegion() throws Exception {
        mockMvc.perform(post("/api/holidays")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {
                      "date": "2024-01-06",
                      "name": "Heilige Drei Könige",
                      "countryCode": "de",
                      "regionCode": "by"
                    }
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.data.countryCode").value("DE"))
            .andExpect(jsonPath("$.data.regionCode").value("BY"));

        mockMvc.perform(get("/api/holidays/dates").param("country", "DE").param("region", "BY").param("year", "2024"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0]").value("2024-01-06"));

        mockMvc.perform(get("/api/holidays/dates").param("country", "DE").param("year", "2024"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(0));
    }

    @Test
    void create_duplicate_isConflict() throws Exception {
        holidayRepository.save(new Holiday(LocalDate.of(2024, 12, 25), "Weihnachten", "DE"));

        mockMvc.perform(post("/api/holidays")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {
                      "date": "2024-12-25",
                      "countryCode": "DE"
                    }
                    """))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("CONFLICT"));
    }

    @Test
    void create_missingDate_isValidationError() throws Exception {
        mockMvc.perform(post("/api/holidays")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"countryCode\": \"DE\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.date").value("日付は必須です"));
    }

    @Test
    void delete_unknownHoliday_isNotFound() throws Exception {
        mockMvc.perform(delete("/api/holidays/-1"))
            .andExpect(status().isNotFound());
    }
}
