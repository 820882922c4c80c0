package com.flagship.wage_ledger.holiday;

import com.flagship.wage_ledger.exception.NotFoundException;
import com.flagship.wage_ledger.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Testcontainers
class HolidayServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("wage_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private HolidayService holidayService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM holidays");
    }

    @Test
    @DisplayName("Upsert on an existing date renames the holiday instead of adding one")
    void testUpsertRenames() {
        LocalDate day = LocalDate.of(2024, 8, 15);
        Holiday first = holidayService.upsertHoliday(day, "Independence", null);
        Holiday renamed = holidayService.upsertHoliday(day, "Independence Day", "National holiday");

        assertEquals(first.getId(), renamed.getId());
        assertEquals("Independence Day", renamed.getName());
        assertEquals(1, holidayService.listHolidays(null).size());
        assertTrue(holidayService.isHoliday(day));
    }

    @Test
    @DisplayName("Listing by year returns that year's holidays in date order")
    void testListByYear() {
        holidayService.upsertHoliday(LocalDate.of(2024, 10, 2), "Gandhi Jayanti", null);
        holidayService.upsertHoliday(LocalDate.of(2024, 1, 26), "Republic Day", null);
        holidayService.upsertHoliday(LocalDate.of(2025, 1, 26), "Republic Day", null);

        List<Holiday> holidays = holidayService.listHolidays(2024);

        assertEquals(2, holidays.size());
        assertEquals(LocalDate.of(2024, 1, 26), holidays.get(0).getDate());
    }

    @Test
    @DisplayName("Deleted holiday no longer marks its date")
    void testDelete() {
        Holiday holiday = holidayService.upsertHoliday(LocalDate.of(2024, 3, 25), "Holi", null);

        holidayService.deleteHoliday(holiday.getId());

        assertFalse(holidayService.isHoliday(LocalDate.of(2024, 3, 25)));
        assertThrows(NotFoundException.class, () -> holidayService.deleteHoliday(holiday.getId()));
    }

    @Test
    @DisplayName("Holiday needs a name")
    void testNameRequired() {
        assertThrows(ValidationException.class,
            () -> holidayService.upsertHoliday(LocalDate.of(2024, 3, 25), " ", null));
    }
}
