package com.flagship.wage_ledger.attendance;

import com.flagship.wage_ledger.common.Period;
import com.flagship.wage_ledger.exception.NotFoundException;
import com.flagship.wage_ledger.exception.ValidationException;
import com.flagship.wage_ledger.holiday.HolidayService;
import com.flagship.wage_ledger.worker.WorkerService;
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

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Attendance upserts and period aggregation.
 */
@SpringBootTest
@Testcontainers
class AttendanceServiceTest {

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

    private static final Period MARCH = Period.of(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31));

    @Autowired
    private AttendanceService attendanceService;

    @Autowired
    private WorkerService workerService;

    @Autowired
    private HolidayService holidayService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID workerId;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM settlement_lines");
        jdbcTemplate.update("DELETE FROM settlement_history");
        jdbcTemplate.update("DELETE FROM bonus_drafts");
        jdbcTemplate.update("DELETE FROM attendance_entries");
        jdbcTemplate.update("DELETE FROM ledger_transactions");
        jdbcTemplate.update("DELETE FROM holidays");
        jdbcTemplate.update("DELETE FROM workers");

        workerId = workerService.createWorker("W-001", "Ravi", new BigDecimal("100"), new BigDecimal("8"), true).getId();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
            "Expected " + expected + " but was " + actual);
    }

    private int entryRows() {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM attendance_entries WHERE worker_id = ?", Integer.class, workerId);
        return count != null ? count : 0;
    }

    @Test
    @DisplayName("Second upsert for the same day replaces the first")
    void testUpsertReplaces() {
        printTestHeader("Upsert Replaces");

        LocalDate day = LocalDate.of(2024, 3, 4);
        attendanceService.upsert(workerId, day, AttendanceStatus.PRESENT, new BigDecimal("8"), null);
        AttendanceEntry latest = attendanceService.upsert(workerId, day, AttendanceStatus.PRESENT, new BigDecimal("6"), "Left early");
        printOutput("Latest entry", latest);

        assertEquals(1, entryRows(), "Exactly one row per worker and day");
        List<AttendanceEntry> entries = attendanceService.listEntries(workerId, null, null);
        assertEquals(1, entries.size());
        assertAmount("6", entries.get(0).getHoursWorked());
        assertAmount("600", entries.get(0).getTotalPay());
        assertEquals("Left early", entries.get(0).getNotes());
    }

    @Test
    @DisplayName("Status change on upsert recomputes stored hours and pay")
    void testUpsertStatusChange() {
        LocalDate day = LocalDate.of(2024, 3, 5);
        attendanceService.upsert(workerId, day, AttendanceStatus.PRESENT, null, null);
        AttendanceEntry absent = attendanceService.upsert(workerId, day, AttendanceStatus.ABSENT, null, null);

        assertEquals(AttendanceStatus.ABSENT, absent.getStatus());
        assertAmount("0", absent.getHoursWorked());
        assertAmount("0", absent.getTotalPay());
        assertEquals(1, entryRows());
    }

    @Test
    @DisplayName("Period totals count present, half and absent days")
    void testAggregate() {
        printTestHeader("Aggregate");

        attendanceService.upsert(workerId, LocalDate.of(2024, 3, 4), AttendanceStatus.PRESENT, null, null);
        attendanceService.upsert(workerId, LocalDate.of(2024, 3, 5), AttendanceStatus.PRESENT, new BigDecimal("10"), null);
        attendanceService.upsert(workerId, LocalDate.of(2024, 3, 6), AttendanceStatus.HALF_DAY, null, null);
        attendanceService.upsert(workerId, LocalDate.of(2024, 3, 7), AttendanceStatus.ABSENT, null, null);
        // Outside the period
        attendanceService.upsert(workerId, LocalDate.of(2024, 4, 1), AttendanceStatus.PRESENT, null, null);

        AttendanceTotals totals = attendanceService.totalsFor(MARCH, workerId);
        printOutput("Totals", totals);

        assertAmount("22", totals.getTotalHours());
        assertAmount("2200", totals.getTotalPay());
        assertEquals(2, totals.getDaysPresent());
        assertEquals(1, totals.getDaysHalf());
        assertEquals(1, totals.getDaysAbsent());
        assertEquals(4, totals.getEntryCount());
    }

    @Test
    @DisplayName("Calendar holiday defaults the status and counts as a paid standard day")
    void testHolidayDefault() {
        printTestHeader("Holiday Default");

        LocalDate holiday = LocalDate.of(2024, 3, 25);
        holidayService.upsertHoliday(holiday, "Holi", null);

        AttendanceEntry entry = attendanceService.upsert(workerId, holiday, null, null, null);
        printOutput("Entry", entry);

        assertEquals(AttendanceStatus.HOLIDAY, entry.getStatus());
        assertAmount("0", entry.getHoursWorked());

        AttendanceTotals totals = attendanceService.totalsFor(MARCH, workerId);
        assertAmount("8", totals.getTotalHours());
        assertAmount("800", totals.getTotalPay());
        assertEquals(1, totals.getDaysPresent());
    }

    @Test
    @DisplayName("Ordinary day without a status defaults to present")
    void testPresentDefault() {
        AttendanceEntry entry = attendanceService.upsert(workerId, LocalDate.of(2024, 3, 26), null, null, null);
        assertEquals(AttendanceStatus.PRESENT, entry.getStatus());
        assertAmount("8", entry.getHoursWorked());
    }

    @Test
    @DisplayName("Aggregate over all workers omits workers without entries")
    void testAggregateAllWorkers() {
        UUID idle = workerService.createWorker("W-002", "Meena", new BigDecimal("90"), null, true).getId();
        attendanceService.upsert(workerId, LocalDate.of(2024, 3, 4), AttendanceStatus.PRESENT, null, null);

        Map<UUID, AttendanceTotals> totals = attendanceService.aggregate(MARCH, null);

        assertTrue(totals.containsKey(workerId));
        assertFalse(totals.containsKey(idle));
        assertEquals(0, attendanceService.totalsFor(MARCH, idle).getEntryCount());
    }

    @Test
    @DisplayName("Invalid hours and unknown workers are rejected")
    void testRejections() {
        LocalDate day = LocalDate.of(2024, 3, 4);
        assertThrows(ValidationException.class,
            () -> attendanceService.upsert(workerId, day, AttendanceStatus.PRESENT, new BigDecimal("25"), null));
        assertThrows(NotFoundException.class,
            () -> attendanceService.upsert(UUID.randomUUID(), day, AttendanceStatus.PRESENT, null, null));
        assertEquals(0, entryRows());
    }

    @Test
    @DisplayName("Deleted entry no longer counts")
    void testDeleteEntry() {
        AttendanceEntry entry = attendanceService.upsert(workerId, LocalDate.of(2024, 3, 4), AttendanceStatus.PRESENT, null, null);

        attendanceService.deleteEntry(entry.getId());

        assertEquals(0, attendanceService.totalsFor(MARCH, workerId).getEntryCount());
        assertThrows(NotFoundException.class, () -> attendanceService.deleteEntry(entry.getId()));
    }
}
