package com.flagship.wage_ledger.compensation.salary;

import com.flagship.wage_ledger.attendance.AttendanceService;
import com.flagship.wage_ledger.attendance.AttendanceStatus;
import com.flagship.wage_ledger.common.Period;
import com.flagship.wage_ledger.exception.ValidationException;
import com.flagship.wage_ledger.ledger.LedgerService;
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

@SpringBootTest
@Testcontainers
class SalaryServiceTest {

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

    private static final Period WEEK = Period.of(LocalDate.of(2024, 3, 4), LocalDate.of(2024, 3, 10));

    @Autowired
    private SalaryService salaryService;

    @Autowired
    private AttendanceService attendanceService;

    @Autowired
    private WorkerService workerService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID workerA;
    private UUID workerB;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM settlement_lines");
        jdbcTemplate.update("DELETE FROM settlement_history");
        jdbcTemplate.update("DELETE FROM bonus_drafts");
        jdbcTemplate.update("DELETE FROM attendance_entries");
        jdbcTemplate.update("DELETE FROM ledger_transactions");
        jdbcTemplate.update("DELETE FROM holidays");
        jdbcTemplate.update("DELETE FROM workers");

        workerA = workerService.createWorker("W-001", "Ravi", new BigDecimal("100"), new BigDecimal("8"), true).getId();
        workerB = workerService.createWorker("W-002", "Meena", new BigDecimal("50"), new BigDecimal("8"), true).getId();

        attendanceService.upsert(workerA, LocalDate.of(2024, 3, 4), AttendanceStatus.PRESENT, null, null);
        attendanceService.upsert(workerA, LocalDate.of(2024, 3, 5), AttendanceStatus.PRESENT, new BigDecimal("4"), null);
        attendanceService.upsert(workerB, LocalDate.of(2024, 3, 4), AttendanceStatus.HALF_DAY, null, null);
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
            "Expected " + expected + " but was " + actual);
    }

    private SalaryDraft draftOf(List<SalaryDraft> drafts, UUID workerId) {
        return drafts.stream().filter(d -> d.getWorkerId().equals(workerId)).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("Final amount is attendance pay less the deposit")
    void testSalaryDraft() {
        ledgerService.giveAdvance(workerA, new BigDecimal("3000"), null, null);

        List<SalaryDraft> drafts = salaryService.computeSalaryDraft(WEEK,
            Map.of(workerA, new SalaryAdjustment(new BigDecimal("200"), new BigDecimal("1000"))));
        drafts.forEach(draft -> System.out.println("OUTPUT - Draft: " + draft));

        SalaryDraft a = draftOf(drafts, workerA);
        assertAmount("12", a.getTotalHours());
        assertAmount("1200", a.getTotalPay());
        assertAmount("200", a.getDeposit());
        assertAmount("1000", a.getNewAdvance());
        assertAmount("1000", a.getFinalAmount());
        assertAmount("3000", a.getCurrentAdvanceBalance());

        SalaryDraft b = draftOf(drafts, workerB);
        assertAmount("200", b.getTotalPay());
        assertEquals(1, b.getDaysHalf());
        assertAmount("0", b.getDeposit());
        assertAmount("200", b.getFinalAmount());
    }

    @Test
    @DisplayName("Deposit larger than pay floors the final amount at zero")
    void testFinalAmountFloor() {
        SalaryDraft b = draftOf(salaryService.computeSalaryDraft(WEEK,
            Map.of(workerB, new SalaryAdjustment(new BigDecimal("500"), null))), workerB);

        assertAmount("0", b.getFinalAmount());
    }

    @Test
    @DisplayName("Drafts do not touch the ledger")
    void testDraftIsReadOnly() {
        salaryService.computeSalaryDraft(WEEK,
            Map.of(workerA, new SalaryAdjustment(new BigDecimal("100"), new BigDecimal("100"))));

        assertTrue(ledgerService.getHistory(workerA).isEmpty());
        assertAmount("0", ledgerService.getBalance(workerA));
    }

    @Test
    @DisplayName("Negative adjustments and adjustments for unknown workers are rejected")
    void testInvalidAdjustments() {
        assertThrows(ValidationException.class, () -> salaryService.computeSalaryDraft(WEEK,
            Map.of(workerA, new SalaryAdjustment(new BigDecimal("-1"), null))));
        assertThrows(ValidationException.class, () -> salaryService.computeSalaryDraft(WEEK,
            Map.of(UUID.randomUUID(), SalaryAdjustment.none())));
    }
}
