package com.flagship.wage_ledger.settlement;

import com.flagship.wage_ledger.attendance.AttendanceService;
import com.flagship.wage_ledger.attendance.AttendanceStatus;
import com.flagship.wage_ledger.common.Period;
import com.flagship.wage_ledger.compensation.bonus.BonusDraft;
import com.flagship.wage_ledger.compensation.bonus.BonusService;
import com.flagship.wage_ledger.compensation.salary.SalaryAdjustment;
import com.flagship.wage_ledger.exception.ConflictException;
import com.flagship.wage_ledger.exception.NotFoundException;
import com.flagship.wage_ledger.exception.SettlementFailedException;
import com.flagship.wage_ledger.exception.ValidationException;
import com.flagship.wage_ledger.ledger.LedgerService;
import com.flagship.wage_ledger.ledger.LedgerTransaction;
import com.flagship.wage_ledger.ledger.TransactionKind;
import com.flagship.wage_ledger.worker.WorkerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
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
 * Settlement finalize and history.
 *
 * The failure tests check that a batch which breaks at one worker leaves no trace:
 * balances, transaction counts, draft state and the history list all stay as they were.
 */
@SpringBootTest
@Testcontainers
class SettlementServiceTest {

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
    private SettlementService settlementService;

    @Autowired
    private BonusService bonusService;

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
        workerB = workerService.createWorker("W-002", "Meena", new BigDecimal("100"), new BigDecimal("8"), true).getId();

        attendanceService.upsert(workerA, LocalDate.of(2024, 3, 4), AttendanceStatus.PRESENT, null, null);
        attendanceService.upsert(workerB, LocalDate.of(2024, 3, 4), AttendanceStatus.PRESENT, null, null);
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
            "Expected " + expected + " but was " + actual);
    }

    private int transactionCount(UUID workerId) {
        return ledgerService.getHistory(workerId).size();
    }

    private SettlementLine lineOf(SettlementHistory history, UUID workerId) {
        return history.getLines().stream()
            .filter(line -> line.getWorkerId().equals(workerId))
            .findFirst()
            .orElseThrow();
    }

    @Nested
    @DisplayName("Salary settlement")
    class SalarySettlement {

        @Test
        @DisplayName("Finalize posts the deposit before the new advance and snapshots the balance")
        void testFinalizeSalary() {
            printTestHeader("Finalize Salary");

            // Given: worker A owes 5000
            ledgerService.giveAdvance(workerA, new BigDecimal("5000"), null, null);

            // When: A deposits 2000 out of salary and takes a new advance of 1000
            SettlementHistory history = settlementService.finalizeSalary(MARCH,
                Map.of(workerA, new SalaryAdjustment(new BigDecimal("2000"), new BigDecimal("1000"))),
                "March wages");
            printOutput("Snapshot", history);

            // Then
            List<LedgerTransaction> txns = ledgerService.getHistory(workerA);
            assertEquals(3, txns.size());
            assertEquals(TransactionKind.DEPOSIT, txns.get(1).getKind());
            assertAmount("3000", txns.get(1).getBalanceAfter());
            assertEquals(TransactionKind.ADVANCE, txns.get(2).getKind());
            assertAmount("4000", txns.get(2).getBalanceAfter());

            assertEquals(SettlementKind.SALARY, history.getKind());
            assertEquals(2, history.getWorkerCount());
            assertEquals("W-001", history.getLines().get(0).getWorkerCode());
            assertEquals("Ravi", history.getLines().get(0).getWorkerName());

            SettlementLine a = lineOf(history, workerA);
            assertAmount("800", a.getBaseAmount());
            assertAmount("8", a.getHoursWorked());
            assertAmount("2000", a.getDeposit());
            assertAmount("0", a.getFinalAmount());
            assertAmount("4000", a.getAdvanceBalanceAtSave());

            assertAmount("2000", history.getTotalDeposit());
            assertAmount("1000", history.getTotalNewAdvance());
            assertAmount("800", history.getTotalFinalAmount());
            assertAmount("4000", history.getTotalAdvanceDue());
            assertEquals("March wages", history.getNotes());

            SettlementHistory reloaded = settlementService.getHistory(history.getId());
            assertEquals(2, reloaded.getLines().size());
            assertAmount("4000", lineOf(reloaded, workerA).getAdvanceBalanceAtSave());
            printSuccess("Postings and snapshot agree");
        }

        @Test
        @DisplayName("Deleting a snapshot keeps the ledger postings it made")
        void testDeleteHistoryKeepsLedger() {
            printTestHeader("Delete History");

            ledgerService.giveAdvance(workerA, new BigDecimal("5000"), null, null);
            SettlementHistory history = settlementService.finalizeSalary(MARCH,
                Map.of(workerA, new SalaryAdjustment(new BigDecimal("2000"), null)), null);

            BigDecimal balanceBefore = ledgerService.getBalance(workerA);
            int countBefore = transactionCount(workerA);
            printOutput("Balance before delete", balanceBefore);

            settlementService.deleteHistory(history.getId());

            assertAmount(balanceBefore.toPlainString(), ledgerService.getBalance(workerA));
            assertAmount("3000", ledgerService.getBalance(workerA));
            assertEquals(countBefore, transactionCount(workerA));
            assertTrue(settlementService.listHistory(SettlementFilter.builder().build()).isEmpty());
            assertThrows(NotFoundException.class, () -> settlementService.getHistory(history.getId()));
            printSuccess("Snapshot gone, ledger intact");
        }

        @Test
        @DisplayName("A failing worker rolls back every posting of the batch")
        void testFailureRollsBackBatch() {
            printTestHeader("Batch Rollback");

            // Given: A owes 1000, B owes nothing
            ledgerService.giveAdvance(workerA, new BigDecimal("1000"), null, null);

            // When: A deposits 500 (fine) and B deposits 100 (overdraft)
            SettlementFailedException e = assertThrows(SettlementFailedException.class,
                () -> settlementService.finalizeSalary(MARCH, Map.of(
                    workerA, new SalaryAdjustment(new BigDecimal("500"), null),
                    workerB, new SalaryAdjustment(new BigDecimal("100"), null)), null));
            printExpectedException("SettlementFailedException", e.getMessage());

            // Then: B is named and A's deposit is gone
            assertEquals(workerB, e.getWorkerId());
            assertEquals("W-002", e.getWorkerCode());
            assertEquals("InsufficientBalance", e.getReason());

            assertAmount("1000", ledgerService.getBalance(workerA));
            assertEquals(1, transactionCount(workerA));
            assertAmount("0", ledgerService.getBalance(workerB));
            assertEquals(0, transactionCount(workerB));
            assertTrue(settlementService.listHistory(SettlementFilter.builder().build()).isEmpty());
            assertTrue(ledgerService.reconcile(workerA).isConsistent());
            printSuccess("Nothing persisted from the failed batch");
        }

        @Test
        @DisplayName("Settlement with no active workers is rejected")
        void testNoWorkers() {
            workerService.updateWorker(workerA, null, null, null, false);
            workerService.updateWorker(workerB, null, null, null, false);

            assertThrows(ValidationException.class, () -> settlementService.finalizeSalary(MARCH, Map.of(), null));
        }
    }

    @Nested
    @DisplayName("Bonus settlement")
    class BonusSettlement {

        @Test
        @DisplayName("Finalize posts draft deposits and advances and freezes the drafts")
        void testFinalizeBonus() {
            printTestHeader("Finalize Bonus");

            ledgerService.giveAdvance(workerA, new BigDecimal("3000"), null, null);
            List<BonusDraft> drafts = bonusService.computeAndSaveBonusDrafts(MARCH, BigDecimal.ZERO, true);
            UUID draftA = drafts.stream().filter(d -> d.getWorkerId().equals(workerA)).findFirst().orElseThrow().getId();
            UUID draftB = drafts.stream().filter(d -> d.getWorkerId().equals(workerB)).findFirst().orElseThrow().getId();
            bonusService.addEmployeeDeposit(draftA, new BigDecimal("3000"), null);
            bonusService.setNewAdvance(draftB, new BigDecimal("1500"), null);

            SettlementHistory history = settlementService.finalizeBonus(MARCH, "Diwali bonus");
            printOutput("Snapshot", history);

            assertEquals(SettlementKind.BONUS, history.getKind());
            assertAmount("0", ledgerService.getBalance(workerA));
            assertAmount("1500", ledgerService.getBalance(workerB));
            assertAmount("21000", lineOf(history, workerA).getFinalAmount());
            assertAmount("24000", lineOf(history, workerB).getFinalAmount());
            assertAmount("1500", history.getTotalAdvanceDue());
            assertAmount("48000", history.getTotalBase());

            assertTrue(bonusService.getBonusDraft(draftA).isFinalized());
            assertThrows(ConflictException.class,
                () -> bonusService.addExtraBonus(draftA, new BigDecimal("100"), null));
            assertThrows(ConflictException.class, () -> settlementService.finalizeBonus(MARCH, null));
            printSuccess("Bonus settled once and frozen");
        }

        @Test
        @DisplayName("Recompute after finalize returns the frozen drafts unchanged")
        void testRecomputeAfterFinalize() {
            bonusService.computeAndSaveBonusDrafts(MARCH, BigDecimal.ZERO, true);
            settlementService.finalizeBonus(MARCH, null);

            attendanceService.upsert(workerA, LocalDate.of(2024, 3, 5), AttendanceStatus.ABSENT, null, null);
            List<BonusDraft> recomputed = bonusService.computeAndSaveBonusDrafts(MARCH, new BigDecimal("50"), true);

            BonusDraft a = recomputed.stream().filter(d -> d.getWorkerId().equals(workerA)).findFirst().orElseThrow();
            assertTrue(a.isFinalized());
            assertEquals(0, a.getDaysAbsent());
            assertAmount("24000", a.getNetBonus());
        }

        @Test
        @DisplayName("Failed bonus finalize leaves the drafts open")
        void testFailedBonusFinalizeLeavesDraftsOpen() {
            printTestHeader("Failed Bonus Finalize");

            List<BonusDraft> drafts = bonusService.computeAndSaveBonusDrafts(MARCH, BigDecimal.ZERO, true);
            UUID draftA = drafts.stream().filter(d -> d.getWorkerId().equals(workerA)).findFirst().orElseThrow().getId();
            // A owes nothing, so depositing from the bonus cannot be posted
            bonusService.addEmployeeDeposit(draftA, new BigDecimal("1000"), null);

            SettlementFailedException e = assertThrows(SettlementFailedException.class,
                () -> settlementService.finalizeBonus(MARCH, null));
            printExpectedException("SettlementFailedException", e.getMessage());

            assertEquals(workerA, e.getWorkerId());
            assertFalse(bonusService.getBonusDraft(draftA).isFinalized());
            assertEquals(0, transactionCount(workerA));
            assertTrue(settlementService.listHistory(SettlementFilter.builder().build()).isEmpty());
        }

        @Test
        @DisplayName("Finalize without stored drafts is rejected")
        void testFinalizeWithoutDrafts() {
            assertThrows(ValidationException.class, () -> settlementService.finalizeBonus(MARCH, null));
        }
    }

    @Test
    @DisplayName("History filters by kind and by period")
    void testListHistoryFilters() {
        bonusService.computeAndSaveBonusDrafts(MARCH, BigDecimal.ZERO, true);
        settlementService.finalizeBonus(MARCH, null);
        settlementService.finalizeSalary(MARCH, Map.of(), null);
        settlementService.finalizeSalary(Period.of(LocalDate.of(2024, 4, 1), LocalDate.of(2024, 4, 30)), Map.of(), null);

        assertEquals(3, settlementService.listHistory(SettlementFilter.builder().build()).size());
        assertEquals(1, settlementService.listHistory(
            SettlementFilter.builder().kind(SettlementKind.BONUS).build()).size());
        assertEquals(2, settlementService.listHistory(SettlementFilter.builder()
            .from(LocalDate.of(2024, 3, 1))
            .to(LocalDate.of(2024, 3, 31))
            .build()).size());
        assertEquals(1, settlementService.listHistory(SettlementFilter.builder()
            .kind(SettlementKind.SALARY)
            .from(LocalDate.of(2024, 4, 1))
            .build()).size());
    }
}
