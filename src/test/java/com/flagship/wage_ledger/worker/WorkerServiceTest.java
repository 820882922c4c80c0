package com.flagship.wage_ledger.worker;

import com.flagship.wage_ledger.exception.ConflictException;
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

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Testcontainers
class WorkerServiceTest {

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
    private WorkerService workerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM settlement_lines");
        jdbcTemplate.update("DELETE FROM settlement_history");
        jdbcTemplate.update("DELETE FROM bonus_drafts");
        jdbcTemplate.update("DELETE FROM attendance_entries");
        jdbcTemplate.update("DELETE FROM ledger_transactions");
        jdbcTemplate.update("DELETE FROM holidays");
        jdbcTemplate.update("DELETE FROM workers");
    }

    @Test
    @DisplayName("New worker starts with a zero balance and the default standard day")
    void testCreateWorker() {
        Worker worker = workerService.createWorker(" W-010 ", "Kiran", new BigDecimal("120"), null, null);

        assertNotNull(worker.getId());
        assertEquals("W-010", worker.getCode());
        assertTrue(worker.isActive());
        assertEquals(0, BigDecimal.ZERO.compareTo(worker.getAdvanceBalance()));
        assertEquals(0, new BigDecimal("8").compareTo(worker.getStandardDailyHours()));
    }

    @Test
    @DisplayName("Duplicate worker code is a conflict")
    void testDuplicateCode() {
        workerService.createWorker("W-011", "Kiran", new BigDecimal("120"), null, true);

        assertThrows(ConflictException.class,
            () -> workerService.createWorker("W-011", "Someone Else", new BigDecimal("80"), null, true));
    }

    @Test
    @DisplayName("Non-positive rate and out-of-range daily hours are rejected")
    void testInvalidRates() {
        assertThrows(ValidationException.class,
            () -> workerService.createWorker("W-012", "Kiran", BigDecimal.ZERO, null, true));
        assertThrows(ValidationException.class,
            () -> workerService.createWorker("W-012", "Kiran", new BigDecimal("50"), new BigDecimal("25"), true));
    }

    @Test
    @DisplayName("Update keeps fields left null and inactive workers drop out of the active list")
    void testUpdateAndActiveList() {
        Worker a = workerService.createWorker("W-002", "Anil", new BigDecimal("100"), null, true);
        workerService.createWorker("W-001", "Bina", new BigDecimal("100"), null, true);

        Worker updated = workerService.updateWorker(a.getId(), null, new BigDecimal("110"), null, false);
        assertEquals("Anil", updated.getName());
        assertEquals(0, new BigDecimal("110").compareTo(updated.getHourlyRate()));
        assertFalse(updated.isActive());

        List<Worker> active = workerService.listActiveWorkers();
        assertEquals(1, active.size());
        assertEquals("W-001", active.get(0).getCode());

        List<Worker> all = workerService.listWorkers(false);
        assertEquals(List.of("W-001", "W-002"), all.stream().map(Worker::getCode).toList());
    }

    @Test
    @DisplayName("Unknown worker is not found")
    void testUnknownWorker() {
        assertThrows(NotFoundException.class, () -> workerService.getWorker(UUID.randomUUID()));
    }
}
