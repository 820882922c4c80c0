package com.flagship.wage_ledger.ledger;

import com.flagship.wage_ledger.common.Money;
import com.flagship.wage_ledger.exception.InsufficientBalanceException;
import com.flagship.wage_ledger.exception.NotFoundException;
import com.flagship.wage_ledger.exception.ValidationException;
import com.flagship.wage_ledger.observability.CorrelationContext;
import com.flagship.wage_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Service for posting advance/repayment/deposit transactions to the worker ledger.
 *
 * This service enforces the core invariants:
 * 1. A worker's balance never goes negative
 * 2. Every transaction records the balance it produced, and the worker row caches
 *    the balance of its latest transaction
 * 3. Ledger transactions are immutable once written
 *
 * Uses JDBC directly: the worker row is locked with SELECT ... FOR UPDATE so postings
 * for one worker serialize, while different workers proceed concurrently.
 */
@Service
@Slf4j
public class LedgerService {

    private static final String TRANSACTION_COLUMNS =
        "id, worker_id, kind, amount, txn_date, balance_after, notes, sequence_number, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final LedgerMetrics metrics;

    public LedgerService(JdbcTemplate jdbcTemplate, LedgerMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.metrics = metrics;
    }

    /**
     * Posts a transaction to a worker's ledger.
     *
     * This method:
     * 1. Validates the amount (> 0)
     * 2. Locks the worker row
     * 3. Rejects a debit larger than the current balance
     * 4. Inserts the transaction and updates the cached balance and lifetime totals
     *
     * Joins the caller's transaction when there is one, so a settlement batch rolls
     * back every posting it made.
     *
     * @param date posting day; today when null
     * @return the stored transaction
     * @throws ValidationException if the amount is missing, zero or negative
     * @throws InsufficientBalanceException if a debit exceeds the balance
     * @throws NotFoundException if the worker does not exist
     */
    @Transactional
    public LedgerTransaction appendTransaction(UUID workerId, TransactionKind kind, BigDecimal amount,
                                               LocalDate date, String notes) {
        if (kind == null) {
            throw new ValidationException("Transaction kind is required");
        }
        BigDecimal postedAmount = Money.requirePositive(amount, "Amount");
        LocalDate postingDate = date != null ? date : LocalDate.now();

        long start = System.currentTimeMillis();
        String previousWorker = CorrelationContext.putWorkerId(workerId);
        try {
            BigDecimal balance = lockBalance(workerId);

            if (kind.isDebit() && postedAmount.compareTo(balance) > 0) {
                metrics.recordTransaction(kind.name(), "insufficient_balance");
                log.warn("Rejected {} of {}: balance is {}", kind, postedAmount, balance);
                throw new InsufficientBalanceException(workerId, balance, postedAmount);
            }

            BigDecimal newBalance = updateBalance(workerId, kind, postedAmount, balance);

            UUID transactionId = UUID.randomUUID();
            jdbcTemplate.update(
                "INSERT INTO ledger_transactions (id, worker_id, kind, amount, txn_date, balance_after, notes, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
                transactionId,
                workerId,
                kind.name(),
                postedAmount,
                postingDate,
                newBalance,
                notes
            );

            LedgerTransaction posted = jdbcTemplate.queryForObject(
                "SELECT " + TRANSACTION_COLUMNS + " FROM ledger_transactions WHERE id = ?",
                transactionRowMapper(),
                transactionId
            );

            metrics.recordTransaction(kind.name(), "posted");
            log.info("Posted {} of {} on {}: balance {} -> {}", kind, postedAmount, postingDate, balance, newBalance);
            return posted;
        } finally {
            metrics.recordLatency("append_transaction", System.currentTimeMillis() - start);
            CorrelationContext.restoreWorkerId(previousWorker);
        }
    }

    @Transactional
    public LedgerTransaction giveAdvance(UUID workerId, BigDecimal amount, LocalDate date, String notes) {
        return appendTransaction(workerId, TransactionKind.ADVANCE, amount, date, notes);
    }

    @Transactional
    public LedgerTransaction recordRepayment(UUID workerId, BigDecimal amount, LocalDate date, String notes) {
        return appendTransaction(workerId, TransactionKind.REPAYMENT, amount, date, notes);
    }

    @Transactional
    public LedgerTransaction recordDeposit(UUID workerId, BigDecimal amount, LocalDate date, String notes) {
        return appendTransaction(workerId, TransactionKind.DEPOSIT, amount, date, notes);
    }

    /**
     * Full history of a worker in posting order.
     */
    @Transactional(readOnly = true)
    public List<LedgerTransaction> getHistory(UUID workerId) {
        getBalance(workerId);
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM ledger_transactions WHERE worker_id = ? ORDER BY sequence_number",
            transactionRowMapper(),
            workerId
        );
    }

    /**
     * Cached balance of the worker. Balances are stored, and {@link #reconcile(UUID)}
     * proves them against the history.
     */
    @Transactional(readOnly = true)
    public BigDecimal getBalance(UUID workerId) {
        List<BigDecimal> balances = jdbcTemplate.queryForList(
            "SELECT advance_balance FROM workers WHERE id = ?",
            BigDecimal.class,
            workerId
        );
        if (balances.isEmpty()) {
            throw NotFoundException.of("Worker", workerId);
        }
        return Money.of(balances.get(0));
    }

    /**
     * Transactions matching the filter, newest first.
     */
    @Transactional(readOnly = true)
    public List<LedgerTransaction> listTransactions(TransactionFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT " + TRANSACTION_COLUMNS + " FROM ledger_transactions WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (filter.getWorkerId() != null) {
            sql.append(" AND worker_id = ?");
            args.add(filter.getWorkerId());
        }
        if (filter.getKind() != null) {
            sql.append(" AND kind = ?");
            args.add(filter.getKind().name());
        }
        if (filter.getFrom() != null) {
            sql.append(" AND txn_date >= ?");
            args.add(filter.getFrom());
        }
        if (filter.getTo() != null) {
            sql.append(" AND txn_date <= ?");
            args.add(filter.getTo());
        }
        sql.append(" ORDER BY sequence_number DESC");
        return jdbcTemplate.query(sql.toString(), transactionRowMapper(), args.toArray());
    }

    /**
     * Balance and lifetime totals of every active worker, by worker code.
     */
    @Transactional(readOnly = true)
    public List<WorkerBalance> summary() {
        return jdbcTemplate.query(
            "SELECT id, code, name, advance_balance, total_advance_taken, total_advance_repaid " +
            "FROM workers WHERE active = TRUE ORDER BY code",
            (rs, rowNum) -> new WorkerBalance(
                UUID.fromString(rs.getString("id")),
                rs.getString("code"),
                rs.getString("name"),
                Money.of(rs.getBigDecimal("advance_balance")),
                Money.of(rs.getBigDecimal("total_advance_taken")),
                Money.of(rs.getBigDecimal("total_advance_repaid"))
            )
        );
    }

    /**
     * Folds the worker's history and checks every balance link and the cached balance.
     * Drift is logged and counted, never repaired.
     */
    @Transactional(readOnly = true)
    public ReconciliationResult reconcile(UUID workerId) {
        BigDecimal cached = getBalance(workerId);
        List<LedgerTransaction> history = getHistory(workerId);

        BigDecimal running = Money.zero();
        BigDecimal priorBalanceAfter = Money.zero();
        List<Long> brokenLinks = new ArrayList<>();
        for (LedgerTransaction txn : history) {
            running = txn.getKind().apply(running, txn.getAmount());
            // Links chain on the stored balance_after, not the running fold
            BigDecimal expectedAfter = txn.getKind().apply(priorBalanceAfter, txn.getAmount());
            if (expectedAfter.compareTo(txn.getBalanceAfter()) != 0) {
                brokenLinks.add(txn.getSequenceNumber());
            }
            priorBalanceAfter = txn.getBalanceAfter();
        }

        ReconciliationResult result = ReconciliationResult.builder()
            .workerId(workerId)
            .cachedBalance(cached)
            .computedBalance(Money.of(running))
            .transactionCount(history.size())
            .brokenLinks(List.copyOf(brokenLinks))
            .build();

        if (!result.isConsistent()) {
            metrics.recordDrift();
            log.warn("Ledger drift for worker {}: cached={}, computed={}, broken links at {}",
                workerId, cached, running, brokenLinks);
        }
        return result;
    }

    @Transactional(readOnly = true)
    public List<ReconciliationResult> reconcileAll() {
        List<UUID> workerIds = jdbcTemplate.query(
            "SELECT id FROM workers ORDER BY code",
            (rs, rowNum) -> UUID.fromString(rs.getString("id"))
        );
        return workerIds.stream().map(this::reconcile).toList();
    }

    private BigDecimal lockBalance(UUID workerId) {
        List<BigDecimal> balances = jdbcTemplate.queryForList(
            "SELECT advance_balance FROM workers WHERE id = ? FOR UPDATE",
            BigDecimal.class,
            workerId
        );
        if (balances.isEmpty()) {
            throw NotFoundException.of("Worker", workerId);
        }
        return Money.of(balances.get(0));
    }

    /**
     * Applies the posting relative to the stored balance, guarded so a debit can never
     * take it below zero, then reads back the resulting balance.
     */
    private BigDecimal updateBalance(UUID workerId, TransactionKind kind, BigDecimal amount, BigDecimal lockedBalance) {
        int updated;
        if (kind.isDebit()) {
            updated = jdbcTemplate.update(
                "UPDATE workers SET advance_balance = advance_balance - ?, " +
                "total_advance_repaid = total_advance_repaid + ?, updated_at = CURRENT_TIMESTAMP " +
                "WHERE id = ? AND advance_balance >= ?",
                amount, amount, workerId, amount
            );
        } else {
            updated = jdbcTemplate.update(
                "UPDATE workers SET advance_balance = advance_balance + ?, " +
                "total_advance_taken = total_advance_taken + ?, updated_at = CURRENT_TIMESTAMP " +
                "WHERE id = ?",
                amount, amount, workerId
            );
        }
        if (updated == 0) {
            metrics.recordTransaction(kind.name(), "insufficient_balance");
            throw new InsufficientBalanceException(workerId, lockedBalance, amount);
        }
        BigDecimal newBalance = jdbcTemplate.queryForObject(
            "SELECT advance_balance FROM workers WHERE id = ?",
            BigDecimal.class,
            workerId
        );
        return Money.of(newBalance);
    }

    private RowMapper<LedgerTransaction> transactionRowMapper() {
        return (rs, rowNum) -> new LedgerTransaction(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("worker_id")),
            TransactionKind.valueOf(rs.getString("kind")),
            Money.of(rs.getBigDecimal("amount")),
            rs.getObject("txn_date", LocalDate.class),
            Money.of(rs.getBigDecimal("balance_after")),
            rs.getString("notes"),
            rs.getLong("sequence_number"),
            toInstant(rs.getObject("created_at", OffsetDateTime.class))
        );
    }

    private static Instant toInstant(OffsetDateTime timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
