package com.flagship.wage_ledger.worker;

import com.flagship.wage_ledger.common.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the worker directory.
 *
 * The balance columns are written only by the ledger (through JDBC, under a row lock),
 * so they are mapped {@code updatable = false}: saving this entity can never
 * overwrite a balance the ledger has posted.
 */
@Entity
@Table(name = "workers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WorkerEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true, length = 64)
    private String code;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "hourly_rate", nullable = false, precision = 19, scale = 2)
    private BigDecimal hourlyRate;

    @Column(name = "standard_daily_hours", nullable = false, precision = 5, scale = 2)
    private BigDecimal standardDailyHours;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "advance_balance", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal advanceBalance;

    @Column(name = "total_advance_taken", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalAdvanceTaken;

    @Column(name = "total_advance_repaid", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalAdvanceRepaid;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * New worker with an empty ledger.
     */
    static WorkerEntity create(String code, String name, BigDecimal hourlyRate,
                               BigDecimal standardDailyHours, boolean active) {
        return new WorkerEntity(
            UUID.randomUUID(),
            code,
            name,
            hourlyRate,
            standardDailyHours,
            active,
            Money.zero(),
            Money.zero(),
            Money.zero(),
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    /**
     * Directory fields only. Balance and lifetime totals belong to the ledger.
     */
    void updateProfile(String name, BigDecimal hourlyRate, BigDecimal standardDailyHours, boolean active) {
        this.name = name;
        this.hourlyRate = hourlyRate;
        this.standardDailyHours = standardDailyHours;
        this.active = active;
    }

    public Worker toDomain() {
        return new Worker(
            id,
            code,
            name,
            hourlyRate,
            standardDailyHours,
            active,
            advanceBalance,
            totalAdvanceTaken,
            totalAdvanceRepaid,
            createdAt,
            updatedAt
        );
    }
}
