package com.flagship.wage_ledger.attendance;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for attendance entries. The (worker_id, entry_date) unique constraint is
 * what keeps a worker to one entry per day, including under concurrent upserts.
 */
@Entity
@Table(name = "attendance_entries",
       uniqueConstraints = @UniqueConstraint(name = "uk_attendance_worker_date",
                                             columnNames = {"worker_id", "entry_date"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AttendanceEntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "worker_id", nullable = false, updatable = false)
    private UUID workerId;

    @Column(name = "entry_date", nullable = false, updatable = false)
    private LocalDate date;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AttendanceStatus status;

    @Column(name = "hours_worked", nullable = false, precision = 5, scale = 2)
    private BigDecimal hoursWorked;

    @Column(name = "total_pay", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalPay;

    @Column(length = 500)
    private String notes;

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

    static AttendanceEntryEntity create(UUID workerId, LocalDate date, AttendanceStatus status,
                                        BigDecimal hoursWorked, BigDecimal totalPay, String notes) {
        return new AttendanceEntryEntity(UUID.randomUUID(), workerId, date, status,
                hoursWorked, totalPay, notes, null, null);
    }

    void record(AttendanceStatus status, BigDecimal hoursWorked, BigDecimal totalPay, String notes) {
        this.status = status;
        this.hoursWorked = hoursWorked;
        this.totalPay = totalPay;
        this.notes = notes;
    }

    public AttendanceEntry toDomain() {
        return new AttendanceEntry(id, workerId, date, status, hoursWorked, totalPay, notes, createdAt, updatedAt);
    }
}
