package com.flagship.wage_ledger.holiday;

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

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "holidays")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class HolidayEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "holiday_date", nullable = false, unique = true, updatable = false)
    private LocalDate date;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 500)
    private String description;

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

    static HolidayEntity create(LocalDate date, String name, String description) {
        return new HolidayEntity(UUID.randomUUID(), date, name, description, null, null);
    }

    void rename(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public Holiday toDomain() {
        return new Holiday(id, date, name, description);
    }
}
