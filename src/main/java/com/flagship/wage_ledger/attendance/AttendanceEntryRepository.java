package com.flagship.wage_ledger.attendance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AttendanceEntryRepository extends JpaRepository<AttendanceEntryEntity, UUID> {

    Optional<AttendanceEntryEntity> findByWorkerIdAndDate(UUID workerId, LocalDate date);

    List<AttendanceEntryEntity> findByDateBetween(LocalDate from, LocalDate to);

    List<AttendanceEntryEntity> findByWorkerIdAndDateBetween(UUID workerId, LocalDate from, LocalDate to);

    List<AttendanceEntryEntity> findByDateBetweenOrderByDateDescCreatedAtDesc(LocalDate from, LocalDate to);

    List<AttendanceEntryEntity> findByWorkerIdAndDateBetweenOrderByDateDescCreatedAtDesc(
            UUID workerId, LocalDate from, LocalDate to);
}
