package com.flagship.wage_ledger.holiday;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface HolidayRepository extends JpaRepository<HolidayEntity, UUID> {

    Optional<HolidayEntity> findByDate(LocalDate date);

    boolean existsByDate(LocalDate date);

    List<HolidayEntity> findByDateBetweenOrderByDateAsc(LocalDate from, LocalDate to);

    List<HolidayEntity> findAllByOrderByDateAsc();
}
