package com.flagship.wage_ledger.settlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface SettlementHistoryRepository extends JpaRepository<SettlementHistoryEntity, UUID> {

    List<SettlementHistoryEntity> findByPeriodStartGreaterThanEqualAndPeriodEndLessThanEqualOrderBySavedAtDesc(
            LocalDate from, LocalDate to);

    List<SettlementHistoryEntity> findByKindAndPeriodStartGreaterThanEqualAndPeriodEndLessThanEqualOrderBySavedAtDesc(
            SettlementKind kind, LocalDate from, LocalDate to);
}
