package com.flagship.wage_ledger.compensation.bonus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BonusDraftRepository extends JpaRepository<BonusDraftEntity, UUID> {

    Optional<BonusDraftEntity> findByWorkerIdAndPeriodStartAndPeriodEnd(UUID workerId, LocalDate periodStart,
                                                                         LocalDate periodEnd);

    List<BonusDraftEntity> findByPeriodStartAndPeriodEnd(LocalDate periodStart, LocalDate periodEnd);
}
