package com.flagship.wage_ledger.worker;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface WorkerRepository extends JpaRepository<WorkerEntity, UUID> {

    boolean existsByCode(String code);

    List<WorkerEntity> findAllByOrderByCodeAsc();

    List<WorkerEntity> findByActiveTrueOrderByCodeAsc();
}
