package com.flagship.wage_ledger.worker;

import com.flagship.wage_ledger.exception.ConflictException;
import com.flagship.wage_ledger.exception.NotFoundException;
import com.flagship.wage_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Worker directory: the identity, rate and active flag every other component reads.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkerService {

    private static final BigDecimal DEFAULT_DAILY_HOURS = new BigDecimal("8");

    private final WorkerRepository workerRepository;

    /**
     * Registers a worker with a zero advance balance.
     *
     * @throws ConflictException if the code is already taken
     */
    @Transactional
    public Worker createWorker(String code, String name, BigDecimal hourlyRate,
                               BigDecimal standardDailyHours, Boolean active) {
        if (code == null || code.isBlank()) {
            throw new ValidationException("Worker code is required");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("Worker name is required");
        }
        BigDecimal dailyHours = standardDailyHours != null ? standardDailyHours : DEFAULT_DAILY_HOURS;
        validateRates(hourlyRate, dailyHours);

        String trimmedCode = code.trim();
        if (workerRepository.existsByCode(trimmedCode)) {
            throw new ConflictException("Worker code already exists: " + trimmedCode);
        }

        WorkerEntity entity = WorkerEntity.create(trimmedCode, name.trim(), hourlyRate, dailyHours,
                active == null || active);
        try {
            WorkerEntity saved = workerRepository.saveAndFlush(entity);
            log.info("Created worker {} ({})", saved.getCode(), saved.getId());
            return saved.toDomain();
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Worker code already exists: " + trimmedCode, e);
        }
    }

    /**
     * Updates profile fields. Fields left null keep their current value.
     */
    @Transactional
    public Worker updateWorker(UUID workerId, String name, BigDecimal hourlyRate,
                               BigDecimal standardDailyHours, Boolean active) {
        WorkerEntity entity = workerRepository.findById(workerId)
            .orElseThrow(() -> NotFoundException.of("Worker", workerId));

        String newName = name != null && !name.isBlank() ? name.trim() : entity.getName();
        BigDecimal newRate = hourlyRate != null ? hourlyRate : entity.getHourlyRate();
        BigDecimal newHours = standardDailyHours != null ? standardDailyHours : entity.getStandardDailyHours();
        validateRates(newRate, newHours);

        entity.updateProfile(newName, newRate, newHours, active != null ? active : entity.isActive());
        WorkerEntity saved = workerRepository.save(entity);
        log.info("Updated worker {}", saved.getCode());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Worker getWorker(UUID workerId) {
        return workerRepository.findById(workerId)
            .map(WorkerEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of("Worker", workerId));
    }

    @Transactional(readOnly = true)
    public List<Worker> listWorkers(boolean activeOnly) {
        List<WorkerEntity> entities = activeOnly
            ? workerRepository.findByActiveTrueOrderByCodeAsc()
            : workerRepository.findAllByOrderByCodeAsc();
        return entities.stream().map(WorkerEntity::toDomain).toList();
    }

    /**
     * Workers by id; unknown ids are simply absent from the map.
     */
    @Transactional(readOnly = true)
    public Map<UUID, Worker> getWorkers(Collection<UUID> workerIds) {
        return workerRepository.findAllById(workerIds).stream()
            .map(WorkerEntity::toDomain)
            .collect(Collectors.toMap(Worker::getId, Function.identity()));
    }

    @Transactional(readOnly = true)
    public List<Worker> listActiveWorkers() {
        return listWorkers(true);
    }

    private void validateRates(BigDecimal hourlyRate, BigDecimal standardDailyHours) {
        if (hourlyRate == null || hourlyRate.signum() <= 0) {
            throw new ValidationException("Hourly rate must be greater than 0");
        }
        if (standardDailyHours.signum() <= 0 || standardDailyHours.compareTo(new BigDecimal("24")) > 0) {
            throw new ValidationException("Standard daily hours must be between 0 and 24");
        }
    }
}
