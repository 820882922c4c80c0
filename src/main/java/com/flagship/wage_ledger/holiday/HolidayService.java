package com.flagship.wage_ledger.holiday;

import com.flagship.wage_ledger.exception.NotFoundException;
import com.flagship.wage_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Holiday calendar. One holiday per calendar day; the attendance aggregator
 * consults it only to choose a default status.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HolidayService {

    private final HolidayRepository holidayRepository;

    /**
     * Creates the holiday for {@code date}, or renames the existing one.
     */
    @Transactional
    public Holiday upsertHoliday(LocalDate date, String name, String description) {
        if (date == null) {
            throw new ValidationException("Holiday date is required");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("Holiday name is required");
        }

        HolidayEntity entity = holidayRepository.findByDate(date)
            .map(existing -> {
                existing.rename(name.trim(), description);
                return existing;
            })
            .orElseGet(() -> HolidayEntity.create(date, name.trim(), description));

        Holiday saved = holidayRepository.save(entity).toDomain();
        log.info("Holiday {} on {}", saved.getName(), saved.getDate());
        return saved;
    }

    @Transactional
    public void deleteHoliday(UUID holidayId) {
        HolidayEntity entity = holidayRepository.findById(holidayId)
            .orElseThrow(() -> NotFoundException.of("Holiday", holidayId));
        holidayRepository.delete(entity);
        log.info("Deleted holiday on {}", entity.getDate());
    }

    @Transactional(readOnly = true)
    public List<Holiday> listHolidays(Integer year) {
        List<HolidayEntity> entities = year == null
            ? holidayRepository.findAllByOrderByDateAsc()
            : holidayRepository.findByDateBetweenOrderByDateAsc(
                LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
        return entities.stream().map(HolidayEntity::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public boolean isHoliday(LocalDate date) {
        return holidayRepository.existsByDate(date);
    }
}
