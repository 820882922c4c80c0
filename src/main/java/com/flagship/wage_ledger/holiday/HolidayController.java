package com.flagship.wage_ledger.holiday;

import com.flagship.wage_ledger.holiday.dto.HolidayRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/holidays")
@RequiredArgsConstructor
public class HolidayController {

    private final HolidayService holidayService;

    @PostMapping
    public ResponseEntity<Holiday> upsertHoliday(@Valid @RequestBody HolidayRequest request) {
        Holiday holiday = holidayService.upsertHoliday(request.getDate(), request.getName(), request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(holiday);
    }

    @GetMapping
    public List<Holiday> listHolidays(@RequestParam(name = "year", required = false) Integer year) {
        return holidayService.listHolidays(year);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteHoliday(@PathVariable("id") UUID id) {
        holidayService.deleteHoliday(id);
        return ResponseEntity.noContent().build();
    }
}
