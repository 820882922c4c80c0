package com.flagship.wage_ledger.attendance;

import com.flagship.wage_ledger.attendance.dto.AttendanceEntryResponse;
import com.flagship.wage_ledger.attendance.dto.AttendanceTotalsResponse;
import com.flagship.wage_ledger.attendance.dto.UpsertAttendanceRequest;
import com.flagship.wage_ledger.common.Period;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/attendance")
@RequiredArgsConstructor
public class AttendanceController {

    private final AttendanceService attendanceService;

    @PutMapping
    public AttendanceEntryResponse upsert(@Valid @RequestBody UpsertAttendanceRequest request) {
        AttendanceEntry entry = attendanceService.upsert(
            request.getWorkerId(),
            request.getDate(),
            request.getStatus(),
            request.getHoursWorked(),
            request.getNotes()
        );
        return AttendanceEntryResponse.from(entry);
    }

    @GetMapping
    public List<AttendanceEntryResponse> listEntries(
            @RequestParam(name = "worker_id", required = false) UUID workerId,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return attendanceService.listEntries(workerId, from, to).stream()
            .map(AttendanceEntryResponse::from)
            .toList();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteEntry(@PathVariable("id") UUID id) {
        attendanceService.deleteEntry(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/totals")
    public List<AttendanceTotalsResponse> totals(
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(name = "worker_id", required = false) UUID workerId) {
        return attendanceService.aggregate(Period.of(start, end), workerId).values().stream()
            .map(AttendanceTotalsResponse::from)
            .toList();
    }
}
