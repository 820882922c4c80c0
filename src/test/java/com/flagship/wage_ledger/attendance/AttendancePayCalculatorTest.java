package com.flagship.wage_ledger.attendance;

import com.flagship.wage_ledger.attendance.AttendancePayCalculator.DayPay;
import com.flagship.wage_ledger.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AttendancePayCalculatorTest {

    private static final BigDecimal STANDARD_DAY = new BigDecimal("8");
    private static final BigDecimal RATE = new BigDecimal("100");

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
            "Expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("Present day defaults to the standard hours")
    void testPresentDefaultsToStandardDay() {
        DayPay day = AttendancePayCalculator.dayPay(AttendanceStatus.PRESENT, null, STANDARD_DAY, RATE);
        assertAmount("8", day.getHours());
        assertAmount("800", day.getPay());
    }

    @Test
    @DisplayName("Present day pays the supplied hours")
    void testPresentWithHours() {
        DayPay day = AttendancePayCalculator.dayPay(AttendanceStatus.PRESENT, new BigDecimal("6.5"), STANDARD_DAY, RATE);
        assertAmount("6.5", day.getHours());
        assertAmount("650", day.getPay());
    }

    @Test
    @DisplayName("Half day is half the standard day regardless of supplied hours")
    void testHalfDay() {
        DayPay day = AttendancePayCalculator.dayPay(AttendanceStatus.HALF_DAY, new BigDecimal("7"), STANDARD_DAY, RATE);
        assertAmount("4", day.getHours());
        assertAmount("400", day.getPay());
    }

    @Test
    @DisplayName("Absent day stores zero hours and zero pay")
    void testAbsent() {
        DayPay day = AttendancePayCalculator.dayPay(AttendanceStatus.ABSENT, new BigDecimal("5"), STANDARD_DAY, RATE);
        assertAmount("0", day.getHours());
        assertAmount("0", day.getPay());
    }

    @Test
    @DisplayName("Hours outside [0, 24] are rejected")
    void testHoursOutOfRange() {
        assertThrows(ValidationException.class, () ->
            AttendancePayCalculator.dayPay(AttendanceStatus.PRESENT, new BigDecimal("24.5"), STANDARD_DAY, RATE));
        assertThrows(ValidationException.class, () ->
            AttendancePayCalculator.dayPay(AttendanceStatus.PRESENT, new BigDecimal("-1"), STANDARD_DAY, RATE));
    }

    @Test
    @DisplayName("Zero-hour holiday counts as a full standard day in totals")
    void testZeroHourHolidayReadsAsFullDay() {
        AttendanceEntry holiday = new AttendanceEntry(UUID.randomUUID(), UUID.randomUUID(), LocalDate.of(2024, 1, 26),
            AttendanceStatus.HOLIDAY, new BigDecimal("0.00"), new BigDecimal("0.00"), null, null, null);

        DayPay day = AttendancePayCalculator.effectiveDayPay(holiday, STANDARD_DAY, RATE);

        assertAmount("8", day.getHours());
        assertAmount("800", day.getPay());
    }

    @Test
    @DisplayName("Worked holiday counts as stored")
    void testWorkedHolidayCountsAsStored() {
        AttendanceEntry holiday = new AttendanceEntry(UUID.randomUUID(), UUID.randomUUID(), LocalDate.of(2024, 1, 26),
            AttendanceStatus.HOLIDAY, new BigDecimal("3.00"), new BigDecimal("300.00"), null, null, null);

        DayPay day = AttendancePayCalculator.effectiveDayPay(holiday, STANDARD_DAY, RATE);

        assertAmount("3", day.getHours());
        assertAmount("300", day.getPay());
    }
}
