package com.flagship.wage_ledger.attendance;

public enum AttendanceStatus {
    PRESENT,
    ABSENT,
    HOLIDAY,
    HALF_DAY
}
