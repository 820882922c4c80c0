package com.flagship.wage_ledger.holiday;

import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

@Value
public class Holiday {
    UUID id;
    LocalDate date;
    String name;
    String description;
}
