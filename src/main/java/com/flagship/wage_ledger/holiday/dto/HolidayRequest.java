package com.flagship.wage_ledger.holiday.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.LocalDate;

@Value
public class HolidayRequest {

    @NotNull(message = "Date is required")
    @JsonProperty("date")
    LocalDate date;

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;
}
