package com.flagship.wage_ledger.settlement;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Optional criteria for listing settlements. {@code from}/{@code to} bound the settled
 * period: a record matches when its period lies inside [from, to].
 */
@Value
@Builder
public class SettlementFilter {
    SettlementKind kind;
    LocalDate from;
    LocalDate to;
}
