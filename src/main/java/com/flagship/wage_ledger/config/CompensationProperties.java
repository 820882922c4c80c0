package com.flagship.wage_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Tunables for the compensation engine, bound from {@code wage-ledger.compensation.*}.
 *
 * The base bonus is {@code bonusDays × bonusHoursPerDay × hourlyRate}; with the
 * defaults that is the fixed standard month of 30 days of 8 hours.
 */
@ConfigurationProperties(prefix = "wage-ledger.compensation")
@Getter
@Setter
public class CompensationProperties {

    private int bonusDays = 30;

    private int bonusHoursPerDay = 8;

    /**
     * Used when a bonus computation request does not name a deduction.
     */
    private BigDecimal defaultDeductionPerAbsentDay = BigDecimal.ZERO;

    /**
     * Whether absence penalties are relative to the least-absent active worker
     * when the request does not say.
     */
    private boolean thresholdRelativeByDefault = true;
}
