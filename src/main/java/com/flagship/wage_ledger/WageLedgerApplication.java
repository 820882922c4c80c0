package com.flagship.wage_ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Wage ledger service.
 *
 * Tracks attendance-based pay, a running cash-advance ledger per worker, and
 * bonus/salary settlements that post deposits and new advances to that ledger.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class WageLedgerApplication {

    public static void main(String[] args) {
        log.info("Starting wage ledger service");
        SpringApplication.run(WageLedgerApplication.class, args);
    }
}
