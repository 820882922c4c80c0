package com.flagship.wage_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class WorkerBalance {
    UUID workerId;
    String workerCode;
    String workerName;
    BigDecimal advanceBalance;
    BigDecimal totalAdvanceTaken;
    BigDecimal totalAdvanceRepaid;
}
