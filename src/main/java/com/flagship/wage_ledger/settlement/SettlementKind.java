package com.flagship.wage_ledger.settlement;

public enum SettlementKind {
    BONUS,
    SALARY
}
