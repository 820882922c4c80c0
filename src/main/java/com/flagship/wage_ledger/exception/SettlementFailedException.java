package com.flagship.wage_ledger.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * A settlement finalize aborted at one worker. The whole batch has been rolled back;
 * {@link #getWorkerId()} names the worker whose ledger posting failed.
 */
@Getter
public class SettlementFailedException extends RuntimeException {

    private final UUID workerId;
    private final String workerCode;

    public SettlementFailedException(UUID workerId, String workerCode, RuntimeException cause) {
        super(String.format("Settlement aborted at worker %s (%s): %s",
                workerCode, workerId, cause.getMessage()), cause);
        this.workerId = workerId;
        this.workerCode = workerCode;
    }

    /**
     * Short name of the underlying failure, e.g. {@code InsufficientBalance}.
     */
    public String getReason() {
        String name = getCause().getClass().getSimpleName();
        return name.endsWith("Exception") ? name.substring(0, name.length() - "Exception".length()) : name;
    }
}
