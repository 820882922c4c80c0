package com.flagship.wage_ledger.exception;

/**
 * Uniqueness violation or an operation against a record in the wrong state
 * (duplicate worker code, concurrent attendance upsert, adjusting a finalized draft).
 */
public class ConflictException extends IllegalStateException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
