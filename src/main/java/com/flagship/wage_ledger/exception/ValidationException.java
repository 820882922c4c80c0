package com.flagship.wage_ledger.exception;

/**
 * Input rejected before any mutation: missing or non-positive amount, malformed period, etc.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
