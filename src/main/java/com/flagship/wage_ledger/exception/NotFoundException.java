package com.flagship.wage_ledger.exception;

import java.util.UUID;

/**
 * Unknown worker, draft, entry or settlement record.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String what, UUID id) {
        return new NotFoundException(what + " not found: " + id);
    }
}
