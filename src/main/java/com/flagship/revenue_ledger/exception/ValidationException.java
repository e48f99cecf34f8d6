package com.flagship.revenue_ledger.exception;

import java.util.Map;

/**
 * Thrown when input is malformed.
 */
public class ValidationException extends RevenueLedgerException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message, Map.of());
    }

    public ValidationException(String message, Map<String, ?> entityIds) {
        super(ErrorKind.VALIDATION, message, entityIds);
    }
}
