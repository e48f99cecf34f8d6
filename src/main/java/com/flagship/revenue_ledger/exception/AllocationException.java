package com.flagship.revenue_ledger.exception;

import java.util.Map;

/**
 * Thrown when a contract price cannot be allocated across its lines.
 */
public class AllocationException extends RevenueLedgerException {

    public AllocationException(String message) {
        super(ErrorKind.ALLOCATION, message, Map.of());
    }

    public AllocationException(String message, Map<String, ?> entityIds) {
        super(ErrorKind.ALLOCATION, message, entityIds);
    }
}
