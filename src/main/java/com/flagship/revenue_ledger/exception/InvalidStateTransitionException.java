package com.flagship.revenue_ledger.exception;

import java.util.Map;

/**
 * Thrown when an operation is not legal from the current status.
 */
public class InvalidStateTransitionException extends RevenueLedgerException {

    public InvalidStateTransitionException(String message) {
        super(ErrorKind.INVALID_STATE_TRANSITION, message, Map.of());
    }

    public InvalidStateTransitionException(String message, Map<String, ?> entityIds) {
        super(ErrorKind.INVALID_STATE_TRANSITION, message, entityIds);
    }
}
