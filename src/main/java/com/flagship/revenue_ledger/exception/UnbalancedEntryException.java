package com.flagship.revenue_ledger.exception;

import java.util.Map;

/**
 * Thrown when posting a journal entry whose debits and credits differ.
 */
public class UnbalancedEntryException extends RevenueLedgerException {

    public UnbalancedEntryException(String message) {
        super(ErrorKind.UNBALANCED_ENTRY, message, Map.of());
    }

    public UnbalancedEntryException(String message, Map<String, ?> entityIds) {
        super(ErrorKind.UNBALANCED_ENTRY, message, entityIds);
    }
}
