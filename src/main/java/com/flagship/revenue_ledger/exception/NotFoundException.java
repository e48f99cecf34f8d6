package com.flagship.revenue_ledger.exception;

import java.util.Map;

public class NotFoundException extends RevenueLedgerException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message, Map.of());
    }

    public NotFoundException(String message, Map<String, ?> entityIds) {
        super(ErrorKind.NOT_FOUND, message, entityIds);
    }
}
