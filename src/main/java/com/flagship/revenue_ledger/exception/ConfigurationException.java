package com.flagship.revenue_ledger.exception;

import java.util.Map;

/**
 * Thrown when required setup is missing, such as the revenue or deferred-revenue account of a contract line.
 */
public class ConfigurationException extends RevenueLedgerException {

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message, Map.of());
    }

    public ConfigurationException(String message, Map<String, ?> entityIds) {
        super(ErrorKind.CONFIGURATION, message, entityIds);
    }
}
