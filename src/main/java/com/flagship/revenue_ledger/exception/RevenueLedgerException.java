package com.flagship.revenue_ledger.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for all engine failures.
 *
 * Carries the error kind plus the ids of the offending entities so callers can
 * render a structured error without parsing messages. Database exceptions are
 * never wrapped in this type; they are handled separately and never leak.
 */
@Getter
public abstract class RevenueLedgerException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> entityIds;

    protected RevenueLedgerException(ErrorKind kind, String message, Map<String, ?> entityIds) {
        super(message);
        this.kind = kind;
        this.entityIds = entityIds == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(entityIds));
    }
}
