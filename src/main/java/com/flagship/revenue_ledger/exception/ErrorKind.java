package com.flagship.revenue_ledger.exception;

/**
 * Closed taxonomy of engine failures.
 * Every {@link RevenueLedgerException} carries exactly one kind.
 */
public enum ErrorKind {
    /** Malformed input: zero total price, missing dates, bad amounts. */
    VALIDATION,
    /** Price cannot be allocated, e.g. a contract without lines. */
    ALLOCATION,
    /** Missing or unusable setup, e.g. no deferred-revenue account on a line. */
    CONFIGURATION,
    /** Debits and credits of an entry differ. */
    UNBALANCED_ENTRY,
    /** Operation is not legal from the entity's current status. */
    INVALID_STATE_TRANSITION,
    NOT_FOUND
}
