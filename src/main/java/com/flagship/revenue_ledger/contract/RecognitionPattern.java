package com.flagship.revenue_ledger.contract;

/**
 * How a contract line's allocated price turns into revenue over time.
 */
public enum RecognitionPattern {
    /** Full amount recognized on a single date. */
    POINT_IN_TIME,
    /** Amount spread evenly over calendar months of the service period. */
    STRAIGHT_LINE
}
