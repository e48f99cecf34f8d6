package com.flagship.revenue_ledger.schedule;

import lombok.Value;

import java.time.LocalDate;

/**
 * Reporting window of one schedule line and the date its revenue is due.
 */
@Value
public class RecognitionPeriod {
    LocalDate periodStart;
    LocalDate periodEnd;
    LocalDate recognitionDate;
}
