package com.flagship.revenue_ledger.schedule;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A planned schedule line that is due, with the ids of what owns it.
 */
@Value
public class DueScheduleLine {
    UUID scheduleLineId;
    UUID scheduleId;
    UUID contractLineId;
    UUID contractId;
    LocalDate scheduleDate;
    BigDecimal amount;
}
