package com.flagship.revenue_ledger.recognition;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Outcome of posting one schedule line.
 */
@Value
public class RecognitionPostingResult {
    UUID scheduleLineId;
    Outcome outcome;
    UUID journalEntryId;
    String entryNumber;
    BigDecimal amount;
    LocalDate postedAt;

    public enum Outcome {
        /** A new journal entry was created by this call. */
        POSTED,
        /** The line had been posted before; nothing was written. */
        ALREADY_POSTED
    }
}
