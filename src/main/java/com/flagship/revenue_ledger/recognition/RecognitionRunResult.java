package com.flagship.revenue_ledger.recognition;

import com.flagship.revenue_ledger.exception.ErrorKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Summary of one recognition run, with a result per due schedule line.
 */
@Value
@Builder
public class RecognitionRunResult {
    UUID organizationId;
    UUID contractId;
    LocalDate asOfDate;
    boolean dryRun;
    int linesProcessed;
    int linesPosted;
    int linesFailed;
    BigDecimal totalAmount;
    List<UUID> journalEntryIds;
    List<LineResult> lineResults;

    public enum LineOutcome {
        WOULD_POST,
        POSTED,
        ALREADY_POSTED,
        FAILED
    }

    @Value
    @Builder
    public static class LineResult {
        UUID scheduleLineId;
        UUID contractId;
        UUID contractLineId;
        LocalDate scheduleDate;
        BigDecimal amount;
        LineOutcome outcome;
        UUID journalEntryId;
        ErrorKind errorKind;
        String message;
    }
}
