package com.flagship.revenue_ledger.recognition;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

/**
 * Revenue per calendar month. Planned amounts are still deferred, so
 * {@code deferred} always equals {@code planned}; posted amounts have been
 * recognized.
 */
@Value
public class WaterfallReport {
    UUID organizationId;
    LocalDate fromDate;
    LocalDate toDate;
    List<Period> periods;
    BigDecimal totalPlanned;
    BigDecimal totalPosted;
    BigDecimal totalDeferred;

    @Value
    public static class Period {
        YearMonth month;
        BigDecimal planned;
        BigDecimal posted;
        BigDecimal deferred;
        int lineCount;
    }
}
