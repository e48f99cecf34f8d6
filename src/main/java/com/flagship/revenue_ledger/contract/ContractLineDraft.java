package com.flagship.revenue_ledger.contract;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Caller-supplied fields of a contract line, before ids, ordering and
 * allocation are assigned.
 */
@Value
@Builder
public class ContractLineDraft {
    String description;
    String productType;
    RecognitionPattern recognitionPattern;
    LocalDate startDate;
    LocalDate endDate;
    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal sspAmount;
    UUID revenueAccountId;
    UUID deferredRevenueAccountId;
}
