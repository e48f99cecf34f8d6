package com.flagship.revenue_ledger.contract;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Domain model for a performance obligation within a contract.
 *
 * {@code allocatedTransactionPrice} is null until the allocation engine runs.
 * {@code sortOrder} fixes the creation order; allocation relies on it to put
 * the rounding remainder on the same line every time.
 */
@Value
@Builder(toBuilder = true)
public class ContractLine {
    UUID id;
    UUID contractId;
    int sortOrder;
    String description;
    String productType;
    RecognitionPattern recognitionPattern;
    LocalDate startDate;
    LocalDate endDate;
    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal sspAmount;
    BigDecimal allocatedTransactionPrice;
    UUID revenueAccountId;
    UUID deferredRevenueAccountId;
    ContractLineStatus status;

    public boolean isAllocated() {
        return allocatedTransactionPrice != null;
    }

    public ContractLine withAllocatedTransactionPrice(BigDecimal allocated) {
        return toBuilder().allocatedTransactionPrice(allocated).build();
    }

    public ContractLine withStatus(ContractLineStatus newStatus) {
        return toBuilder().status(newStatus).build();
    }
}
