package com.flagship.revenue_ledger.contract;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of allocating a contract's price.
 */
@Value
public class AllocationResult {
    UUID contractId;
    BigDecimal totalTransactionPrice;
    List<LineAllocation> allocations;

    public int getAllocationCount() {
        return allocations.size();
    }

    @Value
    public static class LineAllocation {
        UUID contractLineId;
        BigDecimal sspAmount;
        BigDecimal allocatedTransactionPrice;
    }
}
