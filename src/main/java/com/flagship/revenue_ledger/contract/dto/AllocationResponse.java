package com.flagship.revenue_ledger.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.contract.AllocationResult;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
public class AllocationResponse {

    @JsonProperty("contract_id")
    UUID contractId;

    @JsonProperty("total_transaction_price")
    BigDecimal totalTransactionPrice;

    @JsonProperty("allocation_count")
    int allocationCount;

    @JsonProperty("allocations")
    List<Line> allocations;

    public static AllocationResponse from(AllocationResult result) {
        return new AllocationResponse(result.getContractId(), result.getTotalTransactionPrice(),
            result.getAllocationCount(),
            result.getAllocations().stream()
                .map(a -> new Line(a.getContractLineId(), a.getSspAmount(), a.getAllocatedTransactionPrice()))
                .toList());
    }

    @Value
    public static class Line {

        @JsonProperty("contract_line_id")
        UUID contractLineId;

        @JsonProperty("ssp_amount")
        BigDecimal sspAmount;

        @JsonProperty("allocated_transaction_price")
        BigDecimal allocatedTransactionPrice;
    }
}
