package com.flagship.revenue_ledger.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.contract.Contract;
import com.flagship.revenue_ledger.contract.ContractLine;
import com.flagship.revenue_ledger.contract.ContractLineStatus;
import com.flagship.revenue_ledger.contract.ContractStatus;
import com.flagship.revenue_ledger.contract.RecognitionPattern;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ContractResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("organization_id")
    UUID organizationId;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("total_transaction_price")
    BigDecimal totalTransactionPrice;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("status")
    ContractStatus status;

    @JsonProperty("lines")
    List<Line> lines;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ContractResponse from(Contract contract) {
        return ContractResponse.builder()
            .id(contract.getId())
            .organizationId(contract.getOrganizationId())
            .reference(contract.getReference())
            .totalTransactionPrice(contract.getTotalTransactionPrice())
            .currency(contract.getCurrency())
            .startDate(contract.getStartDate())
            .endDate(contract.getEndDate())
            .status(contract.getStatus())
            .lines(contract.getLines().stream().map(Line::from).toList())
            .createdAt(contract.getCreatedAt())
            .build();
    }

    @Value
    @Builder
    public static class Line {

        @JsonProperty("id")
        UUID id;

        @JsonProperty("sort_order")
        int sortOrder;

        @JsonProperty("description")
        String description;

        @JsonProperty("product_type")
        String productType;

        @JsonProperty("recognition_pattern")
        RecognitionPattern recognitionPattern;

        @JsonProperty("start_date")
        LocalDate startDate;

        @JsonProperty("end_date")
        LocalDate endDate;

        @JsonProperty("quantity")
        BigDecimal quantity;

        @JsonProperty("unit_price")
        BigDecimal unitPrice;

        @JsonProperty("ssp_amount")
        BigDecimal sspAmount;

        @JsonProperty("allocated_transaction_price")
        BigDecimal allocatedTransactionPrice;

        @JsonProperty("revenue_account_id")
        UUID revenueAccountId;

        @JsonProperty("deferred_revenue_account_id")
        UUID deferredRevenueAccountId;

        @JsonProperty("status")
        ContractLineStatus status;

        public static Line from(ContractLine line) {
            return Line.builder()
                .id(line.getId())
                .sortOrder(line.getSortOrder())
                .description(line.getDescription())
                .productType(line.getProductType())
                .recognitionPattern(line.getRecognitionPattern())
                .startDate(line.getStartDate())
                .endDate(line.getEndDate())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice())
                .sspAmount(line.getSspAmount())
                .allocatedTransactionPrice(line.getAllocatedTransactionPrice())
                .revenueAccountId(line.getRevenueAccountId())
                .deferredRevenueAccountId(line.getDeferredRevenueAccountId())
                .status(line.getStatus())
                .build();
        }
    }
}
