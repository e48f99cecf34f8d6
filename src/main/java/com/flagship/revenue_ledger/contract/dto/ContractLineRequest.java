package com.flagship.revenue_ledger.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.contract.ContractLineDraft;
import com.flagship.revenue_ledger.contract.RecognitionPattern;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class ContractLineRequest {

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    String description;

    @JsonProperty("product_type")
    String productType;

    @NotNull(message = "Recognition pattern is required")
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

    @NotNull(message = "SSP amount is required")
    @DecimalMin(value = "0.00", message = "SSP amount must not be negative")
    @JsonProperty("ssp_amount")
    BigDecimal sspAmount;

    @JsonProperty("revenue_account_id")
    UUID revenueAccountId;

    @JsonProperty("deferred_revenue_account_id")
    UUID deferredRevenueAccountId;

    public ContractLineDraft toDraft() {
        return ContractLineDraft.builder()
            .description(description)
            .productType(productType)
            .recognitionPattern(recognitionPattern)
            .startDate(startDate)
            .endDate(endDate)
            .quantity(quantity)
            .unitPrice(unitPrice)
            .sspAmount(sspAmount)
            .revenueAccountId(revenueAccountId)
            .deferredRevenueAccountId(deferredRevenueAccountId)
            .build();
    }
}
