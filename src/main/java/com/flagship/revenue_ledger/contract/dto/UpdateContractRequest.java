package com.flagship.revenue_ledger.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial header update; null fields are left unchanged.
 */
@Value
@Builder
@Jacksonized
public class UpdateContractRequest {

    @JsonProperty("reference")
    String reference;

    @DecimalMin(value = "0.01", message = "Total transaction price must be greater than 0")
    @JsonProperty("total_transaction_price")
    BigDecimal totalTransactionPrice;

    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;
}
