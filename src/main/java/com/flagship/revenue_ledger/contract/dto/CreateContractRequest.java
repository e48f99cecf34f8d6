package com.flagship.revenue_ledger.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class CreateContractRequest {

    @NotNull(message = "Organization ID is required")
    @JsonProperty("organization_id")
    UUID organizationId;

    @NotBlank(message = "Reference is required")
    @JsonProperty("reference")
    String reference;

    @NotNull(message = "Total transaction price is required")
    @DecimalMin(value = "0.01", message = "Total transaction price must be greater than 0")
    @JsonProperty("total_transaction_price")
    BigDecimal totalTransactionPrice;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @NotNull(message = "Start date is required")
    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @Valid
    @JsonProperty("lines")
    List<ContractLineRequest> lines;
}
