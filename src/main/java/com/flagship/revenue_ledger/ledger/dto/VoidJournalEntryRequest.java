package com.flagship.revenue_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class VoidJournalEntryRequest {

    @NotBlank(message = "Void reason is required")
    @JsonProperty("reason")
    String reason;
}
