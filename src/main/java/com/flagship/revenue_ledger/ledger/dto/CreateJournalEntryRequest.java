package com.flagship.revenue_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class CreateJournalEntryRequest {

    @NotNull(message = "Organization ID is required")
    @JsonProperty("organization_id")
    UUID organizationId;

    @NotNull(message = "Entry date is required")
    @JsonProperty("entry_date")
    LocalDate entryDate;

    @JsonProperty("description")
    String description;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("source_type")
    String sourceType;

    @JsonProperty("source_id")
    UUID sourceId;

    @Valid
    @JsonProperty("lines")
    List<JournalLineRequest> lines;
}
