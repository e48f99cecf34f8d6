package com.flagship.revenue_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/**
 * Full replacement of a draft's header fields and lines.
 */
@Value
@Builder
@Jacksonized
public class UpdateJournalEntryRequest {

    @NotNull(message = "Entry date is required")
    @JsonProperty("entry_date")
    LocalDate entryDate;

    @JsonProperty("description")
    String description;

    @JsonProperty("reference")
    String reference;

    @Valid
    @JsonProperty("lines")
    List<JournalLineRequest> lines;
}
