package com.flagship.revenue_ledger.recognition.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class RunRecognitionRequest {

    @NotNull(message = "Organization ID is required")
    @JsonProperty("organization_id")
    UUID organizationId;

    @JsonProperty("contract_id")
    UUID contractId;

    @NotNull(message = "As-of date is required")
    @JsonProperty("as_of_date")
    LocalDate asOfDate;

    @JsonProperty("dry_run")
    boolean dryRun;
}
