package com.flagship.revenue_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.ledger.JournalLineDraft;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class JournalLineRequest {

    @NotNull(message = "Account ID is required")
    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("debit")
    BigDecimal debit;

    @JsonProperty("credit")
    BigDecimal credit;

    @JsonProperty("description")
    String description;

    @JsonProperty("department")
    String department;

    @JsonProperty("project")
    String project;

    @JsonProperty("classification")
    String classification;

    @JsonProperty("location")
    String location;

    public JournalLineDraft toDraft() {
        return JournalLineDraft.builder()
            .accountId(accountId)
            .debit(debit)
            .credit(credit)
            .description(description)
            .department(department)
            .project(project)
            .classification(classification)
            .location(location)
            .build();
    }
}
