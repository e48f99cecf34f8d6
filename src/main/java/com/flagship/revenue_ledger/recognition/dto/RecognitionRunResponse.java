package com.flagship.revenue_ledger.recognition.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.exception.ErrorKind;
import com.flagship.revenue_ledger.recognition.RecognitionRunResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class RecognitionRunResponse {

    @JsonProperty("organization_id")
    UUID organizationId;

    @JsonProperty("contract_id")
    UUID contractId;

    @JsonProperty("as_of_date")
    LocalDate asOfDate;

    @JsonProperty("dry_run")
    boolean dryRun;

    @JsonProperty("lines_processed")
    int linesProcessed;

    @JsonProperty("lines_posted")
    int linesPosted;

    @JsonProperty("lines_failed")
    int linesFailed;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("journal_entry_ids")
    List<UUID> journalEntryIds;

    @JsonProperty("lines")
    List<Line> lines;

    public static RecognitionRunResponse from(RecognitionRunResult result) {
        return RecognitionRunResponse.builder()
            .organizationId(result.getOrganizationId())
            .contractId(result.getContractId())
            .asOfDate(result.getAsOfDate())
            .dryRun(result.isDryRun())
            .linesProcessed(result.getLinesProcessed())
            .linesPosted(result.getLinesPosted())
            .linesFailed(result.getLinesFailed())
            .totalAmount(result.getTotalAmount())
            .journalEntryIds(result.getJournalEntryIds())
            .lines(result.getLineResults().stream().map(Line::from).toList())
            .build();
    }

    @Value
    @Builder
    public static class Line {

        @JsonProperty("schedule_line_id")
        UUID scheduleLineId;

        @JsonProperty("contract_id")
        UUID contractId;

        @JsonProperty("contract_line_id")
        UUID contractLineId;

        @JsonProperty("schedule_date")
        LocalDate scheduleDate;

        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("outcome")
        RecognitionRunResult.LineOutcome outcome;

        @JsonProperty("journal_entry_id")
        UUID journalEntryId;

        @JsonProperty("error")
        ErrorKind error;

        @JsonProperty("message")
        String message;

        static Line from(RecognitionRunResult.LineResult result) {
            return Line.builder()
                .scheduleLineId(result.getScheduleLineId())
                .contractId(result.getContractId())
                .contractLineId(result.getContractLineId())
                .scheduleDate(result.getScheduleDate())
                .amount(result.getAmount())
                .outcome(result.getOutcome())
                .journalEntryId(result.getJournalEntryId())
                .error(result.getErrorKind())
                .message(result.getMessage())
                .build();
        }
    }
}
