package com.flagship.revenue_ledger.recognition.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.recognition.RecognitionPostingResult;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class RecognitionPostingResponse {

    @JsonProperty("schedule_line_id")
    UUID scheduleLineId;

    @JsonProperty("outcome")
    RecognitionPostingResult.Outcome outcome;

    @JsonProperty("journal_entry_id")
    UUID journalEntryId;

    @JsonProperty("entry_number")
    String entryNumber;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("posted_at")
    LocalDate postedAt;

    public static RecognitionPostingResponse from(RecognitionPostingResult result) {
        return new RecognitionPostingResponse(result.getScheduleLineId(), result.getOutcome(),
            result.getJournalEntryId(), result.getEntryNumber(), result.getAmount(), result.getPostedAt());
    }
}
