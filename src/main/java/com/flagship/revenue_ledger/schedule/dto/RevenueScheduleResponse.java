package com.flagship.revenue_ledger.schedule.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.contract.RecognitionPattern;
import com.flagship.revenue_ledger.schedule.RevenueSchedule;
import com.flagship.revenue_ledger.schedule.RevenueScheduleLine;
import com.flagship.revenue_ledger.schedule.ScheduleLineStatus;
import com.flagship.revenue_ledger.schedule.ScheduleStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class RevenueScheduleResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("contract_line_id")
    UUID contractLineId;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("recognition_method")
    RecognitionPattern recognitionMethod;

    @JsonProperty("status")
    ScheduleStatus status;

    @JsonProperty("recognized_amount")
    BigDecimal recognizedAmount;

    @JsonProperty("planned_amount")
    BigDecimal plannedAmount;

    @JsonProperty("deferred_amount")
    BigDecimal deferredAmount;

    @JsonProperty("lines")
    List<Line> lines;

    @JsonProperty("created_at")
    Instant createdAt;

    public static RevenueScheduleResponse from(RevenueSchedule schedule) {
        return RevenueScheduleResponse.builder()
            .id(schedule.getId())
            .contractLineId(schedule.getContractLineId())
            .totalAmount(schedule.getTotalAmount())
            .recognitionMethod(schedule.getRecognitionMethod())
            .status(schedule.getStatus())
            .recognizedAmount(schedule.recognizedAmount())
            .plannedAmount(schedule.plannedAmount())
            .deferredAmount(schedule.deferredAmount())
            .lines(schedule.getLines().stream().map(Line::from).toList())
            .createdAt(schedule.getCreatedAt())
            .build();
    }

    @Value
    @Builder
    public static class Line {

        @JsonProperty("id")
        UUID id;

        @JsonProperty("line_number")
        int lineNumber;

        @JsonProperty("schedule_date")
        LocalDate scheduleDate;

        @JsonProperty("period_start")
        LocalDate periodStart;

        @JsonProperty("period_end")
        LocalDate periodEnd;

        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("status")
        ScheduleLineStatus status;

        @JsonProperty("journal_entry_id")
        UUID journalEntryId;

        @JsonProperty("posted_at")
        LocalDate postedAt;

        @JsonProperty("posted_by")
        String postedBy;

        static Line from(RevenueScheduleLine line) {
            return Line.builder()
                .id(line.getId())
                .lineNumber(line.getLineNumber())
                .scheduleDate(line.getScheduleDate())
                .periodStart(line.getPeriodStart())
                .periodEnd(line.getPeriodEnd())
                .amount(line.getAmount())
                .status(line.getStatus())
                .journalEntryId(line.getJournalEntryId())
                .postedAt(line.getPostedAt())
                .postedBy(line.getPostedBy())
                .build();
        }
    }
}
