package com.flagship.revenue_ledger.recognition.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.schedule.DueScheduleLine;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class DueLineResponse {

    @JsonProperty("schedule_line_id")
    UUID scheduleLineId;

    @JsonProperty("schedule_id")
    UUID scheduleId;

    @JsonProperty("contract_line_id")
    UUID contractLineId;

    @JsonProperty("contract_id")
    UUID contractId;

    @JsonProperty("schedule_date")
    LocalDate scheduleDate;

    @JsonProperty("amount")
    BigDecimal amount;

    public static DueLineResponse from(DueScheduleLine line) {
        return new DueLineResponse(line.getScheduleLineId(), line.getScheduleId(), line.getContractLineId(),
            line.getContractId(), line.getScheduleDate(), line.getAmount());
    }
}
