package com.flagship.revenue_ledger.recognition.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.recognition.WaterfallReport;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

@Value
public class WaterfallResponse {

    @JsonProperty("organization_id")
    UUID organizationId;

    @JsonProperty("from_date")
    LocalDate fromDate;

    @JsonProperty("to_date")
    LocalDate toDate;

    @JsonProperty("periods")
    List<Period> periods;

    @JsonProperty("total_planned")
    BigDecimal totalPlanned;

    @JsonProperty("total_posted")
    BigDecimal totalPosted;

    @JsonProperty("total_deferred")
    BigDecimal totalDeferred;

    public static WaterfallResponse from(WaterfallReport report) {
        return new WaterfallResponse(report.getOrganizationId(), report.getFromDate(), report.getToDate(),
            report.getPeriods().stream()
                .map(p -> new Period(p.getMonth(), p.getPlanned(), p.getPosted(), p.getDeferred(),
                    p.getLineCount()))
                .toList(),
            report.getTotalPlanned(), report.getTotalPosted(), report.getTotalDeferred());
    }

    @Value
    public static class Period {

        @JsonProperty("period")
        YearMonth period;

        @JsonProperty("planned_amount")
        BigDecimal planned;

        @JsonProperty("posted_amount")
        BigDecimal posted;

        @JsonProperty("deferred_amount")
        BigDecimal deferred;

        @JsonProperty("line_count")
        int lineCount;
    }
}
