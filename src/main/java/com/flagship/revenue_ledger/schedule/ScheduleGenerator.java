package com.flagship.revenue_ledger.schedule;

import com.flagship.revenue_ledger.common.MoneyAllocator;
import com.flagship.revenue_ledger.contract.Contract;
import com.flagship.revenue_ledger.contract.ContractLine;
import com.flagship.revenue_ledger.exception.ConfigurationException;
import com.flagship.revenue_ledger.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds the revenue schedule of a contract line.
 *
 * Pure: no persistence, no clock. Two patterns are supported:
 * - point in time: one line for the full amount, dated at the line start
 *   (or the contract start when the line has none)
 * - straight line: one line per calendar month between start and end, each
 *   due on the last day of its period; the last period absorbs the rounding
 *   remainder
 *
 * A straight-line service period without an end date falls back to the
 * contract end, then to twelve months from the start.
 */
@Component
public class ScheduleGenerator {

    static final int DEFAULT_TERM_MONTHS = 12;

    /**
     * @throws ValidationException if the line has no allocated price or no start date can be found
     * @throws ConfigurationException if the date range yields no periods
     */
    public RevenueSchedule generate(Contract contract, ContractLine line) {
        if (!line.isAllocated()) {
            throw new ValidationException(
                "Contract line " + line.getId() + " has no allocated transaction price",
                Map.of("contractLineId", line.getId(), "contractId", contract.getId()));
        }
        LocalDate start = line.getStartDate() != null ? line.getStartDate() : contract.getStartDate();
        if (start == null) {
            throw new ValidationException(
                "Contract line " + line.getId() + " has no start date",
                Map.of("contractLineId", line.getId(), "contractId", contract.getId()));
        }

        List<RecognitionPeriod> periods = switch (line.getRecognitionPattern()) {
            case POINT_IN_TIME -> List.of(new RecognitionPeriod(start, start, start));
            case STRAIGHT_LINE -> monthlyPeriods(start, resolveEnd(contract, line, start));
        };
        if (periods.isEmpty()) {
            throw new ConfigurationException(
                "Service period of contract line " + line.getId() + " contains no recognition periods",
                Map.of("contractLineId", line.getId(), "contractId", contract.getId()));
        }

        BigDecimal total = line.getAllocatedTransactionPrice();
        List<BigDecimal> amounts = MoneyAllocator.splitEvenly(total, periods.size());

        UUID scheduleId = UUID.randomUUID();
        List<RevenueScheduleLine> lines = new ArrayList<>(periods.size());
        for (int i = 0; i < periods.size(); i++) {
            RecognitionPeriod period = periods.get(i);
            lines.add(RevenueScheduleLine.builder()
                .id(UUID.randomUUID())
                .scheduleId(scheduleId)
                .lineNumber(i + 1)
                .scheduleDate(period.getRecognitionDate())
                .periodStart(period.getPeriodStart())
                .periodEnd(period.getPeriodEnd())
                .amount(amounts.get(i))
                .status(ScheduleLineStatus.PLANNED)
                .build());
        }

        return RevenueSchedule.builder()
            .id(scheduleId)
            .organizationId(contract.getOrganizationId())
            .contractLineId(line.getId())
            .totalAmount(total)
            .recognitionMethod(line.getRecognitionPattern())
            .status(ScheduleStatus.PLANNED)
            .lines(List.copyOf(lines))
            .build();
    }

    /**
     * Calendar-month periods covering {@code [start, end]}. The first and last
     * periods are clipped to the range. Empty when {@code end} is before {@code start}.
     */
    public List<RecognitionPeriod> monthlyPeriods(LocalDate start, LocalDate end) {
        List<RecognitionPeriod> periods = new ArrayList<>();
        LocalDate cursor = start.withDayOfMonth(1);
        while (!cursor.isAfter(end)) {
            LocalDate periodStart = cursor.isBefore(start) ? start : cursor;
            LocalDate monthEnd = cursor.with(TemporalAdjusters.lastDayOfMonth());
            LocalDate periodEnd = monthEnd.isAfter(end) ? end : monthEnd;
            if (!periodStart.isAfter(periodEnd)) {
                periods.add(new RecognitionPeriod(periodStart, periodEnd, periodEnd));
            }
            cursor = cursor.plusMonths(1);
        }
        return periods;
    }

    private LocalDate resolveEnd(Contract contract, ContractLine line, LocalDate start) {
        if (line.getEndDate() != null) {
            return line.getEndDate();
        }
        if (contract.getEndDate() != null) {
            return contract.getEndDate();
        }
        return start.plusMonths(DEFAULT_TERM_MONTHS).minusDays(1);
    }
}
