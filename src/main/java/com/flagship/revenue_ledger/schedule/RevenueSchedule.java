package com.flagship.revenue_ledger.schedule;

import com.flagship.revenue_ledger.common.Amounts;
import com.flagship.revenue_ledger.contract.RecognitionPattern;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Domain model for the recognition plan of one contract line.
 *
 * {@code totalAmount} is a copy of the line's allocated price at generation
 * time; the line amounts always sum to it exactly.
 */
@Value
@Builder(toBuilder = true)
public class RevenueSchedule {
    UUID id;
    UUID organizationId;
    UUID contractLineId;
    BigDecimal totalAmount;
    RecognitionPattern recognitionMethod;
    ScheduleStatus status;
    List<RevenueScheduleLine> lines;
    Instant createdAt;

    public boolean hasPostedLines() {
        return lines.stream().anyMatch(line -> line.getStatus() == ScheduleLineStatus.POSTED);
    }

    public BigDecimal lineTotal() {
        return lines.stream().map(RevenueScheduleLine::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /** Sum of posted lines. */
    public BigDecimal recognizedAmount() {
        return sumOf(ScheduleLineStatus.POSTED);
    }

    /** Sum of lines still waiting to be posted. */
    public BigDecimal plannedAmount() {
        return sumOf(ScheduleLineStatus.PLANNED);
    }

    /**
     * Total not yet recognized. Includes cancelled lines, which will never be.
     */
    public BigDecimal deferredAmount() {
        return totalAmount.subtract(recognizedAmount());
    }

    private BigDecimal sumOf(ScheduleLineStatus status) {
        return lines.stream()
            .filter(line -> line.getStatus() == status)
            .map(RevenueScheduleLine::getAmount)
            .reduce(Amounts.ZERO, BigDecimal::add);
    }

    /**
     * Replaces one line and re-derives the schedule status.
     */
    public RevenueSchedule withLine(RevenueScheduleLine updated) {
        List<RevenueScheduleLine> newLines = lines.stream()
            .map(line -> line.getId().equals(updated.getId()) ? updated : line)
            .toList();
        return toBuilder()
            .lines(newLines)
            .status(ScheduleStatus.derive(newLines.stream().map(RevenueScheduleLine::getStatus).toList()))
            .build();
    }

    public boolean hasPlannedLines() {
        return lines.stream().anyMatch(line -> line.getStatus() == ScheduleLineStatus.PLANNED);
    }

    /**
     * Cancels every planned line. Posted lines keep their journal entries.
     * A schedule with nothing left to plan is returned unchanged.
     */
    public RevenueSchedule cancel() {
        if (!hasPlannedLines()) {
            return this;
        }
        List<RevenueScheduleLine> newLines = lines.stream().map(RevenueScheduleLine::cancelIfPlanned).toList();
        return toBuilder().lines(newLines).status(ScheduleStatus.CANCELLED).build();
    }
}
