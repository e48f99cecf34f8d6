package com.flagship.revenue_ledger.schedule;

import com.flagship.revenue_ledger.exception.InvalidStateTransitionException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * Domain model for one dated recognition entry of a schedule.
 */
@Value
@Builder(toBuilder = true)
public class RevenueScheduleLine {
    UUID id;
    UUID scheduleId;
    int lineNumber;
    LocalDate scheduleDate;
    LocalDate periodStart;
    LocalDate periodEnd;
    BigDecimal amount;
    ScheduleLineStatus status;
    UUID journalEntryId;
    LocalDate postedAt;
    String postedBy;

    /**
     * Planned to posted, stamping the journal entry that recognized it.
     *
     * @throws InvalidStateTransitionException if the line is not planned
     */
    public RevenueScheduleLine markPosted(UUID journalEntryId, LocalDate postedAt, String postedBy) {
        if (status != ScheduleLineStatus.PLANNED) {
            throw new InvalidStateTransitionException(
                String.format("Cannot post schedule line %s in %s status", id, status),
                Map.of("scheduleLineId", id));
        }
        return toBuilder()
            .status(ScheduleLineStatus.POSTED)
            .journalEntryId(journalEntryId)
            .postedAt(postedAt)
            .postedBy(postedBy)
            .build();
    }

    /** Planned lines become cancelled; posted and cancelled lines are returned unchanged. */
    public RevenueScheduleLine cancelIfPlanned() {
        return status == ScheduleLineStatus.PLANNED
            ? toBuilder().status(ScheduleLineStatus.CANCELLED).build()
            : this;
    }
}
