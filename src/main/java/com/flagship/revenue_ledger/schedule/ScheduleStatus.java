package com.flagship.revenue_ledger.schedule;

import java.util.Collection;

/**
 * Status of a revenue schedule. Derived from its lines, except for
 * {@link #CANCELLED} which follows contract cancellation.
 */
public enum ScheduleStatus {
    /** Nothing posted yet. */
    PLANNED,
    /** Some lines posted, some still planned. */
    IN_PROGRESS,
    /** Every line is posted or cancelled. */
    COMPLETED,
    CANCELLED;

    public static ScheduleStatus derive(Collection<ScheduleLineStatus> lineStatuses) {
        boolean anyPosted = lineStatuses.contains(ScheduleLineStatus.POSTED);
        boolean allSettled = lineStatuses.stream().allMatch(ScheduleLineStatus::isSettled);
        if (allSettled && anyPosted) {
            return COMPLETED;
        }
        return anyPosted ? IN_PROGRESS : PLANNED;
    }
}
