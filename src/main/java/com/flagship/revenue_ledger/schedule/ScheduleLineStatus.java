package com.flagship.revenue_ledger.schedule;

/**
 * Status of a single dated recognition entry. {@code PLANNED -> POSTED} happens exactly once.
 */
public enum ScheduleLineStatus {
    PLANNED,
    POSTED,
    CANCELLED;

    public boolean isSettled() {
        return switch (this) {
            case POSTED, CANCELLED -> true;
            case PLANNED -> false;
        };
    }
}
