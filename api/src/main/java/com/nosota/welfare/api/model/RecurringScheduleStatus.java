package com.nosota.welfare.api.model;

/**
 * Aggregate status of an application's recurring payment plan.
 */
public enum RecurringScheduleStatus {
    ACTIVE,
    PAUSED,
    COMPLETED,
    CANCELLED
}
