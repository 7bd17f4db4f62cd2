package com.nosota.welfare.api.model;

/**
 * Lifecycle of a single installment of a recurring payment schedule.
 *
 * <p>Happy path: {@code SCHEDULED → DUE → OVERDUE → COMPLETED}, with {@code PROCESSING}
 * as an optional transient state. {@code FAILED}, {@code SKIPPED} and {@code CANCELLED}
 * are alternate final states.
 */
public enum RecurringPaymentStatus {
    /**
     * Created by schedule generation, due date not yet close.
     */
    SCHEDULED,

    /**
     * Due date falls inside the look-ahead window.
     */
    DUE,

    /**
     * Due date has passed without the installment being paid.
     */
    OVERDUE,

    /**
     * Disbursement in progress.
     */
    PROCESSING,

    /**
     * Paid. Amount and dates are frozen from here on.
     */
    COMPLETED,

    FAILED,

    SKIPPED,

    /**
     * Cancelled with a reason. The record is kept for the audit trail.
     */
    CANCELLED
}
