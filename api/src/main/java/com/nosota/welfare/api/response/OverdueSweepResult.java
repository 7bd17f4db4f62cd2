package com.nosota.welfare.api.response;

/**
 * Outcome of one overdue sweep.
 *
 * @param updatedCount Total installments whose status changed
 * @param overdueCount Installments promoted to OVERDUE
 * @param dueCount     Installments promoted to DUE
 */
public record OverdueSweepResult(
        int updatedCount,
        int overdueCount,
        int dueCount
) {
}
