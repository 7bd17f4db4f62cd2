package com.nosota.welfare.dto;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One installment computed from a schedule configuration, before it is persisted.
 *
 * @param paymentNumber 1-based position in the schedule
 * @param totalPayments Number of installments in the schedule
 * @param cycleNumber   Recurrence cycle (1-based)
 * @param totalCycles   Number of recurrence cycles
 * @param phaseNumber   Timeline phase (1-based), null without a timeline
 * @param totalPhases   Number of timeline phases, null without a timeline
 * @param scheduledDate Planned disbursement date
 * @param amount        Installment amount
 * @param description   Display description
 */
@Builder
public record ScheduledInstallment(
        int paymentNumber,
        int totalPayments,
        int cycleNumber,
        int totalCycles,
        Integer phaseNumber,
        Integer totalPhases,
        LocalDate scheduledDate,
        BigDecimal amount,
        String description
) {
}
