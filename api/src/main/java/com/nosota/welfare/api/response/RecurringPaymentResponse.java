package com.nosota.welfare.api.response;

import com.nosota.welfare.api.model.PaymentMethod;
import com.nosota.welfare.api.model.RecurringPaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Response DTO describing one installment of a recurring payment schedule.
 *
 * @param id                   Installment UUID
 * @param applicationId        Owning application
 * @param scheduleBatchId      Batch created by one schedule generation
 * @param paymentNumber        1-based position within the schedule
 * @param totalPayments        Number of installments in the schedule
 * @param cycleNumber          Recurrence cycle of this installment
 * @param totalCycles          Number of recurrence cycles
 * @param phaseNumber          Timeline phase of this installment (null without a timeline)
 * @param totalPhases          Number of timeline phases (null without a timeline)
 * @param scheduledDate        Planned disbursement date
 * @param dueDate              Date after which the installment is overdue
 * @param amount               Installment amount
 * @param currency             ISO 4217 currency code
 * @param status               Current status
 * @param paidAmount           Amount actually paid (null until completed)
 * @param paymentMethod        Method used (null until completed)
 * @param transactionReference Transfer reference (null until completed)
 * @param actualPaymentDate    Date the payment was made (null until completed)
 * @param processedAt          Timestamp of recording the payment
 * @param cancellationReason   Reason given on cancellation
 */
public record RecurringPaymentResponse(
        UUID id,
        UUID applicationId,
        UUID scheduleBatchId,
        UUID beneficiaryId,
        UUID schemeId,
        UUID projectId,
        Integer paymentNumber,
        Integer totalPayments,
        Integer cycleNumber,
        Integer totalCycles,
        Integer phaseNumber,
        Integer totalPhases,
        LocalDate scheduledDate,
        LocalDate dueDate,
        BigDecimal amount,
        String currency,
        String description,
        RecurringPaymentStatus status,
        BigDecimal paidAmount,
        PaymentMethod paymentMethod,
        String transactionReference,
        LocalDate actualPaymentDate,
        UUID processedBy,
        LocalDateTime processedAt,
        String notes,
        String cancellationReason,
        LocalDateTime cancelledAt
) {
}
